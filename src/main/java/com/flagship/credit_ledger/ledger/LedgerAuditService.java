package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Rebuilds balances from the append-only transaction log and reports any drift.
 *
 * With signed amounts (grant +a, reserve -a, commit -a, release +a):
 *   available = sum of GRANT, RESERVE and RELEASE amounts
 *   reserved  = -RESERVE + COMMIT - RELEASE
 *
 * Drift is never corrected automatically. It is logged at ERROR and counted so
 * someone can look at it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerAuditService {

    private static final String AUDIT_QUERY = """
        SELECT b.user_id, b.available, b.reserved,
               COALESCE(SUM(CASE WHEN t.kind IN ('GRANT', 'RESERVE', 'RELEASE') THEN t.amount ELSE 0 END), 0)
                   AS expected_available,
               COALESCE(SUM(CASE WHEN t.kind = 'RESERVE' THEN -t.amount
                                 WHEN t.kind = 'COMMIT' THEN t.amount
                                 WHEN t.kind = 'RELEASE' THEN -t.amount
                                 ELSE 0 END), 0)
                   AS expected_reserved
        FROM balances b
        LEFT JOIN transactions t ON t.user_id = b.user_id
        """;

    private final JdbcTemplate jdbcTemplate;
    private final CreditMetrics creditMetrics;

    /**
     * Audits one user. Users without a balance row are trivially consistent.
     */
    @Transactional(readOnly = true)
    public BalanceDrift auditUser(long userId) {
        List<BalanceDrift> rows = jdbcTemplate.query(
            AUDIT_QUERY + " WHERE b.user_id = ? GROUP BY b.user_id, b.available, b.reserved",
            driftRowMapper(),
            userId
        );

        if (rows.isEmpty()) {
            return new BalanceDrift(userId, 0, 0, 0, 0);
        }

        BalanceDrift drift = rows.get(0);
        if (!drift.isConsistent()) {
            report(drift);
        }
        return drift;
    }

    /**
     * Audits every balance and returns only the inconsistent ones.
     */
    @Transactional(readOnly = true)
    public List<BalanceDrift> auditAll() {
        log.info("Starting ledger audit");

        List<BalanceDrift> drifts = jdbcTemplate.query(
            AUDIT_QUERY + " GROUP BY b.user_id, b.available, b.reserved " +
            "HAVING b.available <> COALESCE(SUM(CASE WHEN t.kind IN ('GRANT', 'RESERVE', 'RELEASE') " +
            "THEN t.amount ELSE 0 END), 0) " +
            "OR b.reserved <> COALESCE(SUM(CASE WHEN t.kind = 'RESERVE' THEN -t.amount " +
            "WHEN t.kind = 'COMMIT' THEN t.amount WHEN t.kind = 'RELEASE' THEN -t.amount ELSE 0 END), 0)",
            driftRowMapper()
        );

        drifts.forEach(this::report);

        if (drifts.isEmpty()) {
            log.info("Ledger audit completed: all balances consistent");
        } else {
            log.warn("Ledger audit completed: {} balances drifted", drifts.size());
        }
        return drifts;
    }

    private void report(BalanceDrift drift) {
        creditMetrics.recordAuditDrift();
        log.error("Balance drift for user {}: available={} (expected {}), reserved={} (expected {})",
                drift.getUserId(),
                drift.getActualAvailable(), drift.getExpectedAvailable(),
                drift.getActualReserved(), drift.getExpectedReserved());
    }

    private RowMapper<BalanceDrift> driftRowMapper() {
        return (rs, rowNum) -> new BalanceDrift(
            rs.getLong("user_id"),
            rs.getLong("available"),
            rs.getLong("reserved"),
            rs.getLong("expected_available"),
            rs.getLong("expected_reserved")
        );
    }
}
