package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reserve/commit/release ledger over the balances and transactions tables.
 *
 * Every operation runs in one database transaction and holds the user's balance
 * row lock (SELECT ... FOR UPDATE) for its whole duration, so mutations for one
 * user are totally ordered no matter how many processes call in. Nothing in here
 * performs network I/O.
 *
 * Every operation is idempotent per (kind, reference id): if a transaction row
 * with the same pair exists, the recorded result is returned with
 * {@code duplicate=true} and nothing is mutated. The unique constraint on
 * (kind, reference_id) backs this up at the database level.
 *
 * Balances and transactions are written only from this class. JDBC is used
 * directly so the locking and the SQL stay explicit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditLedger {

    private static final String BALANCE_COLUMNS = "user_id, available, reserved, version, updated_at";
    private static final String TRANSACTION_COLUMNS =
            "id, user_id, kind, amount, balance_before, balance_after, available_after, reserved_after, " +
            "reference_id, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final CreditMetrics creditMetrics;

    /**
     * Adds credits to the user's available balance.
     *
     * @param referenceId topup id (or operator adjustment id) the credits are granted for
     * @throws IllegalArgumentException if amount is not positive
     */
    @Transactional
    public LedgerResult grant(long userId, long amount, UUID referenceId) {
        long startTime = System.currentTimeMillis();
        validate(amount, referenceId);

        Balance balance = lockOrCreateBalance(userId);

        Optional<LedgerResult> prior = findPriorResult(userId, TransactionKind.GRANT, amount, referenceId);
        if (prior.isPresent()) {
            return prior.get();
        }

        LedgerResult result = apply(balance, TransactionKind.GRANT, amount, referenceId,
                balance.getAvailable() + amount, balance.getReserved());
        creditMetrics.recordLedgerLatency(System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * Moves credits from available to reserved.
     *
     * @param referenceId generation id the credits are held for
     * @throws InsufficientCreditsException if available is lower than amount; nothing is mutated
     */
    @Transactional
    public LedgerResult reserve(long userId, long amount, UUID referenceId) {
        long startTime = System.currentTimeMillis();
        validate(amount, referenceId);

        Optional<Balance> locked = lockBalance(userId);

        Optional<LedgerResult> prior = findPriorResult(userId, TransactionKind.RESERVE, amount, referenceId);
        if (prior.isPresent()) {
            return prior.get();
        }

        Balance balance = locked.orElse(Balance.empty(userId));
        if (balance.getAvailable() < amount) {
            creditMetrics.recordLedgerOperation(TransactionKind.RESERVE.name(), "insufficient_credits");
            log.info("Reservation refused: userId={}, requested={}, available={}, referenceId={}",
                    userId, amount, balance.getAvailable(), referenceId);
            throw new InsufficientCreditsException(userId, amount, balance.getAvailable());
        }

        LedgerResult result = apply(balance, TransactionKind.RESERVE, amount, referenceId,
                balance.getAvailable() - amount, balance.getReserved() + amount);
        creditMetrics.recordLedgerLatency(System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * Finalizes a reservation as spent.
     *
     * @throws InvariantViolationException if there is no matching reservation, it was
     *         already released, the amount differs from the reservation, or reserved
     *         would go negative
     */
    @Transactional
    public LedgerResult commit(long userId, long amount, UUID referenceId) {
        return settle(TransactionKind.COMMIT, userId, amount, referenceId);
    }

    /**
     * Returns reserved credits to available.
     *
     * @throws InvariantViolationException if there is no matching reservation, it was
     *         already committed, the amount differs from the reservation, or reserved
     *         would go negative
     */
    @Transactional
    public LedgerResult release(long userId, long amount, UUID referenceId) {
        return settle(TransactionKind.RELEASE, userId, amount, referenceId);
    }

    /**
     * Current balance, without locking. Users never seen by the ledger have a zero balance.
     */
    @Transactional(readOnly = true)
    public Balance getBalance(long userId) {
        List<Balance> rows = jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM balances WHERE user_id = ?",
            balanceRowMapper(),
            userId
        );
        return rows.isEmpty() ? Balance.empty(userId) : rows.get(0);
    }

    /**
     * Most recent transactions first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransactions(long userId, int limit) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE user_id = ? " +
            "ORDER BY sequence_number DESC LIMIT ?",
            transactionRowMapper(),
            userId,
            limit
        );
    }

    /**
     * Whether the user has ever had a balance row, i.e. is known to the ledger.
     */
    @Transactional(readOnly = true)
    public boolean hasAccount(long userId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM balances WHERE user_id = ?)", Boolean.class, userId);
        return Boolean.TRUE.equals(exists);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findTransaction(TransactionKind kind, UUID referenceId) {
        List<LedgerTransaction> rows = jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE kind = ? AND reference_id = ?",
            transactionRowMapper(),
            kind.name(),
            referenceId
        );
        return rows.stream().findFirst();
    }

    private LedgerResult settle(TransactionKind kind, long userId, long amount, UUID referenceId) {
        long startTime = System.currentTimeMillis();
        validate(amount, referenceId);

        Optional<Balance> locked = lockBalance(userId);

        Optional<LedgerResult> prior = findPriorResult(userId, kind, amount, referenceId);
        if (prior.isPresent()) {
            return prior.get();
        }

        Balance balance = locked.orElseThrow(() ->
                violation(userId, kind, referenceId, "user has no balance"));

        LedgerTransaction reservation = findTransaction(TransactionKind.RESERVE, referenceId)
                .orElseThrow(() -> violation(userId, kind, referenceId, "no reservation exists for reference"));
        if (reservation.getUserId() != userId) {
            throw violation(userId, kind, referenceId,
                    "reservation belongs to user " + reservation.getUserId());
        }
        if (Math.abs(reservation.getAmount()) != amount) {
            throw violation(userId, kind, referenceId, String.format(
                    "amount %d does not match reserved amount %d", amount, Math.abs(reservation.getAmount())));
        }

        TransactionKind opposite = kind == TransactionKind.COMMIT ? TransactionKind.RELEASE : TransactionKind.COMMIT;
        if (findTransaction(opposite, referenceId).isPresent()) {
            throw violation(userId, kind, referenceId, "reservation was already settled by " + opposite);
        }

        long reservedAfter = balance.getReserved() - amount;
        if (reservedAfter < 0) {
            throw violation(userId, kind, referenceId, String.format(
                    "reserved would go negative (reserved=%d, amount=%d)", balance.getReserved(), amount));
        }

        long availableAfter = kind == TransactionKind.RELEASE
                ? balance.getAvailable() + amount
                : balance.getAvailable();

        LedgerResult result = apply(balance, kind, amount, referenceId, availableAfter, reservedAfter);
        creditMetrics.recordLedgerLatency(System.currentTimeMillis() - startTime);
        return result;
    }

    private LedgerResult apply(Balance balance, TransactionKind kind, long amount, UUID referenceId,
                               long availableAfter, long reservedAfter) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);

        jdbcTemplate.update(
            "UPDATE balances SET available = ?, reserved = ?, version = version + 1, updated_at = ? " +
            "WHERE user_id = ?",
            availableAfter,
            reservedAfter,
            Timestamp.from(now),
            balance.getUserId()
        );

        LedgerTransaction transaction = new LedgerTransaction(
            UUID.randomUUID(),
            balance.getUserId(),
            kind,
            kind.signed(amount),
            balance.total(),
            availableAfter + reservedAfter,
            availableAfter,
            reservedAfter,
            referenceId,
            now
        );

        jdbcTemplate.update(
            "INSERT INTO transactions (" + TRANSACTION_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            transaction.getId(),
            transaction.getUserId(),
            kind.name(),
            transaction.getAmount(),
            transaction.getBalanceBefore(),
            transaction.getBalanceAfter(),
            transaction.getAvailableAfter(),
            transaction.getReservedAfter(),
            referenceId,
            Timestamp.from(now)
        );

        recordOnCompletion(transaction, amount);
        return LedgerResult.applied(transaction);
    }

    /**
     * A caller's transaction can still roll back after the ledger call returns
     * (a generation refused by admission limits), so "applied" is only counted
     * once the surrounding transaction commits.
     */
    private void recordOnCompletion(LedgerTransaction transaction, long amount) {
        String kind = transaction.getKind().name();
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            recordApplied(transaction, amount);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    recordApplied(transaction, amount);
                } else {
                    creditMetrics.recordLedgerOperation(kind, "rolled_back");
                    log.debug("Ledger {} rolled back: userId={}, referenceId={}",
                            kind, transaction.getUserId(), transaction.getReferenceId());
                }
            }
        });
    }

    private void recordApplied(LedgerTransaction transaction, long amount) {
        creditMetrics.recordLedgerOperation(transaction.getKind().name(), "applied");
        log.info("Ledger {} applied: userId={}, amount={}, referenceId={}, available={}, reserved={}",
                transaction.getKind(), transaction.getUserId(), amount, transaction.getReferenceId(),
                transaction.getAvailableAfter(), transaction.getReservedAfter());
    }

    private Optional<LedgerResult> findPriorResult(long userId, TransactionKind kind, long amount, UUID referenceId) {
        Optional<LedgerTransaction> existing = findTransaction(kind, referenceId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        LedgerTransaction prior = existing.get();
        if (prior.getUserId() != userId) {
            throw violation(userId, kind, referenceId,
                    "reference already used by user " + prior.getUserId());
        }
        if (Math.abs(prior.getAmount()) != amount) {
            log.warn("Duplicate {} with different amount ignored: referenceId={}, recorded={}, requested={}",
                    kind, referenceId, Math.abs(prior.getAmount()), amount);
        }

        creditMetrics.recordLedgerOperation(kind.name(), "duplicate");
        log.debug("Ledger {} already applied for referenceId={}, returning recorded result", kind, referenceId);
        return Optional.of(LedgerResult.duplicate(prior));
    }

    private Balance lockOrCreateBalance(long userId) {
        jdbcTemplate.update(
            "INSERT INTO balances (user_id, available, reserved, version, updated_at) " +
            "VALUES (?, 0, 0, 0, CURRENT_TIMESTAMP) ON CONFLICT (user_id) DO NOTHING",
            userId
        );
        return lockBalance(userId)
                .orElseThrow(() -> new IllegalStateException("Balance row missing after upsert for user " + userId));
    }

    private Optional<Balance> lockBalance(long userId) {
        List<Balance> rows = jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM balances WHERE user_id = ? FOR UPDATE",
            balanceRowMapper(),
            userId
        );
        return rows.stream().findFirst();
    }

    private InvariantViolationException violation(long userId, TransactionKind kind, UUID referenceId, String message) {
        InvariantViolationException exception = new InvariantViolationException(userId, kind, referenceId, message);
        creditMetrics.recordInvariantViolation(kind.name());
        log.error("LEDGER INVARIANT VIOLATION, manual reconciliation required: {}", exception.getMessage());
        return exception;
    }

    private void validate(long amount, UUID referenceId) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
        if (referenceId == null) {
            throw new IllegalArgumentException("Reference id is required");
        }
    }

    private RowMapper<Balance> balanceRowMapper() {
        return (rs, rowNum) -> new Balance(
            rs.getLong("user_id"),
            rs.getLong("available"),
            rs.getLong("reserved"),
            rs.getLong("version"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getObject("id", UUID.class),
            rs.getLong("user_id"),
            TransactionKind.valueOf(rs.getString("kind")),
            rs.getLong("amount"),
            rs.getLong("balance_before"),
            rs.getLong("balance_after"),
            rs.getLong("available_after"),
            rs.getLong("reserved_after"),
            rs.getObject("reference_id", UUID.class),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
