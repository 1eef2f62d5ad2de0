package com.flagship.credit_ledger.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers
class LedgerAuditServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("test_audit")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("scheduler.enabled", () -> "false");
    }

    @Autowired
    private CreditLedger creditLedger;

    @Autowired
    private LedgerAuditService auditService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long userId;

    @BeforeEach
    void setUp() {
        userId = ThreadLocalRandom.current().nextLong(1, 1_000_000_000_000L);
    }

    @Test
    @DisplayName("Balances produced by the ledger match their history")
    void ledgerBalancesAreConsistent() {
        creditLedger.grant(userId, 100, UUID.randomUUID());
        UUID committed = UUID.randomUUID();
        UUID released = UUID.randomUUID();
        UUID open = UUID.randomUUID();
        creditLedger.reserve(userId, 10, committed);
        creditLedger.reserve(userId, 10, released);
        creditLedger.reserve(userId, 10, open);
        creditLedger.commit(userId, 10, committed);
        creditLedger.release(userId, 10, released);

        BalanceDrift drift = auditService.auditUser(userId);

        assertTrue(drift.isConsistent());
        assertEquals(80, drift.getExpectedAvailable());
        assertEquals(10, drift.getExpectedReserved());
        assertFalse(auditService.auditAll().stream().anyMatch(d -> d.getUserId() == userId));
    }

    @Test
    @DisplayName("A balance changed outside the ledger is reported as drift")
    void tamperedBalanceIsReported() {
        creditLedger.grant(userId, 100, UUID.randomUUID());
        jdbcTemplate.update("UPDATE balances SET available = available + 7 WHERE user_id = ?", userId);

        BalanceDrift drift = auditService.auditUser(userId);

        assertFalse(drift.isConsistent());
        assertEquals(107, drift.getActualAvailable());
        assertEquals(100, drift.getExpectedAvailable());

        List<BalanceDrift> drifts = auditService.auditAll();
        assertTrue(drifts.stream().anyMatch(d -> d.getUserId() == userId));
    }

    @Test
    @DisplayName("Users without a balance row are consistent")
    void unknownUserIsConsistent() {
        assertTrue(auditService.auditUser(userId).isConsistent());
    }

    @Test
    @DisplayName("The transaction log refuses updates and deletes")
    void transactionsAreAppendOnly() {
        creditLedger.grant(userId, 100, UUID.randomUUID());

        assertThrows(DataAccessException.class,
                () -> jdbcTemplate.update("UPDATE transactions SET amount = 1000 WHERE user_id = ?", userId));
        assertThrows(DataAccessException.class,
                () -> jdbcTemplate.update("DELETE FROM transactions WHERE user_id = ?", userId));

        assertEquals(100, creditLedger.getBalance(userId).getAvailable());
        assertTrue(auditService.auditUser(userId).isConsistent());
    }
}
