package com.flagship.credit_ledger.generation;

import com.flagship.credit_ledger.ledger.CreditLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers
class GenerationWatchdogTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("test_watchdog")
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
        registry.add("generation.watchdog.processing-timeout-seconds", () -> "600");
        registry.add("generation.watchdog.reserved-timeout-seconds", () -> "1800");
    }

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Autowired
    private GenerationWatchdog watchdog;

    @Autowired
    private JobCoordinator jobCoordinator;

    @Autowired
    private CreditLedger creditLedger;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long userId;

    @BeforeEach
    void setUp() {
        userId = ThreadLocalRandom.current().nextLong(1, 1_000_000_000_000L);
        creditLedger.grant(userId, 100, UUID.randomUUID());
    }

    private Generation createJob() {
        return jobCoordinator.createJob(userId, "stormy sea", List.of(), null);
    }

    private void ageStartedAt(UUID generationId, String interval) {
        jdbcTemplate.update("UPDATE generations SET started_at = started_at - CAST(? AS INTERVAL) WHERE id = ?",
                interval, generationId);
    }

    private void ageCreatedAt(UUID generationId, String interval) {
        jdbcTemplate.update("UPDATE generations SET created_at = created_at - CAST(? AS INTERVAL) WHERE id = ?",
                interval, generationId);
    }

    @Test
    @DisplayName("A job processing past the limit is failed and refunded")
    void stuckProcessingJobIsFailed() {
        Generation generation = createJob();
        jobCoordinator.markProcessing(generation.getJobId());
        ageStartedAt(generation.getId(), "11 minutes");

        assertTrue(watchdog.sweep() >= 1);

        Generation swept = jobCoordinator.getGeneration(generation.getId());
        assertEquals(GenerationStatus.FAILED, swept.getStatus());
        assertEquals("TIMEOUT: Generation exceeded 600s limit", swept.getError());
        assertEquals(100, creditLedger.getBalance(userId).getAvailable());
        assertEquals(0, creditLedger.getBalance(userId).getReserved());
    }

    @Test
    @DisplayName("A job no worker ever picked up is failed after the reserved limit")
    void stuckReservedJobIsFailed() {
        Generation generation = createJob();
        ageCreatedAt(generation.getId(), "31 minutes");

        watchdog.sweep();

        Generation swept = jobCoordinator.getGeneration(generation.getId());
        assertEquals(GenerationStatus.FAILED, swept.getStatus());
        assertEquals(GenerationWatchdog.timeoutError(Duration.ofSeconds(1800)), swept.getError());
        assertEquals(100, creditLedger.getBalance(userId).getAvailable());
    }

    @Test
    @DisplayName("Jobs within their limits are left alone")
    void freshJobsAreUntouched() {
        Generation generation = createJob();
        jobCoordinator.markProcessing(generation.getJobId());
        ageStartedAt(generation.getId(), "5 minutes");
        ageCreatedAt(generation.getId(), "40 minutes");

        watchdog.sweep();

        assertEquals(GenerationStatus.PROCESSING, jobCoordinator.getGeneration(generation.getId()).getStatus());
        assertEquals(10, creditLedger.getBalance(userId).getReserved());
    }

    @Test
    @DisplayName("Finished jobs are never swept, however old")
    void finishedJobsAreUntouched() {
        Generation generation = createJob();
        jobCoordinator.complete(generation.getJobId(), new GenerationResult("https://cdn.test/done.png", 9L));
        ageCreatedAt(generation.getId(), "2 days");
        ageStartedAt(generation.getId(), "2 days");

        watchdog.sweep();

        assertEquals(GenerationStatus.COMPLETED, jobCoordinator.getGeneration(generation.getId()).getStatus());
        assertEquals(90, creditLedger.getBalance(userId).getAvailable());
    }

    @Test
    @DisplayName("A worker report after a timeout does not charge the user")
    void reportAfterTimeoutIsIgnored() {
        Generation generation = createJob();
        jobCoordinator.markProcessing(generation.getJobId());
        ageStartedAt(generation.getId(), "20 minutes");
        watchdog.sweep();

        jobCoordinator.report(generation.getJobId(),
                WorkerOutcome.completed(new GenerationResult("https://cdn.test/late.png", 1L)));

        assertEquals(GenerationStatus.FAILED, jobCoordinator.getGeneration(generation.getId()).getStatus());
        assertEquals(100, creditLedger.getBalance(userId).getAvailable());
    }
}
