package com.flagship.credit_ledger.consumer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers
class IdempotentEventProcessorTest {

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "COMPLETED";
    private static final String AGGREGATE_TYPE = "GenerationJob";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("test_processed_events")
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

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private boolean process(UUID eventId, UUID aggregateId, Runnable handler) {
        return eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, handler);
    }

    @Test
    @DisplayName("The handler runs once however often the event is delivered")
    void handlerRunsOnce() {
        printTestHeader("Redelivered event");
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean first = process(eventId, aggregateId, calls::incrementAndGet);
        boolean second = process(eventId, aggregateId, calls::incrementAndGet);
        boolean third = process(eventId, aggregateId, calls::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertFalse(third);
        assertEquals(1, calls.get());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));
    }

    @Test
    @DisplayName("A failing handler leaves no record, so the redelivery runs again")
    void failedHandlerIsRetried() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> process(eventId, aggregateId, () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("database hiccup");
        }));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        assertTrue(process(eventId, aggregateId, calls::incrementAndGet));
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Skipped events are recorded and never run")
    void skippedEventIsNotRun() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.skipEvent(eventId, "RESTARTED", AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, "Unknown report type");
        eventProcessor.skipEvent(eventId, "RESTARTED", AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, "Unknown report type");

        assertFalse(process(eventId, aggregateId, calls::incrementAndGet));
        assertEquals(0, calls.get());

        List<ProcessedEvent> history = eventProcessor.getHistory(AGGREGATE_TYPE, aggregateId);
        assertEquals(1, history.size());
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, history.get(0).getResult());
        assertEquals("Unknown report type", history.get(0).getErrorMessage());
    }

    @Test
    @DisplayName("History lists an aggregate's events in processing order")
    void historyIsOrdered() {
        UUID aggregateId = UUID.randomUUID();
        process(UUID.randomUUID(), aggregateId, () -> { });
        eventProcessor.processEvent(UUID.randomUUID(), "FAILED", AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, () -> { });

        List<ProcessedEvent> history = eventProcessor.getHistory(AGGREGATE_TYPE, aggregateId);

        assertEquals(2, history.size());
        assertEquals(EVENT_TYPE, history.get(0).getEventType());
        assertEquals("FAILED", history.get(1).getEventType());
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, history.get(1).getResult());
    }

    @Test
    @DisplayName("Concurrent deliveries of one event succeed once")
    void concurrentDeliveriesSucceedOnce() throws InterruptedException {
        printTestHeader("Concurrent deliveries");
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();

        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger successes = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (process(eventId, aggregateId, () -> { })) {
                        successes.incrementAndGet();
                    }
                } catch (Exception e) {
                    System.out.println("Delivery lost the race: " + e.getClass().getSimpleName());
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, successes.get());
        assertEquals(1, eventProcessor.getHistory(AGGREGATE_TYPE, aggregateId).size());
    }

    @Test
    @DisplayName("Old records can be purged")
    void purgeRemovesOldRecords() {
        UUID eventId = UUID.randomUUID();
        process(eventId, UUID.randomUUID(), () -> { });

        int purged = eventProcessor.purgeProcessedBefore(Instant.now().plusSeconds(60));

        assertTrue(purged >= 1);
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));
    }
}
