package com.flagship.credit_ledger.consumer;

import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Runs an event handler at most once per (event id, consumer group).
 *
 * The handler and the processed_events insert share one transaction: either
 * both commit or neither does, in which case the event is redelivered and tried
 * again. Handlers joining this transaction must not commit on their own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final CreditMetrics creditMetrics;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            creditMetrics.recordEventProcessed(eventType, false);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            creditMetrics.recordEventProcessingFailure(eventType);
            log.error("Failed to process event {} by consumer group {}: {}", eventId, consumerGroup, e.getMessage());
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup)));
        creditMetrics.recordEventProcessed(eventType, true);
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records an event that can never be applied so it is not retried.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    @Transactional(readOnly = true)
    public List<ProcessedEvent> getHistory(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(aggregateType, aggregateId)
                .stream()
                .map(ProcessedEventEntity::toDomain)
                .toList();
    }

    @Transactional
    public int purgeProcessedBefore(Instant cutoff) {
        return repository.deleteEventsProcessedBefore(cutoff);
    }
}
