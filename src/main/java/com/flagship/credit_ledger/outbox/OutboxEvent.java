package com.flagship.credit_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A message waiting in the outbox to be relayed to Kafka.
 *
 * Written in the same database transaction as the state change it announces, so
 * the message exists if and only if that change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // GenerationJob, UserNotification
    UUID aggregateId;          // generation id or topup id; also the Kafka key
    String eventType;          // GenerationRequested, TopupPaid, ...
    String payload;            // JSON
    String correlationId;
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload, String correlationId) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            correlationId,
            Instant.now(),
            null,
            0,
            null,
            null  // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
