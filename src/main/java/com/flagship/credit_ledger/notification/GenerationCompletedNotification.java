package com.flagship.credit_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class GenerationCompletedNotification implements UserNotification {
    UUID eventId;
    long userId;
    UUID generationId;
    String imageUrl;
    Long seed;
    long creditsCharged;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GenerationCompleted";

    public static GenerationCompletedNotification of(long userId, UUID generationId, String imageUrl,
                                                     Long seed, long creditsCharged) {
        return new GenerationCompletedNotification(UUID.randomUUID(), userId, generationId, imageUrl,
                seed, creditsCharged, Instant.now());
    }

    @Override
    public UUID getSubjectId() {
        return generationId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
