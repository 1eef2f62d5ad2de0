package com.flagship.credit_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The generation failed or was canceled and its credits were returned.
 */
@Value
public class GenerationFailedNotification implements UserNotification {
    UUID eventId;
    long userId;
    UUID generationId;
    String error;
    long creditsRefunded;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GenerationFailed";

    public static GenerationFailedNotification of(long userId, UUID generationId, String error,
                                                  long creditsRefunded) {
        return new GenerationFailedNotification(UUID.randomUUID(), userId, generationId, error,
                creditsRefunded, Instant.now());
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
