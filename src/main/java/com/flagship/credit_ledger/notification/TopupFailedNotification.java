package com.flagship.credit_ledger.notification;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The payment was canceled; no credits were granted and no charge should be assumed.
 */
@Value
public class TopupFailedNotification implements UserNotification {
    UUID eventId;
    long userId;
    UUID topupId;
    BigDecimal rubAmount;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TopupFailed";

    public static TopupFailedNotification of(long userId, UUID topupId, BigDecimal rubAmount, String reason) {
        return new TopupFailedNotification(UUID.randomUUID(), userId, topupId, rubAmount, reason, Instant.now());
    }

    @Override
    public UUID getSubjectId() {
        return topupId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
