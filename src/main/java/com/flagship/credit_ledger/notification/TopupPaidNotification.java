package com.flagship.credit_ledger.notification;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class TopupPaidNotification implements UserNotification {
    UUID eventId;
    long userId;
    UUID topupId;
    BigDecimal rubAmount;
    long credits;
    long availableAfter;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TopupPaid";

    public static TopupPaidNotification of(long userId, UUID topupId, BigDecimal rubAmount,
                                           long credits, long availableAfter) {
        return new TopupPaidNotification(UUID.randomUUID(), userId, topupId, rubAmount,
                credits, availableAfter, Instant.now());
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
