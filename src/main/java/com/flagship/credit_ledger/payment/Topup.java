package com.flagship.credit_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's intent to buy credits, created before the provider payment is started.
 *
 * Immutable; transitions return a new instance and reject invalid moves with
 * IllegalStateException.
 */
@Value
public class Topup {
    UUID id;
    long userId;
    BigDecimal rubAmount;
    long credits;
    TopupStatus status;
    Instant createdAt;
    Instant updatedAt;
    Instant paidAt;

    public static Topup create(long userId, BigDecimal rubAmount, long credits) {
        if (credits <= 0) {
            throw new IllegalArgumentException("Topup must buy a positive number of credits");
        }
        Instant now = Instant.now();
        return new Topup(UUID.randomUUID(), userId, rubAmount, credits, TopupStatus.CREATED, now, now, null);
    }

    /**
     * Confirmed capture. Valid from any state except PAID.
     */
    public Topup markPaid() {
        if (status == TopupStatus.PAID) {
            throw new IllegalStateException("Topup " + id + " is already paid");
        }
        Instant now = Instant.now();
        return new Topup(id, userId, rubAmount, credits, TopupStatus.PAID, createdAt, now, now);
    }

    /**
     * Payment canceled or could not be started. Only valid from CREATED.
     */
    public Topup markFailed() {
        requireCreated("fail");
        return new Topup(id, userId, rubAmount, credits, TopupStatus.FAILED, createdAt, Instant.now(), null);
    }

    /**
     * Nobody paid within the allowed window. Only valid from CREATED.
     */
    public Topup expire() {
        requireCreated("expire");
        return new Topup(id, userId, rubAmount, credits, TopupStatus.EXPIRED, createdAt, Instant.now(), null);
    }

    public boolean isPaid() {
        return status == TopupStatus.PAID;
    }

    private void requireCreated(String action) {
        if (status != TopupStatus.CREATED) {
            throw new IllegalStateException(String.format(
                    "Cannot %s topup %s in %s status. Only CREATED topups can change this way.", action, id, status));
        }
    }
}
