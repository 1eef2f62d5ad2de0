package com.flagship.credit_ledger.ledger;

/**
 * Thrown when a reservation asks for more credits than the user has available.
 * No state is mutated when this is thrown.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final long userId;
    private final long requested;
    private final long available;

    public InsufficientCreditsException(long userId, long requested, long available) {
        super(String.format("Insufficient credits for user %d: requested=%d, available=%d",
                userId, requested, available));
        this.userId = userId;
        this.requested = requested;
        this.available = available;
    }

    public long getUserId() {
        return userId;
    }

    public long getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }

    public long getShortfall() {
        return requested - available;
    }
}
