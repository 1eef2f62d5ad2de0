package com.flagship.credit_ledger.ledger;

import java.util.UUID;

/**
 * A ledger mutation would break a balance invariant (negative reserved, settling a
 * reference that was never reserved, settling it twice in opposite directions).
 *
 * Not retryable. The state needs manual reconciliation; values are never clamped.
 */
public class InvariantViolationException extends RuntimeException {

    private final long userId;
    private final TransactionKind kind;
    private final UUID referenceId;

    public InvariantViolationException(long userId, TransactionKind kind, UUID referenceId, String message) {
        super(String.format("Ledger invariant violated for user %d (%s %s): %s",
                userId, kind, referenceId, message));
        this.userId = userId;
        this.kind = kind;
        this.referenceId = referenceId;
    }

    public long getUserId() {
        return userId;
    }

    public TransactionKind getKind() {
        return kind;
    }

    public UUID getReferenceId() {
        return referenceId;
    }
}
