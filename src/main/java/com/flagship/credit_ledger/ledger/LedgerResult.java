package com.flagship.credit_ledger.ledger;

import lombok.Value;

/**
 * Outcome of a ledger operation.
 *
 * When {@code duplicate} is true the operation had already been applied for the
 * same (kind, reference id); {@code transaction} is the originally recorded row
 * and nothing was mutated.
 */
@Value
public class LedgerResult {
    LedgerTransaction transaction;
    boolean duplicate;

    public static LedgerResult applied(LedgerTransaction transaction) {
        return new LedgerResult(transaction, false);
    }

    public static LedgerResult duplicate(LedgerTransaction transaction) {
        return new LedgerResult(transaction, true);
    }

    public long getAvailableAfter() {
        return transaction.getAvailableAfter();
    }

    public long getReservedAfter() {
        return transaction.getReservedAfter();
    }
}
