package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of a user's credit balance.
 *
 * available: spendable now
 * reserved:  held against in-flight generations
 */
@Value
public class Balance {
    long userId;
    long available;
    long reserved;
    long version;
    Instant updatedAt;

    /**
     * Balance of a user the ledger has never seen.
     */
    public static Balance empty(long userId) {
        return new Balance(userId, 0, 0, 0, null);
    }

    public long total() {
        return available + reserved;
    }
}
