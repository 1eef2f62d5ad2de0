package com.flagship.credit_ledger.ledger;

import lombok.Value;

/**
 * Stored balance of one user compared against the balance rebuilt from the transaction log.
 */
@Value
public class BalanceDrift {
    long userId;
    long actualAvailable;
    long actualReserved;
    long expectedAvailable;
    long expectedReserved;

    public boolean isConsistent() {
        return actualAvailable == expectedAvailable && actualReserved == expectedReserved;
    }

    public long getAvailableDrift() {
        return actualAvailable - expectedAvailable;
    }

    public long getReservedDrift() {
        return actualReserved - expectedReserved;
    }
}
