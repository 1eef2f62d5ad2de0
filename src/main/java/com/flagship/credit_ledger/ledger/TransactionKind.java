package com.flagship.credit_ledger.ledger;

/**
 * Kind of ledger mutation. Each (kind, reference id) pair can be applied at most once.
 *
 * The recorded amount is signed: GRANT and RELEASE are positive,
 * RESERVE and COMMIT are negative.
 */
public enum TransactionKind {
    GRANT(1),
    RESERVE(-1),
    COMMIT(-1),
    RELEASE(1);

    private final int sign;

    TransactionKind(int sign) {
        this.sign = sign;
    }

    public long signed(long amount) {
        return sign * amount;
    }
}
