package com.flagship.credit_ledger.payment;

/**
 * What a webhook delivery did. All of these are acknowledged to the provider.
 */
public enum ReconciliationOutcome {
    /** Credits granted and topup marked paid. */
    GRANTED,
    /** Payment canceled; topup marked failed, nothing granted. */
    CANCELED,
    /** Already processed earlier; nothing changed. */
    DUPLICATE,
    /** Non-final status; recorded, nothing else changed. */
    IGNORED
}
