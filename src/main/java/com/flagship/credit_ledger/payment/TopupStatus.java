package com.flagship.credit_ledger.payment;

/**
 * Lifecycle of a topup.
 *
 * CREATED -> PAID | FAILED | EXPIRED
 *
 * PAID is absorbing. FAILED and EXPIRED close the purchase intent, but a capture
 * the provider confirms afterwards still moves the topup to PAID because the
 * user's money has already moved.
 */
public enum TopupStatus {
    CREATED,
    PAID,
    FAILED,
    EXPIRED
}
