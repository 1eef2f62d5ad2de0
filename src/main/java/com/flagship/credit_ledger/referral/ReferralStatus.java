package com.flagship.credit_ledger.referral;

/**
 * REGISTERED -> ACTIVATED -> REWARDED. A referral activated while its referrer was
 * at the daily cap stays ACTIVATED and is never rewarded.
 */
public enum ReferralStatus {
    REGISTERED,
    ACTIVATED,
    REWARDED
}
