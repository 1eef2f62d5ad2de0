package com.flagship.credit_ledger.referral;

public enum SignupBonus {
    /** Registered without a usable referral code. */
    WELCOME,
    /** Registered through another user's referral code. */
    REFERRAL,
    /** Already registered; nothing granted. */
    EXISTING
}
