package com.flagship.credit_ledger.referral;

import lombok.Value;

@Value
public class RegistrationResult {
    long userId;
    SignupBonus bonus;
    long creditsGranted;
    Long referrerId;

    public static RegistrationResult existing(long userId) {
        return new RegistrationResult(userId, SignupBonus.EXISTING, 0, null);
    }

    public boolean isNewUser() {
        return bonus != SignupBonus.EXISTING;
    }
}
