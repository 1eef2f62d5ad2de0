package com.flagship.credit_ledger.referral;

import lombok.Value;

@Value
public class ReferralStats {
    long userId;
    String referralCode;
    long referralsCount;
    long activatedCount;
    long rewardedCount;
    long totalEarned;
}
