package com.flagship.credit_ledger.referral.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.referral.ReferralStats;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReferralStatsResponse {

    @JsonProperty("userId")
    long userId;

    @JsonProperty("referralCode")
    String referralCode;

    @JsonProperty("referralsCount")
    long referralsCount;

    @JsonProperty("activatedCount")
    long activatedCount;

    @JsonProperty("rewardedCount")
    long rewardedCount;

    @JsonProperty("totalEarned")
    long totalEarned;

    public static ReferralStatsResponse from(ReferralStats stats) {
        return ReferralStatsResponse.builder()
            .userId(stats.getUserId())
            .referralCode(stats.getReferralCode())
            .referralsCount(stats.getReferralsCount())
            .activatedCount(stats.getActivatedCount())
            .rewardedCount(stats.getRewardedCount())
            .totalEarned(stats.getTotalEarned())
            .build();
    }
}
