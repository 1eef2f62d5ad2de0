package com.flagship.credit_ledger.referral.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.referral.ReferralService;
import com.flagship.credit_ledger.referral.RegistrationResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RegistrationResponse {

    @JsonProperty("userId")
    long userId;

    @JsonProperty("bonus")
    String bonus;

    @JsonProperty("creditsGranted")
    long creditsGranted;

    @JsonProperty("referrerId")
    Long referrerId;

    @JsonProperty("referralCode")
    String referralCode;

    public static RegistrationResponse from(RegistrationResult result) {
        return RegistrationResponse.builder()
            .userId(result.getUserId())
            .bonus(result.getBonus().name())
            .creditsGranted(result.getCreditsGranted())
            .referrerId(result.getReferrerId())
            .referralCode(ReferralService.referralCode(result.getUserId()))
            .build();
    }
}
