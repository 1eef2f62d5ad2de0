package com.flagship.credit_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.payment.Topup;
import com.flagship.credit_ledger.payment.TopupStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TopupResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("userId")
    long userId;

    @JsonProperty("rubAmount")
    BigDecimal rubAmount;

    @JsonProperty("credits")
    long credits;

    @JsonProperty("status")
    TopupStatus status;

    @JsonProperty("createdAt")
    Instant createdAt;

    @JsonProperty("paidAt")
    Instant paidAt;

    public static TopupResponse from(Topup topup) {
        return TopupResponse.builder()
            .id(topup.getId())
            .userId(topup.getUserId())
            .rubAmount(topup.getRubAmount())
            .credits(topup.getCredits())
            .status(topup.getStatus())
            .createdAt(topup.getCreatedAt())
            .paidAt(topup.getPaidAt())
            .build();
    }
}
