package com.flagship.credit_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.payment.TopupInitiation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class TopupInitiationResponse {

    @JsonProperty("topupId")
    UUID topupId;

    @JsonProperty("rubAmount")
    BigDecimal rubAmount;

    @JsonProperty("credits")
    long credits;

    @JsonProperty("paymentId")
    String paymentId;

    @JsonProperty("confirmationUrl")
    String confirmationUrl;

    public static TopupInitiationResponse from(TopupInitiation initiation) {
        return TopupInitiationResponse.builder()
            .topupId(initiation.getTopup().getId())
            .rubAmount(initiation.getTopup().getRubAmount())
            .credits(initiation.getTopup().getCredits())
            .paymentId(initiation.getPaymentId())
            .confirmationUrl(initiation.getConfirmationUrl())
            .build();
    }
}
