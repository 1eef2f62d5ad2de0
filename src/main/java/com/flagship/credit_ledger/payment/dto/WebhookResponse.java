package com.flagship.credit_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.payment.ReconciliationOutcome;
import lombok.Value;

/**
 * Body returned to the payment provider. Anything but 2xx makes it redeliver.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResponse {

    @JsonProperty("status")
    String status;

    @JsonProperty("outcome")
    ReconciliationOutcome outcome;

    @JsonProperty("reason")
    String reason;

    public static WebhookResponse accepted(ReconciliationOutcome outcome) {
        return new WebhookResponse("accepted", outcome, null);
    }

    public static WebhookResponse rejected(String reason) {
        return new WebhookResponse("rejected", null, reason);
    }
}
