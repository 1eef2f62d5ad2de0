package com.flagship.credit_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.LedgerResult;
import lombok.Value;

@Value
public class ManualGrantResponse {

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static ManualGrantResponse from(LedgerResult result) {
        return new ManualGrantResponse(TransactionResponse.from(result.getTransaction()), result.isDuplicate());
    }
}
