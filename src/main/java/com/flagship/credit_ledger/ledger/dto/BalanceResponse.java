package com.flagship.credit_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.Balance;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("userId")
    long userId;

    @JsonProperty("available")
    long available;

    @JsonProperty("reserved")
    long reserved;

    @JsonProperty("total")
    long total;

    public static BalanceResponse from(Balance balance) {
        return BalanceResponse.builder()
            .userId(balance.getUserId())
            .available(balance.getAvailable())
            .reserved(balance.getReserved())
            .total(balance.total())
            .build();
    }
}
