package com.flagship.credit_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.LedgerTransaction;
import com.flagship.credit_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("balanceBefore")
    long balanceBefore;

    @JsonProperty("balanceAfter")
    long balanceAfter;

    @JsonProperty("availableAfter")
    long availableAfter;

    @JsonProperty("reservedAfter")
    long reservedAfter;

    @JsonProperty("referenceId")
    UUID referenceId;

    @JsonProperty("createdAt")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransaction tx) {
        return TransactionResponse.builder()
            .id(tx.getId())
            .kind(tx.getKind())
            .amount(tx.getAmount())
            .balanceBefore(tx.getBalanceBefore())
            .balanceAfter(tx.getBalanceAfter())
            .availableAfter(tx.getAvailableAfter())
            .reservedAfter(tx.getReservedAfter())
            .referenceId(tx.getReferenceId())
            .createdAt(tx.getCreatedAt())
            .build();
    }
}
