package com.flagship.credit_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Operator grant. referenceId makes retries safe: the same reference grants once.
 */
@Value
@Builder
@Jacksonized
public class ManualGrantRequest {

    @NotNull(message = "User ID is required")
    @Positive(message = "User ID must be positive")
    @JsonProperty("userId")
    Long userId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    @JsonProperty("amount")
    Long amount;

    @NotNull(message = "Reference ID is required")
    @JsonProperty("referenceId")
    UUID referenceId;
}
