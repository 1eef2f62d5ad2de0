package com.flagship.credit_ledger.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CancelGenerationRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("userId")
    Long userId;
}
