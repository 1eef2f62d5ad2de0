package com.flagship.credit_ledger.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FailJobRequest {

    @NotBlank(message = "Error is required")
    @JsonProperty("error")
    String error;
}
