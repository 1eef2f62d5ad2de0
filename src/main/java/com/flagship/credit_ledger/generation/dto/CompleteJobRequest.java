package com.flagship.credit_ledger.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CompleteJobRequest {

    @NotBlank(message = "Image URL is required")
    @JsonProperty("imageUrl")
    String imageUrl;

    @JsonProperty("seed")
    Long seed;
}
