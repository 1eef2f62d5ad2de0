package com.flagship.credit_ledger.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class CreateGenerationRequest {

    @NotNull(message = "User ID is required")
    @Positive(message = "User ID must be positive")
    @JsonProperty("userId")
    Long userId;

    @NotBlank(message = "Prompt is required")
    @Size(max = 4000, message = "Prompt must be at most 4000 characters")
    @JsonProperty("prompt")
    String prompt;

    @Size(max = 4, message = "At most 4 reference images are allowed")
    @JsonProperty("referenceImages")
    List<String> referenceImages;

    @JsonProperty("settings")
    Map<String, Object> settings;
}
