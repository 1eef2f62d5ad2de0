package com.flagship.credit_ledger.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.generation.Generation;
import com.flagship.credit_ledger.generation.GenerationStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class GenerationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("userId")
    long userId;

    @JsonProperty("jobId")
    String jobId;

    @JsonProperty("prompt")
    String prompt;

    @JsonProperty("referenceImages")
    List<String> referenceImages;

    @JsonProperty("settings")
    Map<String, Object> settings;

    @JsonProperty("cost")
    long cost;

    @JsonProperty("status")
    GenerationStatus status;

    @JsonProperty("error")
    String error;

    @JsonProperty("imageUrl")
    String imageUrl;

    @JsonProperty("seed")
    Long seed;

    @JsonProperty("createdAt")
    Instant createdAt;

    @JsonProperty("startedAt")
    Instant startedAt;

    @JsonProperty("completedAt")
    Instant completedAt;

    public static GenerationResponse from(Generation generation) {
        return GenerationResponse.builder()
            .id(generation.getId())
            .userId(generation.getUserId())
            .jobId(generation.getJobId())
            .prompt(generation.getPrompt())
            .referenceImages(generation.getReferenceImages())
            .settings(generation.getSettings())
            .cost(generation.getCost())
            .status(generation.getStatus())
            .error(generation.getError())
            .imageUrl(generation.getImageUrl())
            .seed(generation.getSeed())
            .createdAt(generation.getCreatedAt())
            .startedAt(generation.getStartedAt())
            .completedAt(generation.getCompletedAt())
            .build();
    }
}
