package com.flagship.credit_ledger.generation;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Dispatch message read by the worker pool from the generation-jobs topic.
 */
@Value
public class GenerationJobMessage {
    UUID generationId;
    String jobId;
    long userId;
    String prompt;
    List<String> referenceImages;
    Map<String, Object> settings;
    long cost;

    public static GenerationJobMessage from(Generation generation) {
        return new GenerationJobMessage(
            generation.getId(),
            generation.getJobId(),
            generation.getUserId(),
            generation.getPrompt(),
            generation.getReferenceImages(),
            generation.getSettings(),
            generation.getCost()
        );
    }
}
