package com.flagship.credit_ledger.generation;

import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Generation job domain object.
 *
 * Immutable; each transition returns a new instance and rejects moves the state
 * machine does not allow with IllegalStateException. The ledger reference id for
 * the job's reserve/commit/release is always {@link #getId()}.
 */
@Value
public class Generation {
    UUID id;
    long userId;
    String jobId;
    String prompt;
    List<String> referenceImages;
    Map<String, Object> settings;
    long cost;
    GenerationStatus status;
    String error;
    String imageUrl;
    Long seed;
    Instant createdAt;
    Instant updatedAt;
    Instant startedAt;
    Instant completedAt;

    /**
     * Creates a new generation in PENDING status. The job id handed to workers is
     * the generation id.
     */
    public static Generation create(long userId, String prompt, List<String> referenceImages,
                                    Map<String, Object> settings, long cost) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }
        if (cost <= 0) {
            throw new IllegalArgumentException("Generation cost must be positive");
        }
        UUID id = UUID.randomUUID();
        Instant now = Instant.now();
        return new Generation(
            id,
            userId,
            id.toString(),
            prompt,
            referenceImages == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(referenceImages)),
            settings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(settings)),
            cost,
            GenerationStatus.PENDING,
            null,
            null,
            null,
            now,
            now,
            null,
            null
        );
    }

    /**
     * Credits were reserved. Only valid from PENDING.
     */
    public Generation reserve() {
        requireTransition(GenerationStatus.RESERVED);
        return withStatus(GenerationStatus.RESERVED, error, imageUrl, seed, startedAt, completedAt);
    }

    /**
     * A worker started the job. Only valid from RESERVED.
     */
    public Generation markProcessing() {
        requireTransition(GenerationStatus.PROCESSING);
        return withStatus(GenerationStatus.PROCESSING, error, imageUrl, seed, Instant.now(), completedAt);
    }

    /**
     * Valid from PROCESSING, and from RESERVED when the start report was lost.
     */
    public Generation complete(String imageUrl, Long seed) {
        requireTransition(GenerationStatus.COMPLETED);
        Instant now = Instant.now();
        return withStatus(GenerationStatus.COMPLETED, null, imageUrl, seed,
                startedAt != null ? startedAt : now, now);
    }

    public Generation fail(String error) {
        requireTransition(GenerationStatus.FAILED);
        return withStatus(GenerationStatus.FAILED, error, imageUrl, seed, startedAt, Instant.now());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canTransitionTo(GenerationStatus target) {
        return switch (status) {
            case PENDING -> target == GenerationStatus.RESERVED || target == GenerationStatus.FAILED;
            case RESERVED -> target == GenerationStatus.PROCESSING
                    || target == GenerationStatus.COMPLETED
                    || target == GenerationStatus.FAILED;
            case PROCESSING -> target == GenerationStatus.COMPLETED || target == GenerationStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    private void requireTransition(GenerationStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                    "Cannot move generation %s from %s to %s", id, status, target));
        }
    }

    private Generation withStatus(GenerationStatus newStatus, String newError, String newImageUrl, Long newSeed,
                                  Instant newStartedAt, Instant newCompletedAt) {
        return new Generation(id, userId, jobId, prompt, referenceImages, settings, cost, newStatus,
                newError, newImageUrl, newSeed, createdAt, Instant.now(), newStartedAt, newCompletedAt);
    }
}
