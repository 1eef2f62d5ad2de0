package com.flagship.credit_ledger.generation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JPA mapping of the generations table. Writes go through fromDomain and
 * updateFromDomain only.
 */
@Entity
@Table(name = "generations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenerationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private long userId;

    @Column(name = "job_id", nullable = false, updatable = false, unique = true, length = 64)
    private String jobId;

    @Column(nullable = false, updatable = false, columnDefinition = "text")
    private String prompt;

    @Column(name = "reference_images", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> referenceImages;

    @Column(name = "settings", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> settings;

    @Column(nullable = false, updatable = false)
    private long cost;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GenerationStatus status;

    @Column(columnDefinition = "text")
    private String error;

    @Column(name = "image_url", columnDefinition = "text")
    private String imageUrl;

    @Column(name = "seed")
    private Long seed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static GenerationEntity fromDomain(Generation generation) {
        return new GenerationEntity(
            generation.getId(),
            generation.getUserId(),
            generation.getJobId(),
            generation.getPrompt(),
            generation.getReferenceImages(),
            generation.getSettings(),
            generation.getCost(),
            generation.getStatus(),
            generation.getError(),
            generation.getImageUrl(),
            generation.getSeed(),
            generation.getCreatedAt(),
            generation.getUpdatedAt(),
            generation.getStartedAt(),
            generation.getCompletedAt()
        );
    }

    public Generation toDomain() {
        return new Generation(id, userId, jobId, prompt,
                referenceImages == null ? List.of() : referenceImages,
                settings == null ? Map.of() : settings,
                cost, status, error, imageUrl, seed, createdAt, updatedAt, startedAt, completedAt);
    }

    /**
     * Copies the fields a transition may change.
     */
    void updateFromDomain(Generation generation) {
        if (!this.id.equals(generation.getId())) {
            throw new IllegalArgumentException("Generation id mismatch: " + this.id + " vs " + generation.getId());
        }
        this.status = generation.getStatus();
        this.error = generation.getError();
        this.imageUrl = generation.getImageUrl();
        this.seed = generation.getSeed();
        this.startedAt = generation.getStartedAt();
        this.completedAt = generation.getCompletedAt();
    }
}
