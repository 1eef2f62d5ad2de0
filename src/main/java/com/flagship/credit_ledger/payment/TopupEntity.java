package com.flagship.credit_ledger.payment;

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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the topups table.
 *
 * No setters: the only writes go through fromDomain/updateFromDomain so status
 * changes always pass the Topup state machine first.
 */
@Entity
@Table(name = "topups")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TopupEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private long userId;

    @Column(name = "rub_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal rubAmount;

    @Column(nullable = false, updatable = false)
    private long credits;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TopupStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "paid_at")
    private Instant paidAt;

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

    static TopupEntity fromDomain(Topup topup) {
        return new TopupEntity(
            topup.getId(),
            topup.getUserId(),
            topup.getRubAmount(),
            topup.getCredits(),
            topup.getStatus(),
            topup.getCreatedAt(),
            topup.getUpdatedAt(),
            topup.getPaidAt()
        );
    }

    public Topup toDomain() {
        return new Topup(id, userId, rubAmount, credits, status, createdAt, updatedAt, paidAt);
    }

    /**
     * Copies the mutable part (status, paid_at) from the domain object.
     */
    void updateFromDomain(Topup topup) {
        if (!this.id.equals(topup.getId())) {
            throw new IllegalArgumentException("Topup id mismatch: " + this.id + " vs " + topup.getId());
        }
        this.status = topup.getStatus();
        this.paidAt = topup.getPaidAt();
    }
}
