package com.flagship.credit_ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
import java.util.UUID;

/**
 * Local mirror of one provider payment.
 *
 * processed_at is null until the webhook side effect (grant or failure) has
 * committed. Once set it never changes; the reconciler checks it under the row
 * lock to turn redelivered webhooks into no-ops.
 */
@Entity
@Table(name = "payment_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentRecordEntity {

    public static final String STATUS_PENDING = "pending";

    @Id
    @Column(name = "payment_id", nullable = false, updatable = false, length = 128)
    private String paymentId;

    @Column(name = "topup_id", nullable = false, updatable = false)
    private UUID topupId;

    @Column(nullable = false, length = 32)
    private String status;

    @Column(name = "raw_payload", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String rawPayload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentRecordEntity pending(String paymentId, UUID topupId) {
        return new PaymentRecordEntity(paymentId, topupId, STATUS_PENDING, null, null, null, null);
    }

    boolean isProcessed() {
        return processedAt != null;
    }

    /**
     * Stores the latest provider status without marking the record processed.
     */
    void recordStatus(String providerStatus, String payload) {
        if (isProcessed()) {
            throw new IllegalStateException("Payment " + paymentId + " was already processed");
        }
        this.status = providerStatus;
        this.rawPayload = payload;
    }

    /**
     * Marks the webhook side effect as done. Can only happen once.
     */
    void markProcessed(String providerStatus, String payload) {
        recordStatus(providerStatus, payload);
        this.processedAt = Instant.now();
    }
}
