package com.flagship.credit_ledger.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRecordRepository extends JpaRepository<PaymentRecordEntity, String> {

    /**
     * Creates the record for a payment we never saw at initiation time (for example
     * when the second insert of topup initiation was lost). Concurrent deliveries of
     * the same payment race harmlessly here; the row lock taken afterwards
     * serializes them.
     */
    @Modifying
    @Query(value = """
        INSERT INTO payment_records (payment_id, topup_id, status, created_at, updated_at)
        VALUES (:paymentId, :topupId, 'pending', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        ON CONFLICT (payment_id) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("paymentId") String paymentId, @Param("topupId") UUID topupId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentRecordEntity p WHERE p.paymentId = :paymentId")
    Optional<PaymentRecordEntity> findByPaymentIdForUpdate(@Param("paymentId") String paymentId);

    List<PaymentRecordEntity> findByTopupId(UUID topupId);

    @Query("SELECT CASE WHEN COUNT(p) > 0 THEN true ELSE false END FROM PaymentRecordEntity p " +
           "WHERE p.paymentId = :paymentId AND p.processedAt IS NOT NULL")
    boolean isProcessed(@Param("paymentId") String paymentId);
}
