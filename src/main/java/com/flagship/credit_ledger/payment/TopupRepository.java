package com.flagship.credit_ledger.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TopupRepository extends JpaRepository<TopupEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TopupEntity t WHERE t.id = :id")
    Optional<TopupEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Topups still waiting for payment that were created before the cutoff, locked
     * so a webhook arriving at the same moment waits for the expiry to commit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TopupEntity t WHERE t.status = :status AND t.createdAt < :cutoff ORDER BY t.createdAt")
    List<TopupEntity> findByStatusCreatedBeforeForUpdate(@Param("status") TopupStatus status,
                                                         @Param("cutoff") Instant cutoff);

    List<TopupEntity> findByUserIdOrderByCreatedAtDesc(long userId);
}
