package com.flagship.credit_ledger.generation;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GenerationRepository extends JpaRepository<GenerationEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM GenerationEntity g WHERE g.jobId = :jobId")
    Optional<GenerationEntity> findByJobIdForUpdate(@Param("jobId") String jobId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM GenerationEntity g WHERE g.id = :id")
    Optional<GenerationEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByUserIdAndStatusIn(long userId, Collection<GenerationStatus> statuses);

    long countByStatusIn(Collection<GenerationStatus> statuses);

    List<GenerationEntity> findByUserIdOrderByCreatedAtDesc(long userId);

    /**
     * Workers that started before the cutoff and never reported back.
     */
    @Query("SELECT g.id FROM GenerationEntity g WHERE g.status = :status AND g.startedAt < :cutoff ORDER BY g.startedAt")
    List<UUID> findIdsStartedBefore(@Param("status") GenerationStatus status, @Param("cutoff") Instant cutoff);

    /**
     * Jobs queued before the cutoff that no worker picked up.
     */
    @Query("SELECT g.id FROM GenerationEntity g WHERE g.status = :status AND g.createdAt < :cutoff ORDER BY g.createdAt")
    List<UUID> findIdsCreatedBefore(@Param("status") GenerationStatus status, @Param("cutoff") Instant cutoff);
}
