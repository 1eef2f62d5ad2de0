package com.flagship.credit_ledger.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Short transactions around topups and their payment records. Topup initiation
 * calls the provider between two of these, never inside one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopupPersistenceService {

    private final TopupRepository topupRepository;
    private final PaymentRecordRepository paymentRecordRepository;

    @Transactional
    public Topup save(Topup topup) {
        TopupEntity saved = topupRepository.save(TopupEntity.fromDomain(topup));
        log.debug("Saved topup {} for user {}", saved.getId(), saved.getUserId());
        return saved.toDomain();
    }

    /**
     * Links the provider payment to the topup before any webhook for it can arrive.
     */
    @Transactional
    public void recordPendingPayment(String paymentId, UUID topupId) {
        paymentRecordRepository.save(PaymentRecordEntity.pending(paymentId, topupId));
        log.debug("Recorded pending payment {} for topup {}", paymentId, topupId);
    }

    /**
     * Fails a topup whose payment could not be started. A topup that already left
     * CREATED is returned unchanged.
     */
    @Transactional
    public Topup markFailed(UUID topupId) {
        TopupEntity entity = topupRepository.findByIdForUpdate(topupId)
                .orElseThrow(() -> new TopupNotFoundException(topupId));
        Topup topup = entity.toDomain();
        if (topup.getStatus() != TopupStatus.CREATED) {
            return topup;
        }
        Topup failed = topup.markFailed();
        entity.updateFromDomain(failed);
        topupRepository.save(entity);
        return failed;
    }

    @Transactional(readOnly = true)
    public Optional<Topup> findById(UUID topupId) {
        return topupRepository.findById(topupId).map(TopupEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Topup> findByUser(long userId) {
        return topupRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(TopupEntity::toDomain)
                .toList();
    }

    /**
     * Expires CREATED topups older than the cutoff. Rows are locked, so a webhook
     * for one of them waits and then sees the expired status.
     */
    @Transactional
    public List<Topup> expireStaleTopups(Instant cutoff) {
        List<Topup> expired = new ArrayList<>();
        for (TopupEntity entity : topupRepository.findByStatusCreatedBeforeForUpdate(TopupStatus.CREATED, cutoff)) {
            Topup topup = entity.toDomain().expire();
            entity.updateFromDomain(topup);
            topupRepository.save(entity);
            expired.add(topup);
        }
        return expired;
    }
}
