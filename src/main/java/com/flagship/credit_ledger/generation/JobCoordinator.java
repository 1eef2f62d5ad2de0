package com.flagship.credit_ledger.generation;

import com.flagship.credit_ledger.ledger.CreditLedger;
import com.flagship.credit_ledger.ledger.CreditPricing;
import com.flagship.credit_ledger.ledger.InsufficientCreditsException;
import com.flagship.credit_ledger.notification.GenerationCompletedNotification;
import com.flagship.credit_ledger.notification.GenerationFailedNotification;
import com.flagship.credit_ledger.notification.UserNotifier;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.CreditMetrics;
import com.flagship.credit_ledger.referral.ReferralService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Drives generation jobs through their lifecycle and keeps the credit ledger in
 * step with it:
 *
 * <pre>
 *   createJob      PENDING -> RESERVED     reserve(cost)
 *   markProcessing RESERVED -> PROCESSING
 *   complete       -> COMPLETED            commit(cost), activate the user's referral
 *   fail           -> FAILED               release(cost)
 * </pre>
 *
 * Each transition runs in one transaction holding the generation row lock, with
 * the ledger call inside it, so a job's status and its ledger rows never
 * disagree. Worker reports may arrive late or more than once; repeats and
 * reports that lost the race against a terminal state are no-ops.
 */
@Service
@Slf4j
public class JobCoordinator {

    public static final String CANCELLED_BY_USER = "CANCELLED_BY_USER";

    private static final Set<GenerationStatus> ACTIVE = EnumSet.of(GenerationStatus.RESERVED, GenerationStatus.PROCESSING);

    private final GenerationRepository generationRepository;
    private final CreditLedger creditLedger;
    private final CreditPricing pricing;
    private final JobQueue jobQueue;
    private final UserNotifier userNotifier;
    private final ReferralService referralService;
    private final CreditMetrics creditMetrics;
    private final long maxActivePerUser;
    private final long maxQueueSize;

    public JobCoordinator(GenerationRepository generationRepository,
                          CreditLedger creditLedger,
                          CreditPricing pricing,
                          JobQueue jobQueue,
                          UserNotifier userNotifier,
                          ReferralService referralService,
                          CreditMetrics creditMetrics,
                          @Value("${generation.limits.max-active-per-user:1}") long maxActivePerUser,
                          @Value("${generation.limits.max-queue-size:100}") long maxQueueSize) {
        this.generationRepository = generationRepository;
        this.creditLedger = creditLedger;
        this.pricing = pricing;
        this.jobQueue = jobQueue;
        this.userNotifier = userNotifier;
        this.referralService = referralService;
        this.creditMetrics = creditMetrics;
        this.maxActivePerUser = maxActivePerUser;
        this.maxQueueSize = maxQueueSize;
    }

    /**
     * Reserves the generation cost, persists the job as RESERVED and enqueues it,
     * all in one transaction. If any step fails nothing is kept: no reservation,
     * no row, no dispatch.
     *
     * @throws InsufficientCreditsException if the user cannot pay
     * @throws GenerationLimitExceededException if admission limits are reached
     */
    @Transactional
    public Generation createJob(long userId, String prompt, List<String> referenceImages,
                                Map<String, Object> settings) {
        Generation generation = Generation.create(userId, prompt, referenceImages, settings,
                pricing.generationCost());

        MDC.put(CorrelationContext.USER_ID_MDC_KEY, String.valueOf(userId));
        MDC.put(CorrelationContext.GENERATION_ID_MDC_KEY, generation.getId().toString());
        try {
            // Reserve first: the balance row lock it takes serializes this user's
            // admission checks below.
            creditLedger.reserve(userId, generation.getCost(), generation.getId());
            checkAdmission(userId);

            Generation reserved = generation.reserve();
            generationRepository.save(GenerationEntity.fromDomain(reserved));
            jobQueue.enqueue(GenerationJobMessage.from(reserved));

            creditMetrics.recordGenerationTransition(GenerationStatus.RESERVED.name());
            log.info("Generation created: cost={}, referenceImages={}", reserved.getCost(),
                    reserved.getReferenceImages().size());
            return reserved;

        } catch (InsufficientCreditsException e) {
            creditMetrics.recordGenerationRejected("insufficient_credits");
            log.info("Generation rejected: requested={}, available={}", e.getRequested(), e.getAvailable());
            throw e;
        } catch (GenerationLimitExceededException e) {
            creditMetrics.recordGenerationRejected(e.getReason());
            log.info("Generation rejected: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.GENERATION_ID_MDC_KEY);
        }
    }

    /**
     * RESERVED -> PROCESSING. A no-op in any other status.
     */
    @Transactional
    public Generation markProcessing(String jobId) {
        GenerationEntity entity = lockByJobId(jobId);
        Generation generation = entity.toDomain();

        if (generation.getStatus() != GenerationStatus.RESERVED) {
            log.debug("Ignoring start report for job {} in {} status", jobId, generation.getStatus());
            return generation;
        }

        Generation processing = generation.markProcessing();
        entity.updateFromDomain(processing);
        generationRepository.save(entity);

        creditMetrics.recordGenerationTransition(GenerationStatus.PROCESSING.name());
        log.info("Generation {} processing", generation.getId());
        return processing;
    }

    /**
     * Commits the reservation and records the result. Repeated completions are
     * no-ops; a completion for a job that already FAILED is ignored because its
     * credits were refunded.
     */
    @Transactional
    public Generation complete(String jobId, GenerationResult result) {
        GenerationEntity entity = lockByJobId(jobId);
        Generation generation = entity.toDomain();

        if (generation.getStatus() == GenerationStatus.COMPLETED) {
            log.debug("Job {} already completed", jobId);
            return generation;
        }
        if (generation.getStatus() == GenerationStatus.FAILED) {
            log.warn("Ignoring completion of job {}: already failed with {}", jobId, generation.getError());
            creditMetrics.recordGenerationRejected("late_completion");
            return generation;
        }

        creditLedger.commit(generation.getUserId(), generation.getCost(), generation.getId());
        Generation completed = generation.complete(result.getImageUrl(), result.getSeed());
        entity.updateFromDomain(completed);
        generationRepository.save(entity);

        userNotifier.notify(GenerationCompletedNotification.of(completed.getUserId(), completed.getId(),
                completed.getImageUrl(), completed.getSeed(), completed.getCost()));
        referralService.activateReferral(completed.getUserId());

        creditMetrics.recordGenerationTransition(GenerationStatus.COMPLETED.name());
        log.info("Generation {} completed: charged {} credits", completed.getId(), completed.getCost());
        return completed;
    }

    /**
     * Releases the reservation and records the error. Repeated failures are
     * no-ops; a failure for a job that already COMPLETED is ignored.
     */
    @Transactional
    public Generation fail(String jobId, String error) {
        return failLocked(lockByJobId(jobId), error);
    }

    @Transactional
    public Generation report(String jobId, WorkerOutcome outcome) {
        return switch (outcome.getType()) {
            case COMPLETED -> complete(jobId, outcome.getResult());
            case FAILED -> fail(jobId, outcome.getError());
        };
    }

    /**
     * User cancel of an active job. Jobs of other users are reported as not found.
     *
     * @throws IllegalStateException if the job already finished
     */
    @Transactional
    public Generation cancel(UUID generationId, long userId) {
        GenerationEntity entity = generationRepository.findByIdForUpdate(generationId)
                .orElseThrow(() -> new GenerationNotFoundException(generationId.toString()));
        if (entity.getUserId() != userId) {
            log.warn("User {} tried to cancel generation {} owned by another user", userId, generationId);
            throw new GenerationNotFoundException(generationId.toString());
        }
        if (entity.getStatus().isTerminal()) {
            throw new IllegalStateException(String.format(
                    "Generation %s is already %s and cannot be canceled", generationId, entity.getStatus()));
        }
        return failLocked(entity, CANCELLED_BY_USER);
    }

    /**
     * Fails a job the watchdog found stuck, after re-checking under the row lock
     * that it is still in the same stage and still past the cutoff.
     *
     * @return true if the job was failed
     */
    @Transactional
    public boolean failIfStuck(UUID generationId, GenerationStatus stage, Instant cutoff, String error) {
        GenerationEntity entity = generationRepository.findByIdForUpdate(generationId).orElse(null);
        if (entity == null || entity.getStatus() != stage) {
            return false;
        }
        Instant since = stage == GenerationStatus.PROCESSING ? entity.getStartedAt() : entity.getCreatedAt();
        if (since == null || !since.isBefore(cutoff)) {
            return false;
        }
        failLocked(entity, error);
        return true;
    }

    @Transactional(readOnly = true)
    public Generation getGeneration(UUID generationId) {
        return generationRepository.findById(generationId)
                .map(GenerationEntity::toDomain)
                .orElseThrow(() -> new GenerationNotFoundException(generationId.toString()));
    }

    @Transactional(readOnly = true)
    public List<Generation> getGenerations(long userId) {
        return generationRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(GenerationEntity::toDomain)
                .toList();
    }

    private Generation failLocked(GenerationEntity entity, String error) {
        Generation generation = entity.toDomain();

        if (generation.getStatus() == GenerationStatus.FAILED) {
            log.debug("Job {} already failed", generation.getJobId());
            return generation;
        }
        if (generation.getStatus() == GenerationStatus.COMPLETED) {
            log.warn("Ignoring failure of job {}: already completed", generation.getJobId());
            creditMetrics.recordGenerationRejected("late_failure");
            return generation;
        }

        creditLedger.release(generation.getUserId(), generation.getCost(), generation.getId());
        Generation failed = generation.fail(error);
        entity.updateFromDomain(failed);
        generationRepository.save(entity);

        userNotifier.notify(GenerationFailedNotification.of(failed.getUserId(), failed.getId(),
                failed.getError(), failed.getCost()));

        creditMetrics.recordGenerationTransition(GenerationStatus.FAILED.name());
        log.info("Generation {} failed: error={}, refunded {} credits", failed.getId(), error, failed.getCost());
        return failed;
    }

    private void checkAdmission(long userId) {
        long active = generationRepository.countByUserIdAndStatusIn(userId, ACTIVE);
        if (active >= maxActivePerUser) {
            throw new GenerationLimitExceededException("user_limit", maxActivePerUser, String.format(
                    "User %d already has %d active generation(s); limit is %d", userId, active, maxActivePerUser));
        }
        long queued = generationRepository.countByStatusIn(ACTIVE);
        if (queued >= maxQueueSize) {
            throw new GenerationLimitExceededException("queue_full", maxQueueSize, String.format(
                    "Generation queue is full (%d jobs)", queued));
        }
    }

    private GenerationEntity lockByJobId(String jobId) {
        return generationRepository.findByJobIdForUpdate(jobId)
                .orElseThrow(() -> new GenerationNotFoundException(jobId));
    }
}
