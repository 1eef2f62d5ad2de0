package com.flagship.credit_ledger.generation;

import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Fails jobs whose worker never reported back, releasing their credits.
 *
 * Candidates are listed without locks; each one is then failed in its own
 * transaction by the coordinator, which re-checks its status under the row lock.
 * A failure on one job does not stop the sweep.
 */
@Component
@Slf4j
public class GenerationWatchdog {

    private final GenerationRepository generationRepository;
    private final JobCoordinator jobCoordinator;
    private final CreditMetrics creditMetrics;
    private final Duration processingTimeout;
    private final Duration reservedTimeout;

    public GenerationWatchdog(GenerationRepository generationRepository,
                              JobCoordinator jobCoordinator,
                              CreditMetrics creditMetrics,
                              @Value("${generation.watchdog.processing-timeout-seconds:600}") long processingTimeoutSeconds,
                              @Value("${generation.watchdog.reserved-timeout-seconds:1800}") long reservedTimeoutSeconds) {
        this.generationRepository = generationRepository;
        this.jobCoordinator = jobCoordinator;
        this.creditMetrics = creditMetrics;
        this.processingTimeout = Duration.ofSeconds(processingTimeoutSeconds);
        this.reservedTimeout = Duration.ofSeconds(reservedTimeoutSeconds);
    }

    /**
     * @return number of jobs failed by this sweep
     */
    public int sweep() {
        Instant now = Instant.now();
        int failed = sweepStage(GenerationStatus.PROCESSING, now.minus(processingTimeout), processingTimeout);
        failed += sweepStage(GenerationStatus.RESERVED, now.minus(reservedTimeout), reservedTimeout);
        if (failed > 0) {
            log.warn("Watchdog failed {} stuck generation(s)", failed);
        }
        return failed;
    }

    static String timeoutError(Duration limit) {
        return "TIMEOUT: Generation exceeded " + limit.toSeconds() + "s limit";
    }

    private int sweepStage(GenerationStatus stage, Instant cutoff, Duration limit) {
        List<UUID> candidates = stage == GenerationStatus.PROCESSING
                ? generationRepository.findIdsStartedBefore(stage, cutoff)
                : generationRepository.findIdsCreatedBefore(stage, cutoff);

        int failed = 0;
        for (UUID generationId : candidates) {
            try {
                if (jobCoordinator.failIfStuck(generationId, stage, cutoff, timeoutError(limit))) {
                    creditMetrics.recordWatchdogTimeout(stage.name());
                    log.warn("Generation {} timed out in {} after {}", generationId, stage, limit);
                    failed++;
                }
            } catch (RuntimeException e) {
                log.error("Watchdog could not fail generation {}: {}", generationId, e.getMessage(), e);
            }
        }
        return failed;
    }
}
