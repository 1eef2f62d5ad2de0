package com.flagship.credit_ledger.scheduling;

import com.flagship.credit_ledger.consumer.IdempotentEventProcessor;
import com.flagship.credit_ledger.generation.GenerationWatchdog;
import com.flagship.credit_ledger.ledger.BalanceDrift;
import com.flagship.credit_ledger.ledger.LedgerAuditService;
import com.flagship.credit_ledger.outbox.OutboxService;
import com.flagship.credit_ledger.payment.TopupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic background work. Every task is safe to run concurrently on several
 * instances: each takes row locks and re-checks state before changing anything.
 */
@Component
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MaintenanceScheduler {

    private final GenerationWatchdog generationWatchdog;
    private final TopupService topupService;
    private final LedgerAuditService ledgerAuditService;
    private final OutboxService outboxService;
    private final IdempotentEventProcessor eventProcessor;
    private final Duration retention;

    public MaintenanceScheduler(GenerationWatchdog generationWatchdog,
                                TopupService topupService,
                                LedgerAuditService ledgerAuditService,
                                OutboxService outboxService,
                                IdempotentEventProcessor eventProcessor,
                                @Value("${maintenance.retention-days:7}") long retentionDays) {
        this.generationWatchdog = generationWatchdog;
        this.topupService = topupService;
        this.ledgerAuditService = ledgerAuditService;
        this.outboxService = outboxService;
        this.eventProcessor = eventProcessor;
        this.retention = Duration.ofDays(retentionDays);
    }

    @Scheduled(fixedDelayString = "${generation.watchdog.interval-ms:60000}")
    public void sweepStuckGenerations() {
        try {
            generationWatchdog.sweep();
        } catch (RuntimeException e) {
            log.error("Generation watchdog sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${payment.topup.expiry-interval-ms:300000}")
    public void expireStaleTopups() {
        try {
            topupService.expireStaleTopups();
        } catch (RuntimeException e) {
            log.error("Topup expiry sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${ledger.audit.interval-ms:3600000}", initialDelayString = "${ledger.audit.initial-delay-ms:60000}")
    public void auditBalances() {
        try {
            List<BalanceDrift> drifts = ledgerAuditService.auditAll();
            if (drifts.isEmpty()) {
                log.debug("Balance audit found no drift");
            }
        } catch (RuntimeException e) {
            log.error("Balance audit failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${maintenance.purge-cron:0 30 3 * * *}")
    public void purgeHistory() {
        Instant cutoff = Instant.now().minus(retention);
        try {
            int events = outboxService.purgePublishedBefore(cutoff);
            int processed = eventProcessor.purgeProcessedBefore(cutoff);
            log.info("Purged {} published outbox events and {} processed event records older than {}",
                    events, processed, cutoff);
        } catch (RuntimeException e) {
            log.error("History purge failed: {}", e.getMessage(), e);
        }
    }
}
