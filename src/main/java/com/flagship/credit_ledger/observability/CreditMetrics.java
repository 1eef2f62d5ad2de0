package com.flagship.credit_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the credit core.
 *
 * Metrics exposed:
 * - ledger.operations: ledger calls tagged by kind and outcome
 *   (applied, rolled_back, duplicate, insufficient_credits, invariant_violation)
 * - ledger.operation.duration: timer for ledger calls
 * - ledger.invariant.violations: counter that should always read zero
 * - payment.webhooks: webhook outcomes (accepted, duplicate, rejected, ignored)
 * - payment.topups: topup initiations by status
 * - generation.transitions: generation state changes by target status
 * - generation.rejections: create requests refused, by reason
 * - generation.watchdog.timeouts: jobs failed by the sweep
 * - ledger.audit.drift: users whose balance disagrees with the transaction log
 * - referral.bonuses: signup bonuses and referrer rewards granted, by type
 */
@Component
public class CreditMetrics {

    private final MeterRegistry registry;

    private final Counter invariantViolations;
    private final Counter auditDrifts;
    private final Timer ledgerTimer;

    public CreditMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.invariantViolations = Counter.builder("ledger.invariant.violations")
                .description("Ledger mutations refused because they would break a balance invariant")
                .register(registry);

        this.auditDrifts = Counter.builder("ledger.audit.drift")
                .description("Balances found inconsistent with the transaction log")
                .register(registry);

        this.ledgerTimer = Timer.builder("ledger.operation.duration")
                .description("Time spent inside a ledger transaction")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordLedgerOperation(String kind, String outcome) {
        registry.counter("ledger.operations",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLedgerLatency(long durationMs) {
        ledgerTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordInvariantViolation(String kind) {
        invariantViolations.increment();
        recordLedgerOperation(kind, "invariant_violation");
    }

    public void recordAuditDrift() {
        auditDrifts.increment();
    }

    // ==================== Payments ====================

    public void recordWebhook(String outcome) {
        registry.counter("payment.webhooks", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordTopup(String status) {
        registry.counter("payment.topups", "status", sanitizeTag(status)).increment();
    }

    /**
     * Records a lookup against the processed-payment cache.
     */
    public void recordPaymentCacheLookup(boolean hit) {
        registry.counter("payment.cache", "result", hit ? "hit" : "miss").increment();
    }

    // ==================== Generations ====================

    public void recordGenerationTransition(String status) {
        registry.counter("generation.transitions", "status", sanitizeTag(status)).increment();
    }

    public void recordGenerationRejected(String reason) {
        registry.counter("generation.rejections", "reason", sanitizeTag(reason)).increment();
    }

    public void recordWatchdogTimeout(String stage) {
        registry.counter("generation.watchdog.timeouts", "stage", sanitizeTag(stage)).increment();
    }

    // ==================== Referrals ====================

    public void recordBonus(String type) {
        registry.counter("referral.bonuses", "type", sanitizeTag(type)).increment();
    }

    // ==================== Event Processing ====================

    public void recordEventProcessed(String eventType, boolean wasNew) {
        Counter.builder("event.processed")
                .tag("event_type", sanitizeTag(eventType))
                .tag("was_new", String.valueOf(wasNew))
                .register(registry)
                .increment();
    }

    public void recordEventProcessingFailure(String eventType) {
        Counter.builder("event.processing.failure")
                .tag("event_type", sanitizeTag(eventType))
                .register(registry)
                .increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
