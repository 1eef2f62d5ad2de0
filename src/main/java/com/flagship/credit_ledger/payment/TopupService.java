package com.flagship.credit_ledger.payment;

import com.flagship.credit_ledger.ledger.CreditPricing;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Starts credit purchases and expires the ones nobody paid for.
 *
 * Not transactional: initiation saves the topup, calls the provider with no
 * transaction open, then records the pending payment.
 */
@Service
@Slf4j
public class TopupService {

    private final CreditPricing pricing;
    private final TopupPersistenceService persistenceService;
    private final PaymentProviderClient providerClient;
    private final CreditMetrics creditMetrics;
    private final Duration expiryAge;

    public TopupService(CreditPricing pricing,
                        TopupPersistenceService persistenceService,
                        PaymentProviderClient providerClient,
                        CreditMetrics creditMetrics,
                        @Value("${payment.topup.expiry-hours:24}") long expiryHours) {
        this.pricing = pricing;
        this.persistenceService = persistenceService;
        this.providerClient = providerClient;
        this.creditMetrics = creditMetrics;
        this.expiryAge = Duration.ofHours(expiryHours);
    }

    /**
     * @throws IllegalArgumentException if the amount is outside the allowed range
     * @throws PaymentProviderException if the provider call failed; the topup is then FAILED
     */
    public TopupInitiation initiateTopup(long userId, BigDecimal rubAmount) {
        long credits = pricing.creditsFor(rubAmount);
        Topup topup = persistenceService.save(Topup.create(userId, rubAmount, credits));
        creditMetrics.recordTopup("created");

        ProviderPayment payment;
        try {
            payment = providerClient.createPayment(topup.getId(), rubAmount, "Credits: " + credits);
        } catch (RuntimeException e) {
            persistenceService.markFailed(topup.getId());
            creditMetrics.recordTopup("provider_failed");
            log.error("Payment provider call failed for topup {}: {}", topup.getId(), e.getMessage());
            if (e instanceof PaymentProviderException) {
                throw e;
            }
            throw new PaymentProviderException("Payment provider call failed for topup " + topup.getId(), e);
        }

        persistenceService.recordPendingPayment(payment.getPaymentId(), topup.getId());
        log.info("Topup {} initiated for user {}: {} RUB -> {} credits, payment {}",
                topup.getId(), userId, rubAmount, credits, payment.getPaymentId());
        return new TopupInitiation(topup, payment.getPaymentId(), payment.getConfirmationUrl());
    }

    public Topup getTopup(UUID topupId) {
        return persistenceService.findById(topupId)
                .orElseThrow(() -> new TopupNotFoundException(topupId));
    }

    public List<Topup> getTopups(long userId) {
        return persistenceService.findByUser(userId);
    }

    /**
     * @return number of topups moved to EXPIRED
     */
    public int expireStaleTopups() {
        List<Topup> expired = persistenceService.expireStaleTopups(Instant.now().minus(expiryAge));
        expired.forEach(topup -> creditMetrics.recordTopup("expired"));
        if (!expired.isEmpty()) {
            log.info("Expired {} unpaid topups older than {}", expired.size(), expiryAge);
        }
        return expired.size();
    }
}
