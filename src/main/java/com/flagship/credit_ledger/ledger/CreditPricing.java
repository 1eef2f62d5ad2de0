package com.flagship.credit_ledger.ledger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;

/**
 * Single source of truth for what a credit costs and what a generation costs.
 *
 * Topups convert roubles to credits at a fixed rate (whole credits, rounded down);
 * every generation reserves the same fixed number of credits. Nothing else in the
 * code derives prices on its own.
 */
@Component
public class CreditPricing {

    private final long creditsPerRub;
    private final long generationCost;
    private final long[] packages;
    private final BigDecimal minRub;
    private final BigDecimal maxRub;

    public CreditPricing(
            @Value("${credits.pricing.credits-per-rub:1}") long creditsPerRub,
            @Value("${credits.pricing.generation-cost:10}") long generationCost,
            @Value("${credits.pricing.packages:100,200,300}") long[] packages,
            @Value("${credits.pricing.min-rub:10}") BigDecimal minRub,
            @Value("${credits.pricing.max-rub:100000}") BigDecimal maxRub) {
        if (creditsPerRub <= 0 || generationCost <= 0) {
            throw new IllegalArgumentException("Credit rate and generation cost must be positive");
        }
        this.creditsPerRub = creditsPerRub;
        this.generationCost = generationCost;
        this.packages = packages.clone();
        this.minRub = minRub;
        this.maxRub = maxRub;
    }

    public long generationCost() {
        return generationCost;
    }

    /**
     * Credits bought by a topup of the given amount.
     *
     * @throws IllegalArgumentException if the amount is outside the allowed range
     *         or would buy no credits at all
     */
    public long creditsFor(BigDecimal rubAmount) {
        if (rubAmount == null) {
            throw new IllegalArgumentException("Topup amount is required");
        }
        if (rubAmount.compareTo(minRub) < 0 || rubAmount.compareTo(maxRub) > 0) {
            throw new IllegalArgumentException(String.format(
                    "Topup amount must be between %s and %s RUB, got %s", minRub, maxRub, rubAmount));
        }
        long credits = rubAmount.multiply(BigDecimal.valueOf(creditsPerRub))
                .setScale(0, RoundingMode.DOWN)
                .longValueExact();
        if (credits <= 0) {
            throw new IllegalArgumentException("Topup amount " + rubAmount + " buys no credits");
        }
        return credits;
    }

    public List<TopupPackage> packages() {
        return Arrays.stream(packages)
                .mapToObj(rub -> new TopupPackage(BigDecimal.valueOf(rub), rub * creditsPerRub))
                .toList();
    }
}
