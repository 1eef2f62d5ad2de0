package com.flagship.credit_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CreditPricingTest {

    private final CreditPricing pricing = new CreditPricing(1, 10, new long[]{100, 200, 300},
            new BigDecimal("10"), new BigDecimal("100000"));

    @Test
    @DisplayName("One credit per ruble, fractional kopecks are not credited")
    void creditsForRubles() {
        assertEquals(100, pricing.creditsFor(new BigDecimal("100")));
        assertEquals(150, pricing.creditsFor(new BigDecimal("150.99")));
    }

    @Test
    @DisplayName("Amounts outside the allowed range are rejected")
    void rangeIsEnforced() {
        assertThrows(IllegalArgumentException.class, () -> pricing.creditsFor(new BigDecimal("9.99")));
        assertThrows(IllegalArgumentException.class, () -> pricing.creditsFor(new BigDecimal("100000.01")));
        assertThrows(IllegalArgumentException.class, () -> pricing.creditsFor(null));
    }

    @Test
    @DisplayName("Packages are priced with the same rate")
    void packages() {
        List<TopupPackage> packages = pricing.packages();

        assertEquals(3, packages.size());
        assertEquals(0, new BigDecimal("200").compareTo(packages.get(1).getRubAmount()));
        assertEquals(200, packages.get(1).getCredits());
    }

    @Test
    @DisplayName("Generation cost is fixed")
    void generationCost() {
        assertEquals(10, pricing.generationCost());
    }

    @Test
    @DisplayName("Non-positive rates are refused at startup")
    void invalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new CreditPricing(0, 10, new long[]{100},
                BigDecimal.ONE, BigDecimal.TEN));
    }
}
