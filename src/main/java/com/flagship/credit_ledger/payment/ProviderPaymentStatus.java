package com.flagship.credit_ledger.payment;

import java.util.Locale;

/**
 * Payment status as reported by the provider.
 * Only SUCCEEDED and CANCELED are final; the rest are acknowledged and ignored.
 */
public enum ProviderPaymentStatus {
    SUCCEEDED,
    CANCELED,
    PENDING,
    WAITING_FOR_CAPTURE,
    UNKNOWN;

    public static ProviderPaymentStatus fromProvider(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("CANCELLED".equals(normalized)) {
            return CANCELED;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public boolean isFinal() {
        return this == SUCCEEDED || this == CANCELED;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
