package com.flagship.credit_ledger.payment;

import lombok.Value;

import java.util.UUID;

/**
 * The fields of a provider webhook the reconciler acts on.
 */
@Value
public class PaymentNotification {
    String paymentId;
    ProviderPaymentStatus status;
    String rawStatus;
    UUID topupId;
}
