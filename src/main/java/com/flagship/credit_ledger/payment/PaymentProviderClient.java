package com.flagship.credit_ledger.payment;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Starts a payment at the external provider. Called outside any database
 * transaction.
 */
public interface PaymentProviderClient {

    /**
     * @param topupId stored in the payment metadata so the webhook can find the topup
     * @throws PaymentProviderException if the provider rejected the call or did not answer
     */
    ProviderPayment createPayment(UUID topupId, BigDecimal rubAmount, String description);
}
