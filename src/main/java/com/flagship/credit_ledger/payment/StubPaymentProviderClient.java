package com.flagship.credit_ledger.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Provider client that issues local payment ids and checkout links. The payment
 * is later confirmed by a signed webhook like a real one.
 */
@Component
@Slf4j
public class StubPaymentProviderClient implements PaymentProviderClient {

    private final String checkoutBaseUrl;

    public StubPaymentProviderClient(
            @Value("${payment.provider.checkout-base-url:https://checkout.example.com/pay}") String checkoutBaseUrl) {
        this.checkoutBaseUrl = checkoutBaseUrl.endsWith("/")
                ? checkoutBaseUrl.substring(0, checkoutBaseUrl.length() - 1)
                : checkoutBaseUrl;
    }

    @Override
    public ProviderPayment createPayment(UUID topupId, BigDecimal rubAmount, String description) {
        if (rubAmount == null || rubAmount.signum() <= 0) {
            throw new PaymentProviderException("Provider rejected amount " + rubAmount);
        }
        String paymentId = "pay_" + UUID.randomUUID().toString().replace("-", "");
        log.info("Created provider payment {} for topup {}: {} RUB", paymentId, topupId, rubAmount);
        return new ProviderPayment(paymentId, checkoutBaseUrl + "/" + paymentId);
    }
}
