package com.flagship.credit_ledger.payment;

import lombok.Value;

@Value
public class ProviderPayment {
    String paymentId;
    String confirmationUrl;
}
