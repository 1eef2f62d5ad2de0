package com.flagship.credit_ledger.payment;

/**
 * The payment provider rejected a request or did not answer in time.
 */
public class PaymentProviderException extends RuntimeException {

    public PaymentProviderException(String message) {
        super(message);
    }

    public PaymentProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
