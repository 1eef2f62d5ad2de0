package com.flagship.credit_ledger.payment;

/**
 * A webhook failed signature verification, or an operator call carried no
 * valid token. Permanent: the same request will never be accepted.
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
