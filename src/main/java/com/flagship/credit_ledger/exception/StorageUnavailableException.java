package com.flagship.credit_ledger.exception;

/**
 * The database could not be reached or the transaction could not complete.
 * Transient: nothing was committed, so the caller may retry.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
