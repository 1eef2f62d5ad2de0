package com.flagship.credit_ledger.generation;

public class GenerationNotFoundException extends RuntimeException {

    public GenerationNotFoundException(String idOrJobId) {
        super("Generation not found: " + idOrJobId);
    }
}
