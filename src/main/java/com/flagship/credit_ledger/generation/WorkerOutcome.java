package com.flagship.credit_ledger.generation;

import lombok.Value;

/**
 * Final report of a worker: either a result or an error, never both.
 */
@Value
public class WorkerOutcome {

    public enum Type {
        COMPLETED,
        FAILED
    }

    Type type;
    GenerationResult result;
    String error;

    public static WorkerOutcome completed(GenerationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Completed outcome needs a result");
        }
        return new WorkerOutcome(Type.COMPLETED, result, null);
    }

    public static WorkerOutcome failed(String error) {
        return new WorkerOutcome(Type.FAILED, null, error == null || error.isBlank() ? "UNKNOWN_ERROR" : error);
    }
}
