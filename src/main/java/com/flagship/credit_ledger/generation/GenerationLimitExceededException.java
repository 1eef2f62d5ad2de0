package com.flagship.credit_ledger.generation;

import lombok.Getter;

/**
 * Admission refused: the user or the whole queue has too many active jobs.
 * Nothing was reserved or created.
 */
@Getter
public class GenerationLimitExceededException extends RuntimeException {

    private final String reason;
    private final long limit;

    public GenerationLimitExceededException(String reason, long limit, String message) {
        super(message);
        this.reason = reason;
        this.limit = limit;
    }
}
