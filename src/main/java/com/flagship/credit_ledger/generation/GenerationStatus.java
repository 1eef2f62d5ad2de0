package com.flagship.credit_ledger.generation;

/**
 * Lifecycle of a generation job.
 * PENDING -> RESERVED -> PROCESSING -> COMPLETED | FAILED
 */
public enum GenerationStatus {
    /**
     * Created in memory, credits not yet reserved. Never visible outside the
     * creating transaction.
     */
    PENDING,

    /**
     * Credits reserved, job queued for a worker.
     */
    RESERVED,

    /**
     * A worker picked the job up.
     */
    PROCESSING,

    /**
     * Image delivered, reservation committed. Terminal.
     */
    COMPLETED,

    /**
     * Job failed or was canceled, reservation released. Terminal.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Holds reserved credits.
     */
    public boolean isActive() {
        return this == RESERVED || this == PROCESSING;
    }
}
