package com.flagship.credit_ledger.generation;

/**
 * Hands jobs to the worker pool. Delivery is at least once; workers and the
 * coordinator tolerate duplicates.
 */
public interface JobQueue {

    /**
     * Must be called inside the transaction that reserved the job's credits, so
     * the job is dispatched if and only if that transaction commits.
     */
    void enqueue(GenerationJobMessage message);
}
