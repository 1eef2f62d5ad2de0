package com.flagship.credit_ledger.outbox;

/**
 * Aggregate types written to the outbox. The publisher routes on these.
 */
public final class AggregateTypes {

    public static final String GENERATION_JOB = "GenerationJob";
    public static final String USER_NOTIFICATION = "UserNotification";

    private AggregateTypes() {
    }
}
