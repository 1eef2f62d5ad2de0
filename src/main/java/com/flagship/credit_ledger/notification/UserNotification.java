package com.flagship.credit_ledger.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * A message for the bot front-end about the outcome of something the user did.
 */
public interface UserNotification {

    /**
     * Unique per notification; consumers dedup on it.
     */
    UUID getEventId();

    long getUserId();

    /**
     * The topup or generation the notification is about.
     */
    UUID getSubjectId();

    Instant getOccurredAt();

    String getEventType();
}
