package com.flagship.credit_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Sent to a referrer when a user they invited activates and the reward is granted.
 */
@Value
public class ReferralRewardedNotification implements UserNotification {
    UUID eventId;
    long userId;
    long referredUserId;
    UUID rewardReferenceId;
    long creditsGranted;
    long availableCredits;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ReferralRewarded";

    public static ReferralRewardedNotification of(long referrerId, long referredUserId, UUID rewardReferenceId,
                                                  long creditsGranted, long availableCredits) {
        return new ReferralRewardedNotification(UUID.randomUUID(), referrerId, referredUserId, rewardReferenceId,
                creditsGranted, availableCredits, Instant.now());
    }

    @Override
    public UUID getSubjectId() {
        return rewardReferenceId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
