package com.flagship.credit_ledger.referral;

import com.flagship.credit_ledger.ledger.CreditLedger;
import com.flagship.credit_ledger.ledger.LedgerResult;
import com.flagship.credit_ledger.ledger.TransactionKind;
import com.flagship.credit_ledger.notification.ReferralRewardedNotification;
import com.flagship.credit_ledger.notification.UserNotifier;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Credits granted outside of purchases: the signup bonus (welcome or referral)
 * and the referrer's reward once an invited user activates.
 *
 * Every grant goes through {@link CreditLedger#grant} with a reference derived
 * from the user id, so a bonus is granted at most once per user however often
 * registration or activation is retried. A user gets one signup bonus, never both.
 *
 * Rewards per referrer are capped per UTC day. Activations for one referrer are
 * serialized by locking that referrer's referral rows, so the cap holds under
 * concurrent activations.
 */
@Service
@Slf4j
public class ReferralService {

    static final String CODE_PREFIX = "ref_";

    private final JdbcTemplate jdbcTemplate;
    private final CreditLedger creditLedger;
    private final UserNotifier userNotifier;
    private final CreditMetrics creditMetrics;
    private final long welcomeBonus;
    private final long referralBonus;
    private final long referrerReward;
    private final long dailyRewardCap;
    private final boolean activationRequired;

    public ReferralService(JdbcTemplate jdbcTemplate,
                           CreditLedger creditLedger,
                           UserNotifier userNotifier,
                           CreditMetrics creditMetrics,
                           @Value("${referral.welcome-bonus:20}") long welcomeBonus,
                           @Value("${referral.referral-bonus:30}") long referralBonus,
                           @Value("${referral.referrer-reward:30}") long referrerReward,
                           @Value("${referral.daily-reward-cap:10}") long dailyRewardCap,
                           @Value("${referral.activation-required:true}") boolean activationRequired) {
        this.jdbcTemplate = jdbcTemplate;
        this.creditLedger = creditLedger;
        this.userNotifier = userNotifier;
        this.creditMetrics = creditMetrics;
        this.welcomeBonus = welcomeBonus;
        this.referralBonus = referralBonus;
        this.referrerReward = referrerReward;
        this.dailyRewardCap = dailyRewardCap;
        this.activationRequired = activationRequired;
    }

    public static String referralCode(long userId) {
        return CODE_PREFIX + userId;
    }

    static UUID signupReference(long userId) {
        return UUID.nameUUIDFromBytes(("signup-bonus:" + userId).getBytes(StandardCharsets.UTF_8));
    }

    static UUID rewardReference(long referredUserId) {
        return UUID.nameUUIDFromBytes(("referrer-reward:" + referredUserId).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Grants the signup bonus on a user's first contact. An unusable referral code
     * (malformed, the user's own, or naming an unknown user) falls back to the
     * welcome bonus.
     */
    @Transactional
    public RegistrationResult registerUser(long userId, String referrerCode) {
        UUID reference = signupReference(userId);
        if (creditLedger.findTransaction(TransactionKind.GRANT, reference).isPresent()) {
            log.debug("User {} already registered", userId);
            return RegistrationResult.existing(userId);
        }

        Long referrerId = resolveReferrer(userId, referrerCode);
        SignupBonus bonus = referrerId != null ? SignupBonus.REFERRAL : SignupBonus.WELCOME;
        long amount = referrerId != null ? referralBonus : welcomeBonus;

        LedgerResult result = creditLedger.grant(userId, amount, reference);
        if (result.isDuplicate()) {
            // a concurrent registration got there first
            return RegistrationResult.existing(userId);
        }

        if (referrerId != null) {
            jdbcTemplate.update(
                "INSERT INTO referrals (referred_user_id, referrer_id, status, registered_at) " +
                "VALUES (?, ?, ?, ?) ON CONFLICT (referred_user_id) DO NOTHING",
                userId, referrerId, ReferralStatus.REGISTERED.name(), Timestamp.from(Instant.now()));
            if (!activationRequired) {
                lockReferralsOf(referrerId);
                reward(referrerId, userId);
            }
        }

        creditMetrics.recordBonus(bonus.name());
        log.info("Registered user {} with {} bonus of {} credits (referrer: {})", userId, bonus, amount, referrerId);
        return new RegistrationResult(userId, bonus, amount, referrerId);
    }

    /**
     * Marks the user's referral activated and rewards the referrer unless the
     * referrer hit the daily cap. Called when the user's generation completes;
     * only the first activation does anything.
     *
     * @return true if the referrer was rewarded by this call
     */
    @Transactional
    public boolean activateReferral(long userId) {
        if (!activationRequired) {
            return false;
        }
        List<Long> referrer = jdbcTemplate.queryForList(
            "SELECT referrer_id FROM referrals WHERE referred_user_id = ? AND status = ?",
            Long.class, userId, ReferralStatus.REGISTERED.name());
        if (referrer.isEmpty()) {
            return false;
        }

        long referrerId = referrer.get(0);
        lockReferralsOf(referrerId);

        String status = jdbcTemplate.queryForObject(
            "SELECT status FROM referrals WHERE referred_user_id = ?", String.class, userId);
        if (!ReferralStatus.REGISTERED.name().equals(status)) {
            return false;
        }
        return reward(referrerId, userId);
    }

    @Transactional(readOnly = true)
    public ReferralStats getStats(long userId) {
        Map<String, Object> counts = jdbcTemplate.queryForMap(
            "SELECT COUNT(*) AS total, " +
            "COUNT(*) FILTER (WHERE status IN ('ACTIVATED', 'REWARDED')) AS activated, " +
            "COUNT(*) FILTER (WHERE status = 'REWARDED') AS rewarded " +
            "FROM referrals WHERE referrer_id = ?",
            userId);
        long rewarded = ((Number) counts.get("rewarded")).longValue();
        return new ReferralStats(userId, referralCode(userId),
                ((Number) counts.get("total")).longValue(),
                ((Number) counts.get("activated")).longValue(),
                rewarded,
                rewarded * referrerReward);
    }

    /**
     * Caller holds the referrer's referral row locks.
     */
    private boolean reward(long referrerId, long referredUserId) {
        Instant now = Instant.now();
        Long rewardedToday = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM referrals WHERE referrer_id = ? AND status = ? AND rewarded_at >= ?",
            Long.class, referrerId, ReferralStatus.REWARDED.name(),
            Timestamp.from(now.truncatedTo(ChronoUnit.DAYS)));

        if (rewardedToday != null && rewardedToday >= dailyRewardCap) {
            jdbcTemplate.update(
                "UPDATE referrals SET status = ?, activated_at = COALESCE(activated_at, ?) WHERE referred_user_id = ?",
                ReferralStatus.ACTIVATED.name(), Timestamp.from(now), referredUserId);
            creditMetrics.recordBonus("referrer_capped");
            log.warn("Referrer {} reached the daily reward cap ({}); user {} activated without reward",
                    referrerId, dailyRewardCap, referredUserId);
            return false;
        }

        UUID reference = rewardReference(referredUserId);
        LedgerResult result = creditLedger.grant(referrerId, referrerReward, reference);
        jdbcTemplate.update(
            "UPDATE referrals SET status = ?, activated_at = COALESCE(activated_at, ?), rewarded_at = ? " +
            "WHERE referred_user_id = ?",
            ReferralStatus.REWARDED.name(), Timestamp.from(now), Timestamp.from(now), referredUserId);

        if (!result.isDuplicate()) {
            userNotifier.notify(ReferralRewardedNotification.of(referrerId, referredUserId, reference,
                    referrerReward, result.getAvailableAfter()));
            creditMetrics.recordBonus("referrer_reward");
        }
        log.info("Referrer {} rewarded {} credits for user {}", referrerId, referrerReward, referredUserId);
        return true;
    }

    private void lockReferralsOf(long referrerId) {
        jdbcTemplate.queryForList(
            "SELECT referred_user_id FROM referrals WHERE referrer_id = ? ORDER BY referred_user_id FOR UPDATE",
            Long.class, referrerId);
    }

    private Long resolveReferrer(long userId, String referrerCode) {
        if (referrerCode == null || referrerCode.isBlank()) {
            return null;
        }
        if (!referrerCode.startsWith(CODE_PREFIX)) {
            log.warn("Ignoring malformed referral code {} for user {}", referrerCode, userId);
            return null;
        }

        long referrerId;
        try {
            referrerId = Long.parseLong(referrerCode.substring(CODE_PREFIX.length()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed referral code {} for user {}", referrerCode, userId);
            return null;
        }

        if (referrerId == userId) {
            log.warn("User {} tried to refer themselves", userId);
            return null;
        }
        if (!creditLedger.hasAccount(referrerId)) {
            log.warn("Referrer {} for user {} is unknown", referrerId, userId);
            return null;
        }
        return referrerId;
    }
}
