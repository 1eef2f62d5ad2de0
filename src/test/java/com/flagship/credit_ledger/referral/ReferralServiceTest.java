package com.flagship.credit_ledger.referral;

import com.flagship.credit_ledger.generation.Generation;
import com.flagship.credit_ledger.generation.GenerationResult;
import com.flagship.credit_ledger.generation.JobCoordinator;
import com.flagship.credit_ledger.ledger.CreditLedger;
import com.flagship.credit_ledger.ledger.LedgerTransaction;
import com.flagship.credit_ledger.ledger.TransactionKind;
import com.flagship.credit_ledger.notification.ReferralRewardedNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Signup bonuses and referrer rewards against a real database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class ReferralServiceTest {

    private static final int DAILY_CAP = 2;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("test_referrals")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("scheduler.enabled", () -> "false");
        registry.add("referral.daily-reward-cap", () -> String.valueOf(DAILY_CAP));
        registry.add("generation.limits.max-queue-size", () -> "10000");
    }

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Autowired
    private ReferralService referralService;

    @Autowired
    private CreditLedger creditLedger;

    @Autowired
    private JobCoordinator jobCoordinator;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MockMvc mockMvc;

    private long userId;
    private long referrerId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static long randomUserId() {
        return ThreadLocalRandom.current().nextLong(1, 1_000_000_000_000L);
    }

    @BeforeEach
    void setUp() {
        userId = randomUserId();
        referrerId = randomUserId();
    }

    private long available(long user) {
        return creditLedger.getBalance(user).getAvailable();
    }

    private long grantCount(long user) {
        return creditLedger.getTransactions(user, 100).stream()
                .filter(t -> t.getKind() == TransactionKind.GRANT)
                .count();
    }

    private String referralStatus(long referredUserId) {
        return jdbcTemplate.queryForObject(
                "SELECT status FROM referrals WHERE referred_user_id = ?", String.class, referredUserId);
    }

    private long countRewardNotifications(long referredUserId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM outbox_events WHERE aggregate_id = ? AND event_type = ?",
                Long.class, ReferralService.rewardReference(referredUserId), ReferralRewardedNotification.EVENT_TYPE);
        return count == null ? 0 : count;
    }

    private long registerReferred(long referrer) {
        long referred = randomUserId();
        referralService.registerUser(referred, ReferralService.referralCode(referrer));
        return referred;
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("A new user without a code gets the welcome bonus")
        void welcomeBonus() {
            printTestHeader("Welcome bonus");

            RegistrationResult result = referralService.registerUser(userId, null);
            printOutput("Result", result);

            assertEquals(SignupBonus.WELCOME, result.getBonus());
            assertEquals(20, result.getCreditsGranted());
            assertEquals(20, available(userId));
        }

        @Test
        @DisplayName("Registering again grants nothing, even with a referral code the second time")
        void repeatedRegistrationGrantsOnce() {
            referralService.registerUser(referrerId, null);
            referralService.registerUser(userId, null);

            RegistrationResult again = referralService.registerUser(userId, null);
            RegistrationResult withCode = referralService.registerUser(userId, ReferralService.referralCode(referrerId));

            assertEquals(SignupBonus.EXISTING, again.getBonus());
            assertEquals(SignupBonus.EXISTING, withCode.getBonus());
            assertEquals(0, withCode.getCreditsGranted());
            assertEquals(20, available(userId));
            assertEquals(1, grantCount(userId));
            assertEquals(0L, jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM referrals WHERE referred_user_id = ?", Long.class, userId));
        }

        @Test
        @DisplayName("A valid referral code gives the referral bonus and records the referral")
        void referralBonus() {
            referralService.registerUser(referrerId, null);

            RegistrationResult result = referralService.registerUser(userId, "ref_" + referrerId);

            assertEquals(SignupBonus.REFERRAL, result.getBonus());
            assertEquals(30, available(userId));
            assertEquals(Long.valueOf(referrerId), result.getReferrerId());
            assertEquals(ReferralStatus.REGISTERED.name(), referralStatus(userId));
            // the referrer waits for activation
            assertEquals(20, available(referrerId));
        }

        @Test
        @DisplayName("Unusable codes fall back to the welcome bonus")
        void unusableCodesFallBack() {
            long unknown = randomUserId();
            long self = randomUserId();
            long malformed = randomUserId();

            assertEquals(SignupBonus.WELCOME, referralService.registerUser(unknown, "ref_" + randomUserId()).getBonus());
            assertEquals(SignupBonus.WELCOME, referralService.registerUser(self, "ref_" + self).getBonus());
            assertEquals(SignupBonus.WELCOME, referralService.registerUser(malformed, "ref_abc").getBonus());
            assertEquals(SignupBonus.WELCOME, referralService.registerUser(randomUserId(), "promo_1").getBonus());
        }

        @Test
        @DisplayName("Concurrent registrations of one user grant one bonus")
        void concurrentRegistrationsGrantOnce() throws InterruptedException {
            printTestHeader("Concurrent registrations");
            referralService.registerUser(referrerId, null);

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger granted = new AtomicInteger();
            AtomicInteger errors = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        if (referralService.registerUser(userId, ReferralService.referralCode(referrerId)).isNewUser()) {
                            granted.incrementAndGet();
                        }
                    } catch (Exception e) {
                        errors.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Granted", granted.get());
            assertEquals(0, errors.get());
            assertEquals(1, granted.get());
            assertEquals(30, available(userId));
            assertEquals(1, grantCount(userId));
        }
    }

    @Nested
    @DisplayName("Activation")
    class Activation {

        @Test
        @DisplayName("Activation rewards the referrer once and notifies them")
        void activationRewardsOnce() {
            printTestHeader("Referral activation");
            referralService.registerUser(referrerId, null);
            referralService.registerUser(userId, ReferralService.referralCode(referrerId));

            assertTrue(referralService.activateReferral(userId));
            assertFalse(referralService.activateReferral(userId));

            assertEquals(50, available(referrerId));
            assertEquals(ReferralStatus.REWARDED.name(), referralStatus(userId));
            assertEquals(1, countRewardNotifications(userId));
            List<LedgerTransaction> rewards = creditLedger.getTransactions(referrerId, 10).stream()
                    .filter(t -> ReferralService.rewardReference(userId).equals(t.getReferenceId()))
                    .toList();
            assertEquals(1, rewards.size());
        }

        @Test
        @DisplayName("Users who were not referred have nothing to activate")
        void nothingToActivate() {
            referralService.registerUser(userId, null);

            assertFalse(referralService.activateReferral(userId));
            assertFalse(referralService.activateReferral(randomUserId()));
        }

        @Test
        @DisplayName("Rewards stop at the daily cap; the capped referral stays activated without reward")
        void dailyCap() {
            printTestHeader("Daily reward cap");
            referralService.registerUser(referrerId, null);
            long first = registerReferred(referrerId);
            long second = registerReferred(referrerId);
            long third = registerReferred(referrerId);

            assertTrue(referralService.activateReferral(first));
            assertTrue(referralService.activateReferral(second));
            assertFalse(referralService.activateReferral(third));

            printOutput("Referrer balance", creditLedger.getBalance(referrerId));
            assertEquals(20 + DAILY_CAP * 30, available(referrerId));
            assertEquals(ReferralStatus.ACTIVATED.name(), referralStatus(third));
            assertFalse(referralService.activateReferral(third));

            ReferralStats stats = referralService.getStats(referrerId);
            assertEquals(3, stats.getReferralsCount());
            assertEquals(3, stats.getActivatedCount());
            assertEquals(2, stats.getRewardedCount());
            assertEquals(60, stats.getTotalEarned());
        }

        @Test
        @DisplayName("Completing the referred user's generation activates the referral")
        void completionActivates() {
            referralService.registerUser(referrerId, null);
            referralService.registerUser(userId, ReferralService.referralCode(referrerId));

            Generation generation = jobCoordinator.createJob(userId, "a paper boat", List.of(), Map.of());
            jobCoordinator.complete(generation.getJobId(), new GenerationResult("https://cdn.test/boat.png", 3L));

            assertEquals(ReferralStatus.REWARDED.name(), referralStatus(userId));
            assertEquals(50, available(referrerId));
            assertEquals(20, available(userId));
        }
    }

    @Nested
    @DisplayName("HTTP")
    class Http {

        @Test
        @DisplayName("Registration answers 201 with the bonus, then 200 for the same user")
        void registrationOverHttp() throws Exception {
            referralService.registerUser(referrerId, null);

            mockMvc.perform(post("/api/users/{userId}/registration", userId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"referrerCode\":\"ref_" + referrerId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.bonus").value("REFERRAL"))
                .andExpect(jsonPath("$.creditsGranted").value(30))
                .andExpect(jsonPath("$.referralCode").value("ref_" + userId));

            mockMvc.perform(post("/api/users/{userId}/registration", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bonus").value("EXISTING"));

            mockMvc.perform(get("/api/users/{userId}/referrals", referrerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.referralsCount").value(1))
                .andExpect(jsonPath("$.rewardedCount").value(0));
        }
    }

    @Test
    @DisplayName("Bonus references are stable per user")
    void referencesAreStable() {
        assertEquals(ReferralService.signupReference(42L), ReferralService.signupReference(42L));
        assertNotEquals(ReferralService.signupReference(42L), ReferralService.rewardReference(42L));
        assertNotEquals(UUID.nameUUIDFromBytes(new byte[0]), ReferralService.signupReference(42L));
    }
}
