package com.flagship.credit_ledger.payment;

import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast-path for webhook deduplication with database fallback.
 *
 * Redis only answers "already processed"; a miss or a Redis failure always goes
 * to payment_records, which stays the source of truth.
 */
@Service
@Slf4j
public class ProcessedPaymentCache {

    private static final String REDIS_KEY_PREFIX = "payment:processed:";

    private final PaymentRecordRepository paymentRecordRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final CreditMetrics creditMetrics;
    private final Duration ttl;

    public ProcessedPaymentCache(PaymentRecordRepository paymentRecordRepository,
                                 Optional<StringRedisTemplate> redisTemplate,
                                 CreditMetrics creditMetrics,
                                 @Value("${payment.cache.ttl-hours:24}") long ttlHours) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.redisTemplate = redisTemplate;
        this.creditMetrics = creditMetrics;
        this.ttl = Duration.ofHours(ttlHours);
    }

    /**
     * @return true if the payment's side effect is known to be committed
     */
    public boolean isProcessed(String paymentId) {
        if (redisTemplate.isPresent()) {
            try {
                if (Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + paymentId))) {
                    creditMetrics.recordPaymentCacheLookup(true);
                    log.debug("Payment {} found processed in Redis", paymentId);
                    return true;
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for payment {}. Falling back to database. Error: {}",
                        paymentId, e.getMessage());
            }
        }
        creditMetrics.recordPaymentCacheLookup(false);

        boolean processed = paymentRecordRepository.isProcessed(paymentId);
        if (processed) {
            markProcessed(paymentId);
        }
        return processed;
    }

    /**
     * Best effort. Only call after the settlement transaction committed.
     */
    public void markProcessed(String paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + paymentId, "1", ttl);
        } catch (Exception e) {
            log.debug("Failed to cache processed payment {} in Redis: {}", paymentId, e.getMessage());
        }
    }
}
