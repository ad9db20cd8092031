package com.flagship.inventory_ledger.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps direct payment idempotency keys to the direct payment reference they
 * produced.
 *
 * Redis is a fast path only. The payments table, where every slice of a
 * direct payment carries the key, is the source of truth and is consulted
 * whenever Redis misses or is unavailable.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:direct-payment:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the direct payment reference recorded for the key, if any
     */
    public Optional<String> lookup(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(cached);
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<String> stored = paymentRepository.findFirstByIdempotencyKey(idempotencyKey)
                .map(PaymentEntity::getDirectPaymentRef);
        stored.ifPresent(ref -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, ref);
        });
        return stored;
    }

    /**
     * Caches the mapping once the surrounding transaction commits, so a
     * rolled-back payment never leaves a key behind.
     */
    public void remember(String idempotencyKey, String directPaymentRef) {
        requireKey(idempotencyKey);
        if (directPaymentRef == null) {
            throw new IllegalArgumentException("Direct payment reference cannot be null");
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(idempotencyKey, directPaymentRef);
                }
            });
        } else {
            cache(idempotencyKey, directPaymentRef);
        }
    }

    /**
     * Drops a cached key that no longer resolves to any payment.
     */
    public void evict(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + idempotencyKey);
        } catch (RuntimeException e) {
            log.warn("Failed to evict idempotency key {} from Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private void cache(String idempotencyKey, String directPaymentRef) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, directPaymentRef, REDIS_TTL);
            log.debug("Cached idempotency key {} -> {}", idempotencyKey, directPaymentRef);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
