package com.flagship.payment_settlement.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for payment initiation.
 *
 * Redis is the fast path; {@code payments.idempotency_key} is the source of truth. Keys
 * are scoped per organization so two tenants may reuse the same client key.
 * Redis failures degrade to the database lookup and are never fatal.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:payment:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Key actually stored on the payment row.
     */
    public static String scopedKey(UUID organizationId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
        return organizationId + ":" + idempotencyKey.trim();
    }

    /**
     * @return id of the payment created earlier with this key, if any
     */
    public Optional<UUID> findPaymentId(String scopedKey) {
        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + scopedKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", scopedKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        scopedKey, e.getMessage());
            }
        }

        Optional<UUID> stored = paymentRepository.findByIdempotencyKey(scopedKey).map(PaymentEntity::getId);
        stored.ifPresent(paymentId -> {
            log.debug("Idempotency key found in database: {}", scopedKey);
            cache(scopedKey, paymentId);
        });
        return stored;
    }

    /**
     * Caches the mapping after the payment row (which carries the key) is written.
     */
    public void remember(String scopedKey, UUID paymentId) {
        cache(scopedKey, paymentId);
    }

    private void cache(String scopedKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + scopedKey, paymentId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Could not cache idempotency key {} in Redis: {}", scopedKey, e.getMessage());
        }
    }
}
