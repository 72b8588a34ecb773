package com.flagship.fund_quarantine.quarantine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency key lookup for quarantine creation.
 *
 * Redis is the fast path. The idempotency_key column on fq_quarantines is the
 * source of truth, so a Redis outage only costs a database lookup.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "quarantine-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final QuarantineLedger ledger;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(QuarantineLedger ledger,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.ledger = ledger;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @param idempotencyKey Key from the Idempotency-Key header
     * @return ID of the quarantine created under this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = ledger.findByIdempotencyKey(idempotencyKey).map(Quarantine::getId);
        if (stored.isPresent()) {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, stored.get());
        }
        return stored;
    }

    /**
     * Caches the key mapping in Redis. The database row already holds the key.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID quarantineId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (quarantineId == null) {
            throw new IllegalArgumentException("Quarantine ID cannot be null");
        }
        cache(idempotencyKey, quarantineId);
    }

    private void cache(String idempotencyKey, UUID quarantineId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + idempotencyKey, quarantineId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }
}
