package com.careercraft.agent.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for conversation turns.
 *
 * A client that retries a turn after a network timeout must not run the
 * tools twice. It sends an {@code Idempotency-Key} header; the finished
 * response is cached under that key and replayed for repeats.
 *
 * Key pattern: careercraft:idempotency:{idempotencyKey}
 * TTL: 24 hours (agent.idempotency.ttl)
 *
 * Opt-in: requests without a key always execute.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "careercraft:idempotency:";
    // Stored while the turn is running
    private static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public IdempotencyService(StringRedisTemplate redisTemplate,
                              @Value("${agent.idempotency.ttl:24h}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * The cached response for a finished turn with this key, if any.
     * A key whose turn is still running reports empty.
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));

        if (existing == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in-flight", idempotencyKey);
            return Optional.empty();
        }

        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /**
     * Mark key as in-flight atomically (SET NX).
     * Returns false if another request already holds it.
     */
    public boolean claimKey(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, ttl);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, ttl);
        log.debug("Stored idempotency response for key={}", idempotencyKey);
    }

    /** Frees the key after a failed turn so the client can retry */
    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
