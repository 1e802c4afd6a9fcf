package com.inboxai.credit_core.action;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps Idempotency-Key values to action executions.
 *
 * Redis is a cache in front of the action_executions table, which stays the source of truth:
 * a Redis outage slows lookups down but never lets a key be executed twice.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "action-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ActionExecutionRepository repository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(ActionExecutionRepository repository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the execution recorded for this key, if any
     */
    public Optional<UUID> findExecutionId(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            return cached;
        }

        Optional<UUID> stored = repository.findByIdempotencyKey(idempotencyKey)
            .map(ActionExecutionEntity::getId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            writeCache(idempotencyKey, id);
        });
        return stored;
    }

    /**
     * Caches a finished execution. The database row already exists at this point.
     */
    public void remember(String idempotencyKey, UUID executionId) {
        requireKey(idempotencyKey);
        if (executionId == null) {
            throw new IllegalArgumentException("Execution ID cannot be null");
        }
        writeCache(idempotencyKey, executionId);
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, UUID executionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, executionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
