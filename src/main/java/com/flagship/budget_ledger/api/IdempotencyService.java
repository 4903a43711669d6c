package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.common.OwnerLock;
import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Idempotency keys for money-moving commands.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the idempotency_keys table, which is the source of truth
 * 3. Write the key row in the command's own transaction, and cache it in Redis only
 *    after that transaction commits
 *
 * Keys are scoped per owner and resource type, so the same client key can be reused
 * for a transfer and a repayment without clashing.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final int MAX_KEY_LENGTH = 255;

    private final JdbcTemplate jdbcTemplate;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final LedgerProperties properties;
    private final OwnerLock ownerLock;
    private final LedgerMetrics metrics;

    public IdempotencyService(JdbcTemplate jdbcTemplate,
                              Optional<StringRedisTemplate> redisTemplate,
                              LedgerProperties properties,
                              OwnerLock ownerLock,
                              LedgerMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.ownerLock = ownerLock;
        this.metrics = metrics;
    }

    /**
     * Runs a command at most once per key.
     *
     * The owner lock is taken before the lookup, so two concurrent requests with the same
     * key cannot both miss. A replay loads the resource the first request produced.
     *
     * @param command       executes the command
     * @param resourceIdOf  extracts the id to remember from the command's result
     * @param replay        loads an earlier result by id
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public <T> IdempotentResult<T> executeOnce(UUID ownerId, String resourceType, String idempotencyKey,
                                               Supplier<T> command,
                                               Function<T, UUID> resourceIdOf,
                                               Function<UUID, T> replay) {
        ownerLock.acquire(ownerId);

        Optional<UUID> existing = find(ownerId, resourceType, idempotencyKey);
        if (existing.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning existing {}: resourceId={}", resourceType, existing.get());
            return IdempotentResult.replayed(replay.apply(existing.get()));
        }

        metrics.recordIdempotencyMiss();
        T result = command.get();
        record(ownerId, resourceType, idempotencyKey, resourceIdOf.apply(result));
        return IdempotentResult.created(result);
    }

    /**
     * Looks up the resource a key produced.
     *
     * @return the resource id if the key was used before, empty otherwise
     */
    public Optional<UUID> find(UUID ownerId, String resourceType, String idempotencyKey) {
        validateKey(idempotencyKey);
        String redisKey = redisKey(ownerId, resourceType, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String resourceId = redisTemplate.get().opsForValue().get(redisKey);
                if (resourceId != null) {
                    log.debug("Idempotency key found in Redis: {}", redisKey);
                    return Optional.of(UUID.fromString(resourceId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    redisKey, e.getMessage());
            }
        }

        List<UUID> stored = jdbcTemplate.queryForList(
            "SELECT resource_id FROM idempotency_keys WHERE owner_id = ? AND resource_type = ? AND idempotency_key = ?",
            UUID.class, ownerId, resourceType, idempotencyKey);
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        UUID resourceId = stored.get(0);
        log.debug("Idempotency key found in database: {}", redisKey);
        cache(redisKey, resourceId);
        return Optional.of(resourceId);
    }

    /**
     * Records the resource a key produced. Must run inside the command's transaction so
     * the key and the resource commit or roll back together.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(UUID ownerId, String resourceType, String idempotencyKey, UUID resourceId) {
        validateKey(idempotencyKey);
        if (resourceId == null) {
            throw new IllegalArgumentException("Resource ID cannot be null");
        }

        jdbcTemplate.update(
            "INSERT INTO idempotency_keys (owner_id, idempotency_key, resource_type, resource_id) VALUES (?, ?, ?, ?)",
            ownerId, idempotencyKey, resourceType, resourceId);

        String redisKey = redisKey(ownerId, resourceType, idempotencyKey);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(redisKey, resourceId);
                }
            });
        }
        log.debug("Stored idempotency key: {} -> {}", redisKey, resourceId);
    }

    private void cache(String redisKey, UUID resourceId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, resourceId.toString(), properties.getIdempotency().getTtl());
        } catch (Exception e) {
            // the database row stays authoritative
            log.debug("Failed to cache idempotency key {} in Redis: {}", redisKey, e.getMessage());
        }
    }

    static String redisKey(UUID ownerId, String resourceType, String idempotencyKey) {
        return REDIS_KEY_PREFIX + ownerId + ":" + resourceType + ":" + idempotencyKey;
    }

    private static void validateKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Idempotency key exceeds " + MAX_KEY_LENGTH + " characters");
        }
    }
}
