package com.flagship.budget_ledger.common;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Per-owner write serialization using PostgreSQL transaction-level advisory locks.
 *
 * Every mutating service method acquires the lock first. The lock is released when the
 * surrounding transaction commits or rolls back, so it must be called inside one.
 * Re-acquiring within the same transaction is a no-op.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OwnerLock {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(UUID ownerId) {
        long key = lockKey(ownerId);
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", rs -> null, key);
        log.debug("Acquired owner lock: ownerId={}, key={}", ownerId, key);
    }

    static long lockKey(UUID ownerId) {
        return ownerId.getMostSignificantBits() ^ ownerId.getLeastSignificantBits();
    }
}
