package com.flagship.budget_ledger.allocation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * JDBC access to allocation runs. Outcomes are stored as a JSONB array.
 */
@Repository
@RequiredArgsConstructor
public class AllocationRunRepository {

    private static final TypeReference<List<AllocationOutcome>> OUTCOME_LIST = new TypeReference<>() {
    };

    private static final String SELECT_RUN =
        "SELECT id, owner_id, period_id, source_account_id, pool, total_allocated, remaining_pool, reprocess, " +
        "outcomes::text AS outcomes, created_at FROM allocation_runs ";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public AllocationRun insert(AllocationRun run) {
        Timestamp createdAt = jdbcTemplate.queryForObject(
            "INSERT INTO allocation_runs (id, owner_id, period_id, source_account_id, pool, total_allocated, " +
            "remaining_pool, reprocess, outcomes) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb) RETURNING created_at",
            Timestamp.class,
            run.getId(),
            run.getOwnerId(),
            run.getPeriodId(),
            run.getSourceAccountId(),
            run.getPool(),
            run.getTotalAllocated(),
            run.getRemainingPool(),
            run.isReprocess(),
            writeOutcomes(run.getOutcomes())
        );
        return new AllocationRun(run.getId(), run.getOwnerId(), run.getPeriodId(), run.getSourceAccountId(),
            run.getPool(), run.getTotalAllocated(), run.getRemainingPool(), run.isReprocess(), run.getOutcomes(),
            createdAt != null ? createdAt.toInstant() : null);
    }

    public List<AllocationRun> findByPeriod(UUID ownerId, UUID periodId) {
        return jdbcTemplate.query(
            SELECT_RUN + "WHERE owner_id = ? AND period_id = ? ORDER BY created_at, id",
            runRowMapper(), ownerId, periodId);
    }

    public List<AllocationRun> findByOwner(UUID ownerId) {
        return jdbcTemplate.query(
            SELECT_RUN + "WHERE owner_id = ? ORDER BY created_at DESC, id",
            runRowMapper(), ownerId);
    }

    private String writeOutcomes(List<AllocationOutcome> outcomes) {
        try {
            return objectMapper.writeValueAsString(outcomes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize allocation outcomes", e);
        }
    }

    private List<AllocationOutcome> readOutcomes(String json) {
        try {
            return objectMapper.readValue(json, OUTCOME_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize allocation outcomes", e);
        }
    }

    private RowMapper<AllocationRun> runRowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new AllocationRun(
                rs.getObject("id", UUID.class),
                rs.getObject("owner_id", UUID.class),
                rs.getObject("period_id", UUID.class),
                rs.getObject("source_account_id", UUID.class),
                rs.getBigDecimal("pool"),
                rs.getBigDecimal("total_allocated"),
                rs.getBigDecimal("remaining_pool"),
                rs.getBoolean("reprocess"),
                readOutcomes(rs.getString("outcomes")),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
