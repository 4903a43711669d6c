package com.flagship.budget_ledger.allocation;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JDBC access to allocation rows. Callers hold the owner lock for writes.
 */
@Repository
@RequiredArgsConstructor
public class AllocationRepository {

    private static final String SELECT_ALLOCATION =
        "SELECT id, owner_id, run_id, template_id, source_account_id, destination_account_id, period_id, " +
        "amount, requested_amount, partially_funded, processed, transfer_id, reversal_transfer_id, notes, created_at " +
        "FROM allocations ";

    private final JdbcTemplate jdbcTemplate;

    public Allocation insert(Allocation allocation) {
        Timestamp createdAt = jdbcTemplate.queryForObject(
            "INSERT INTO allocations (id, owner_id, run_id, template_id, source_account_id, destination_account_id, " +
            "period_id, amount, requested_amount, partially_funded, processed, transfer_id, notes) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, TRUE, ?, ?) RETURNING created_at",
            Timestamp.class,
            allocation.getId(),
            allocation.getOwnerId(),
            allocation.getRunId(),
            allocation.getTemplateId(),
            allocation.getSourceAccountId(),
            allocation.getDestinationAccountId(),
            allocation.getPeriodId(),
            allocation.getAmount(),
            allocation.getRequestedAmount(),
            allocation.isPartiallyFunded(),
            allocation.getTransferId(),
            allocation.getNotes()
        );
        return new Allocation(
            allocation.getId(), allocation.getOwnerId(), allocation.getRunId(), allocation.getTemplateId(),
            allocation.getSourceAccountId(), allocation.getDestinationAccountId(), allocation.getPeriodId(),
            allocation.getAmount(), allocation.getRequestedAmount(), allocation.isPartiallyFunded(), true,
            allocation.getTransferId(), null, allocation.getNotes(),
            createdAt != null ? createdAt.toInstant() : null);
    }

    /**
     * Live template allocations of a period, in creation order.
     */
    public List<Allocation> findProcessedTemplateAllocations(UUID ownerId, UUID periodId) {
        return jdbcTemplate.query(
            SELECT_ALLOCATION + "WHERE owner_id = ? AND period_id = ? AND processed AND template_id IS NOT NULL " +
            "ORDER BY created_at, id",
            allocationRowMapper(), ownerId, periodId);
    }

    /**
     * Amount already allocated this period per template.
     */
    public Map<UUID, BigDecimal> processedAmountsByTemplate(UUID ownerId, UUID periodId) {
        Map<UUID, BigDecimal> amounts = new LinkedHashMap<>();
        for (Allocation allocation : findProcessedTemplateAllocations(ownerId, periodId)) {
            amounts.merge(allocation.getTemplateId(), allocation.getAmount(), BigDecimal::add);
        }
        return amounts;
    }

    public void markUnprocessed(UUID allocationId, UUID reversalTransferId) {
        int updated = jdbcTemplate.update(
            "UPDATE allocations SET processed = FALSE, reversal_transfer_id = ? WHERE id = ? AND processed",
            reversalTransferId, allocationId);
        if (updated != 1) {
            throw new IllegalStateException("Allocation " + allocationId + " was not processed");
        }
    }

    public List<Allocation> findByPeriod(UUID ownerId, UUID periodId) {
        return jdbcTemplate.query(
            SELECT_ALLOCATION + "WHERE owner_id = ? AND period_id = ? ORDER BY created_at, id",
            allocationRowMapper(), ownerId, periodId);
    }

    static RowMapper<Allocation> allocationRowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new Allocation(
                rs.getObject("id", UUID.class),
                rs.getObject("owner_id", UUID.class),
                rs.getObject("run_id", UUID.class),
                rs.getObject("template_id", UUID.class),
                rs.getObject("source_account_id", UUID.class),
                rs.getObject("destination_account_id", UUID.class),
                rs.getObject("period_id", UUID.class),
                rs.getBigDecimal("amount"),
                rs.getBigDecimal("requested_amount"),
                rs.getBoolean("partially_funded"),
                rs.getBoolean("processed"),
                rs.getObject("transfer_id", UUID.class),
                rs.getObject("reversal_transfer_id", UUID.class),
                rs.getString("notes"),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
