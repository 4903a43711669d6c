package com.flagship.budget_ledger.event;

import com.flagship.budget_ledger.allocation.AllocationRun;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once per allocation run, whatever its outcomes.
 */
@Value
public class AllocationRunCompletedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "AllocationRunCompleted";
    public static final String AGGREGATE_TYPE = "AllocationRun";

    UUID eventId;
    UUID ownerId;
    UUID runId;
    UUID periodId;
    UUID sourceAccountId;
    BigDecimal pool;
    BigDecimal totalAllocated;
    BigDecimal remainingPool;
    int fundedCount;
    int skippedCount;
    int failedCount;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return runId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AllocationRunCompletedEvent from(AllocationRun run) {
        return new AllocationRunCompletedEvent(
            UUID.randomUUID(),
            run.getOwnerId(),
            run.getId(),
            run.getPeriodId(),
            run.getSourceAccountId(),
            run.getPool(),
            run.getTotalAllocated(),
            run.getRemainingPool(),
            run.countFunded(),
            run.countSkipped(),
            run.countFailed(),
            Instant.now()
        );
    }
}
