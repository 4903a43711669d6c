package com.flagship.budget_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Audit record of one engine run and every template outcome it produced.
 */
@Value
public class AllocationRun {
    UUID id;
    UUID ownerId;
    UUID periodId;
    UUID sourceAccountId;
    BigDecimal pool;
    BigDecimal totalAllocated;
    BigDecimal remainingPool;
    boolean reprocess;
    List<AllocationOutcome> outcomes;
    Instant createdAt;

    public int countFunded() {
        return (int) outcomes.stream().filter(o -> o.getStatus().isFunded()).count();
    }

    public int countSkipped() {
        return (int) outcomes.stream().filter(o -> o.getStatus().isSkipped()).count();
    }

    public int countFailed() {
        return (int) outcomes.stream().filter(o -> o.getStatus() == OutcomeStatus.FAILED).count();
    }

    public List<AllocationOutcome> outcomesWithStatus(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).toList();
    }
}
