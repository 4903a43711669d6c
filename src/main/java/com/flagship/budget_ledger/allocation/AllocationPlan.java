package com.flagship.budget_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * The planner's decision for a run, before any money moves.
 */
@Value
public class AllocationPlan {
    BigDecimal originalPool;
    List<AllocationOutcome> outcomes;
    BigDecimal remainingPool;

    /**
     * Sum of the amounts this run will move. Excludes amounts already allocated by earlier runs.
     */
    public BigDecimal getTotalPlanned() {
        return outcomes.stream()
            .filter(AllocationOutcome::requiresTransfer)
            .map(AllocationOutcome::getAllocatedAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
