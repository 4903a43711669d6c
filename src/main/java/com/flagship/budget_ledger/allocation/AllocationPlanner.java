package com.flagship.budget_ledger.allocation;

import com.flagship.budget_ledger.common.Money;
import com.flagship.budget_ledger.exception.LedgerException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Pure allocation algorithm: walks templates in run order and decides each outcome
 * against a shrinking pool. No I/O; the engine supplies the processed amounts and the
 * destination check.
 *
 * Percentages are taken from the original pool, not the remaining one, so a template's
 * share does not depend on what ran before it. The remaining pool caps every amount.
 */
public final class AllocationPlanner {

    private AllocationPlanner() {
    }

    /**
     * @param pool             the run's pool, already validated positive
     * @param templates        active templates, visited in {@link BudgetTemplate#RUN_ORDER}
     * @param processedAmounts amounts already allocated this period, keyed by template id
     * @param destinationCheck returns the error for a template whose destination cannot be funded
     */
    public static AllocationPlan plan(BigDecimal pool,
                                      List<BudgetTemplate> templates,
                                      Map<UUID, BigDecimal> processedAmounts,
                                      Function<BudgetTemplate, Optional<LedgerException>> destinationCheck) {
        BigDecimal originalPool = Money.round(pool);
        BigDecimal remaining = originalPool;
        List<AllocationOutcome> outcomes = new ArrayList<>(templates.size());

        for (BudgetTemplate template : templates.stream().sorted(BudgetTemplate.RUN_ORDER).toList()) {
            AllocationOutcome.AllocationOutcomeBuilder outcome = AllocationOutcome.builder()
                .templateId(template.getId())
                .accountId(template.getAccountId())
                .allocationType(template.getAllocationType());

            BigDecimal alreadyAllocated = processedAmounts.get(template.getId());
            if (alreadyAllocated != null) {
                remaining = remaining.subtract(Money.min(alreadyAllocated, remaining));
                outcomes.add(outcome
                    .allocatedAmount(Money.ZERO)
                    .requestedAmount(alreadyAllocated)
                    .status(OutcomeStatus.SKIPPED_ALREADY_PROCESSED)
                    .message("Already allocated " + alreadyAllocated.toPlainString() + " this period")
                    .build());
                continue;
            }

            Optional<LedgerException> destinationError = destinationCheck.apply(template);
            if (destinationError.isPresent()) {
                outcomes.add(outcome
                    .allocatedAmount(Money.ZERO)
                    .status(OutcomeStatus.FAILED)
                    .errorKind(destinationError.get().getKind())
                    .message(destinationError.get().getMessage())
                    .build());
                continue;
            }

            BigDecimal requested = requestedAmount(template, originalPool);
            outcome.requestedAmount(requested);

            if (Money.isZero(remaining)) {
                outcomes.add(outcome
                    .allocatedAmount(Money.ZERO)
                    .status(OutcomeStatus.SKIPPED_POOL_EXHAUSTED)
                    .build());
                continue;
            }

            if (template.getAllocationType() == AllocationType.RANGE
                && remaining.compareTo(template.getMinAmount()) < 0) {
                outcomes.add(outcome
                    .allocatedAmount(Money.ZERO)
                    .status(OutcomeStatus.SKIPPED_BELOW_MINIMUM)
                    .message(String.format("Remaining pool %s is below the minimum %s",
                        remaining.toPlainString(), template.getMinAmount().toPlainString()))
                    .build());
                continue;
            }

            BigDecimal amount = Money.min(requested, remaining);
            if (Money.isZero(amount)) {
                outcomes.add(outcome
                    .allocatedAmount(Money.ZERO)
                    .status(OutcomeStatus.SKIPPED_ZERO_AMOUNT)
                    .build());
                continue;
            }

            remaining = remaining.subtract(amount);
            outcomes.add(outcome
                .allocatedAmount(amount)
                .status(amount.compareTo(requested) < 0 ? OutcomeStatus.PARTIALLY_FUNDED : OutcomeStatus.FUNDED)
                .build());
        }

        return new AllocationPlan(originalPool, List.copyOf(outcomes), remaining);
    }

    /**
     * The amount a template asks for before the pool cap. A range asks for its maximum.
     */
    static BigDecimal requestedAmount(BudgetTemplate template, BigDecimal originalPool) {
        return switch (template.getAllocationType()) {
            case FIXED -> template.getFixedAmount();
            case PERCENTAGE -> Money.percentOf(originalPool, template.getPercentage());
            case RANGE -> template.getMaxAmount();
        };
    }
}
