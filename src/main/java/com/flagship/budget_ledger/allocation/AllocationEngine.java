package com.flagship.budget_ledger.allocation;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.common.Money;
import com.flagship.budget_ledger.common.OwnerLock;
import com.flagship.budget_ledger.event.AllocationRunCompletedEvent;
import com.flagship.budget_ledger.exception.InvalidAmountException;
import com.flagship.budget_ledger.exception.InvalidPoolException;
import com.flagship.budget_ledger.exception.LedgerException;
import com.flagship.budget_ledger.exception.SameAccountException;
import com.flagship.budget_ledger.exception.UnknownAccountException;
import com.flagship.budget_ledger.ledger.LedgerService;
import com.flagship.budget_ledger.ledger.TransactionKind;
import com.flagship.budget_ledger.ledger.Transfer;
import com.flagship.budget_ledger.ledger.TransferCommand;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.period.PeriodService;
import com.flagship.budget_ledger.period.WeeklyPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Distributes a period's pool across the owner's active budget templates.
 *
 * A run is one database transaction under the owner lock. Per-template problems
 * (bad destination, pool exhausted, below minimum) become outcomes and the run goes on;
 * anything else aborts the whole run so no partial set of transfers is left behind.
 * Rerunning a period without reprocess funds only the templates not yet funded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationEngine {

    private final AllocationRepository allocationRepository;
    private final AllocationRunRepository runRepository;
    private final BudgetTemplateService templateService;
    private final AccountService accountService;
    private final PeriodService periodService;
    private final LedgerService ledgerService;
    private final OwnerLock ownerLock;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Without an explicit pool the run distributes the period's income on the source
     * account: its net activity plus whatever earlier runs already moved out to templates.
     *
     * @throws InvalidPoolException if the pool is not positive or has more than two decimals
     * @throws UnknownAccountException if the source is missing, foreign or inactive
     * @throws com.flagship.budget_ledger.exception.UnknownReferenceException if the period is not the owner's
     */
    @Transactional
    public AllocationRun runAllocation(UUID ownerId, AllocationRunCommand command) {
        BigDecimal explicitPool = command.getPool() != null ? validatePool(command.getPool()) : null;
        return metrics.timeAllocationRun(() -> execute(ownerId, command, explicitPool));
    }

    private AllocationRun execute(UUID ownerId, AllocationRunCommand command, BigDecimal explicitPool) {
        ownerLock.acquire(ownerId);
        Account source = accountService.requireActive(ownerId, command.getSourceAccountId());
        WeeklyPeriod period = periodService.getPeriod(ownerId, command.getPeriodId());

        if (command.isReprocess()) {
            reverseProcessedAllocations(ownerId, period.getId());
        }
        BigDecimal pool = explicitPool != null ? explicitPool : periodPool(ownerId, period.getId(), source.getId());

        List<BudgetTemplate> templates = templateService.listTemplates(ownerId, true);
        Map<UUID, BigDecimal> processed = allocationRepository.processedAmountsByTemplate(ownerId, period.getId());

        AllocationPlan plan = AllocationPlanner.plan(pool, templates, processed,
            template -> checkDestination(ownerId, source.getId(), template.getAccountId()));

        UUID runId = UUID.randomUUID();
        List<AllocationOutcome> outcomes = new ArrayList<>(plan.getOutcomes().size());
        List<Allocation> pending = new ArrayList<>();

        for (AllocationOutcome outcome : plan.getOutcomes()) {
            if (!outcome.requiresTransfer()) {
                if (outcome.getStatus() == OutcomeStatus.FAILED) {
                    log.warn("Allocation failed for template: ownerId={}, templateId={}, accountId={}, kind={}, reason={}",
                        ownerId, outcome.getTemplateId(), outcome.getAccountId(), outcome.getErrorKind(), outcome.getMessage());
                }
                outcomes.add(outcome);
                continue;
            }

            Transfer transfer = ledgerService.postTransfer(ownerId, TransferCommand.builder()
                .sourceAccountId(source.getId())
                .destinationAccountId(outcome.getAccountId())
                .periodId(period.getId())
                .amount(outcome.getAllocatedAmount())
                .kind(TransactionKind.TRANSFER)
                .description("Allocation for template " + outcome.getTemplateId())
                .build());

            UUID allocationId = UUID.randomUUID();
            pending.add(new Allocation(
                allocationId, ownerId, runId, outcome.getTemplateId(), source.getId(), outcome.getAccountId(),
                period.getId(), outcome.getAllocatedAmount(), outcome.getRequestedAmount(),
                outcome.getStatus() == OutcomeStatus.PARTIALLY_FUNDED, true,
                transfer.getTransferId(), null, null, null));
            outcomes.add(outcome.toBuilder().allocationId(allocationId).build());
        }

        AllocationRun run = runRepository.insert(new AllocationRun(
            runId, ownerId, period.getId(), source.getId(), plan.getOriginalPool(), plan.getTotalPlanned(),
            plan.getRemainingPool(), command.isReprocess(), List.copyOf(outcomes), null));
        pending.forEach(allocationRepository::insert);

        outboxService.append(AllocationRunCompletedEvent.from(run));
        run.getOutcomes().forEach(outcome -> metrics.recordAllocationOutcome(outcome.getStatus().name()));

        log.info("Allocation run completed: ownerId={}, runId={}, periodId={}, pool={}, allocated={}, remaining={}, " +
                "funded={}, skipped={}, failed={}",
            ownerId, runId, period.getId(), run.getPool(), run.getTotalAllocated(), run.getRemainingPool(),
            run.countFunded(), run.countSkipped(), run.countFailed());
        return run;
    }

    /**
     * Moves money from source to destination outside any template. Manual allocations
     * never count as processed for a template.
     */
    @Transactional
    public Allocation allocateManually(UUID ownerId, ManualAllocationCommand command) {
        BigDecimal amount = Money.positive(command.getAmount(), "Allocation amount");
        if (command.getSourceAccountId() != null && command.getSourceAccountId().equals(command.getDestinationAccountId())) {
            throw new SameAccountException("Cannot allocate from account " + command.getSourceAccountId() + " to itself");
        }

        ownerLock.acquire(ownerId);
        accountService.requireActive(ownerId, command.getSourceAccountId());
        accountService.requireActive(ownerId, command.getDestinationAccountId());
        WeeklyPeriod period = periodService.getPeriod(ownerId, command.getPeriodId());

        Transfer transfer = ledgerService.postTransfer(ownerId, TransferCommand.builder()
            .sourceAccountId(command.getSourceAccountId())
            .destinationAccountId(command.getDestinationAccountId())
            .periodId(period.getId())
            .amount(amount)
            .kind(TransactionKind.TRANSFER)
            .description(command.getNotes() != null ? command.getNotes() : "Manual allocation")
            .build());

        Allocation allocation = allocationRepository.insert(new Allocation(
            UUID.randomUUID(), ownerId, null, null, command.getSourceAccountId(), command.getDestinationAccountId(),
            period.getId(), amount, amount, false, true, transfer.getTransferId(), null, command.getNotes(), null));

        log.info("Manual allocation: ownerId={}, allocationId={}, from={}, to={}, amount={}",
            ownerId, allocation.getId(), allocation.getSourceAccountId(), allocation.getDestinationAccountId(), amount);
        return allocation;
    }

    @Transactional(readOnly = true)
    public List<Allocation> listAllocations(UUID ownerId, UUID periodId) {
        periodService.getPeriod(ownerId, periodId);
        return allocationRepository.findByPeriod(ownerId, periodId);
    }

    /**
     * Runs of one period, or all of the owner's runs newest first when no period is given.
     */
    @Transactional(readOnly = true)
    public List<AllocationRun> listRuns(UUID ownerId, UUID periodId) {
        if (periodId == null) {
            return runRepository.findByOwner(ownerId);
        }
        periodService.getPeriod(ownerId, periodId);
        return runRepository.findByPeriod(ownerId, periodId);
    }

    private void reverseProcessedAllocations(UUID ownerId, UUID periodId) {
        List<Allocation> processed = allocationRepository.findProcessedTemplateAllocations(ownerId, periodId);
        for (Allocation allocation : processed) {
            Transfer reversal = ledgerService.reverseTransfer(ownerId, allocation.getTransferId(),
                "Reprocess of allocation " + allocation.getId());
            allocationRepository.markUnprocessed(allocation.getId(), reversal.getTransferId());
        }
        log.info("Reversed processed allocations for reprocess: ownerId={}, periodId={}, count={}",
            ownerId, periodId, processed.size());
    }

    /**
     * Net activity on the source plus the template allocations already taken from it.
     * Manual allocations stay deducted.
     */
    private BigDecimal periodPool(UUID ownerId, UUID periodId, UUID sourceAccountId) {
        BigDecimal activity = ledgerService.periodActivity(ownerId, periodId, List.of(sourceAccountId));
        BigDecimal allocated = allocationRepository.findProcessedTemplateAllocations(ownerId, periodId).stream()
            .filter(allocation -> sourceAccountId.equals(allocation.getSourceAccountId()))
            .map(Allocation::getAmount)
            .reduce(Money.ZERO, BigDecimal::add);
        BigDecimal pool = activity.add(allocated);
        log.debug("Resolved allocation pool from period activity: ownerId={}, periodId={}, activity={}, " +
            "alreadyAllocated={}, pool={}", ownerId, periodId, activity, allocated, pool);
        return validatePool(pool);
    }

    private Optional<LedgerException> checkDestination(UUID ownerId, UUID sourceAccountId, UUID destinationAccountId) {
        if (sourceAccountId.equals(destinationAccountId)) {
            return Optional.of(new SameAccountException("Template destination is the pool's source account"));
        }
        Optional<Account> destination = accountService.find(ownerId, destinationAccountId);
        if (destination.isEmpty()) {
            return Optional.of(UnknownAccountException.of(destinationAccountId));
        }
        if (!destination.get().isActive()) {
            return Optional.of(new UnknownAccountException("Account is inactive: " + destinationAccountId));
        }
        return Optional.empty();
    }

    private static BigDecimal validatePool(BigDecimal pool) {
        if (pool.signum() <= 0) {
            throw new InvalidPoolException("Allocation pool must be greater than zero, got " + pool.toPlainString());
        }
        try {
            return Money.of(pool);
        } catch (InvalidAmountException e) {
            throw new InvalidPoolException(e.getMessage());
        }
    }
}
