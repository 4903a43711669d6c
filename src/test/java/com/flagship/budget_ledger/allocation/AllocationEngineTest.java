package com.flagship.budget_ledger.allocation;

import com.flagship.budget_ledger.PostgresIntegrationTest;
import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountCategory;
import com.flagship.budget_ledger.event.AllocationRunCompletedEvent;
import com.flagship.budget_ledger.exception.ErrorKind;
import com.flagship.budget_ledger.exception.InvalidPoolException;
import com.flagship.budget_ledger.exception.SameAccountException;
import com.flagship.budget_ledger.exception.UnknownAccountException;
import com.flagship.budget_ledger.ledger.LedgerService;
import com.flagship.budget_ledger.ledger.PostTransactionCommand;
import com.flagship.budget_ledger.ledger.TransactionKind;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.period.WeeklyPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Allocation runs against a real ledger: every funded outcome is a balanced transfer
 * from the pool's source, and reruns never fund a template twice in a period.
 */
class AllocationEngineTest extends PostgresIntegrationTest {

    @Autowired
    private AllocationEngine allocationEngine;

    @Autowired
    private BudgetTemplateService templateService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    private UUID ownerId;
    private WeeklyPeriod period;
    private Account paycheck;
    private Account rent;
    private Account savings;

    @BeforeEach
    void setUp() {
        ownerId = newOwner();
        period = currentPeriod(ownerId);
        paycheck = createAccount(ownerId, "Paycheck", root(ownerId, AccountCategory.INCOME).getId());
        rent = createAccount(ownerId, "Rent", root(ownerId, AccountCategory.EXPENSE).getId());
        savings = createAccount(ownerId, "Emergency Fund", root(ownerId, AccountCategory.SAVINGS).getId());

        ledgerService.post(ownerId, PostTransactionCommand.builder()
            .accountId(paycheck.getId())
            .periodId(period.getId())
            .amount(new BigDecimal("1000.00"))
            .kind(TransactionKind.INCOME)
            .description("Salary")
            .build());
    }

    private BudgetTemplate fixed(Account destination, String amount, int priority) {
        return templateService.createTemplate(ownerId, CreateTemplateCommand.builder()
            .accountId(destination.getId())
            .allocationType(AllocationType.FIXED)
            .fixedAmount(new BigDecimal(amount))
            .priority(priority)
            .build());
    }

    private BudgetTemplate percentage(Account destination, String percent, int priority) {
        return templateService.createTemplate(ownerId, CreateTemplateCommand.builder()
            .accountId(destination.getId())
            .allocationType(AllocationType.PERCENTAGE)
            .percentage(new BigDecimal(percent))
            .priority(priority)
            .build());
    }

    private AllocationRun run(String pool) {
        return run(pool, false);
    }

    private AllocationRun run(String pool, boolean reprocess) {
        return allocationEngine.runAllocation(ownerId, AllocationRunCommand.builder()
            .periodId(period.getId())
            .sourceAccountId(paycheck.getId())
            .pool(pool != null ? new BigDecimal(pool) : null)
            .reprocess(reprocess)
            .build());
    }

    private BigDecimal balance(Account account) {
        return accountService.cachedBalance(ownerId, account.getId());
    }

    @Test
    @DisplayName("Fixed 150 on a pool of 100 is partially funded with 100")
    void testFixedLargerThanPool() {
        printTestHeader("Partial Funding");

        // Given
        fixed(rent, "150.00", 1);
        printInput("Pool", "100.00");

        // When
        AllocationRun run = run("100.00");

        // Then
        AllocationOutcome outcome = run.getOutcomes().get(0);
        printOutput("Outcome", outcome);
        assertEquals(OutcomeStatus.PARTIALLY_FUNDED, outcome.getStatus());
        assertEquals(new BigDecimal("100.00"), outcome.getAllocatedAmount());
        assertNotNull(outcome.getAllocationId());
        assertEquals(0, run.getRemainingPool().signum());
        assertEquals(0, new BigDecimal("100.00").compareTo(balance(rent)));
        assertEquals(0, new BigDecimal("900.00").compareTo(balance(paycheck)));

        List<Allocation> allocations = allocationEngine.listAllocations(ownerId, period.getId());
        assertEquals(1, allocations.size());
        assertTrue(allocations.get(0).isPartiallyFunded());
        assertTrue(allocations.get(0).isProcessed());
        assertEquals(run.getId(), allocations.get(0).getRunId());

        printSuccess("Pool fully used, shortfall recorded");
    }

    @Test
    @DisplayName("Percentage 30 and fixed 50 on a pool of 200 allocate 60 and 50, leaving 90")
    void testPercentageAndFixed() {
        printTestHeader("Priority Order");

        fixed(rent, "50.00", 2);
        percentage(savings, "30", 1);

        AllocationRun run = run("200.00");

        printOutput("Outcomes", run.getOutcomes());
        assertEquals(savings.getId(), run.getOutcomes().get(0).getAccountId(), "Priority 1 runs first");
        assertEquals(new BigDecimal("60.00"), run.getOutcomes().get(0).getAllocatedAmount());
        assertEquals(new BigDecimal("50.00"), run.getOutcomes().get(1).getAllocatedAmount());
        assertEquals(0, new BigDecimal("110.00").compareTo(run.getTotalAllocated()));
        assertEquals(0, new BigDecimal("90.00").compareTo(run.getRemainingPool()));
        assertEquals(2, run.countFunded());

        // Stored run reads back with its outcomes
        AllocationRun stored = allocationEngine.listRuns(ownerId, period.getId()).get(0);
        assertEquals(run.getId(), stored.getId());
        assertEquals(2, stored.getOutcomes().size());
        assertEquals(OutcomeStatus.FUNDED, stored.getOutcomes().get(0).getStatus());
        assertEquals(1, outboxService.eventsForAggregate(AllocationRunCompletedEvent.AGGREGATE_TYPE, run.getId()).size());

        printSuccess("Run stored and event emitted");
    }

    @Test
    @DisplayName("Range 20..50 on a pool of 10 is skipped below minimum and moves nothing")
    void testRangeBelowMinimum() {
        templateService.createTemplate(ownerId, CreateTemplateCommand.builder()
            .accountId(savings.getId())
            .allocationType(AllocationType.RANGE)
            .minAmount(new BigDecimal("20.00"))
            .maxAmount(new BigDecimal("50.00"))
            .build());

        AllocationRun run = run("10.00");

        assertEquals(OutcomeStatus.SKIPPED_BELOW_MINIMUM, run.getOutcomes().get(0).getStatus());
        assertEquals(1, run.countSkipped());
        assertEquals(0, new BigDecimal("10.00").compareTo(run.getRemainingPool()));
        assertEquals(0, balance(savings).signum());
        assertTrue(allocationEngine.listAllocations(ownerId, period.getId()).isEmpty());
    }

    @Test
    @DisplayName("Rerunning a period does not fund the same template twice")
    void testRerunIsIdempotent() {
        printTestHeader("Rerun Same Period");

        fixed(rent, "300.00", 1);
        percentage(savings, "10", 2);
        run("500.00");

        // When: the same run again
        AllocationRun second = run("500.00");

        // Then
        printOutput("Second run outcomes", second.getOutcomes());
        assertTrue(second.getOutcomes().stream()
            .allMatch(outcome -> outcome.getStatus() == OutcomeStatus.SKIPPED_ALREADY_PROCESSED));
        assertEquals(0, second.getTotalAllocated().signum());
        assertEquals(0, new BigDecimal("300.00").compareTo(balance(rent)));
        assertEquals(0, new BigDecimal("50.00").compareTo(balance(savings)));
        assertEquals(2, allocationEngine.listAllocations(ownerId, period.getId()).size());
        assertEquals(2, allocationEngine.listRuns(ownerId, period.getId()).size());

        printSuccess("No double funding");
    }

    @Test
    @DisplayName("A template added after a run is funded from what the earlier run left")
    void testRerunFundsNewTemplate() {
        fixed(rent, "80.00", 1);
        run("100.00");
        fixed(savings, "50.00", 2);

        AllocationRun second = run("100.00");

        assertEquals(OutcomeStatus.SKIPPED_ALREADY_PROCESSED, second.getOutcomes().get(0).getStatus());
        assertEquals(OutcomeStatus.PARTIALLY_FUNDED, second.getOutcomes().get(1).getStatus());
        assertEquals(new BigDecimal("20.00"), second.getOutcomes().get(1).getAllocatedAmount());
        assertEquals(0, new BigDecimal("20.00").compareTo(balance(savings)));
    }

    @Test
    @DisplayName("Reprocess reverses the period's allocations and funds the current templates")
    void testReprocess() {
        printTestHeader("Reprocess Period");

        BudgetTemplate template = fixed(rent, "50.00", 1);
        run("200.00");
        templateService.updateTemplate(ownerId, template.getId(), UpdateTemplateCommand.builder()
            .fixedAmount(new BigDecimal("80.00"))
            .build());

        AllocationRun reprocessed = run("200.00", true);

        printOutput("Reprocessed outcome", reprocessed.getOutcomes().get(0));
        assertTrue(reprocessed.isReprocess());
        assertEquals(new BigDecimal("80.00"), reprocessed.getOutcomes().get(0).getAllocatedAmount());
        assertEquals(0, new BigDecimal("80.00").compareTo(balance(rent)));
        assertEquals(0, new BigDecimal("920.00").compareTo(balance(paycheck)));

        List<Allocation> allocations = allocationEngine.listAllocations(ownerId, period.getId());
        assertEquals(2, allocations.size());
        Allocation reversed = allocations.stream().filter(allocation -> !allocation.isProcessed()).findFirst().orElseThrow();
        assertNotNull(reversed.getReversalTransferId());
        assertEquals(new BigDecimal("50.00"), reversed.getAmount());

        printSuccess("Old allocation reversed, new amount funded");
    }

    @Test
    @DisplayName("Pool-less rerun funds a new template from the period income the first run left")
    void testPoolFromActivityOnRerun() {
        printTestHeader("Pool From Period Activity On Rerun");

        // Given: income 1000, first run funds rent 200 and savings 10%
        fixed(rent, "200.00", 1);
        percentage(savings, "10", 2);
        AllocationRun first = run(null);
        assertEquals(0, new BigDecimal("1000.00").compareTo(first.getPool()));
        assertEquals(0, new BigDecimal("300.00").compareTo(first.getTotalAllocated()));

        Account groceries = createAccount(ownerId, "Groceries", root(ownerId, AccountCategory.EXPENSE).getId());
        fixed(groceries, "250.00", 3);

        // When
        AllocationRun second = run(null);

        // Then: the pool is still the full income, earlier allocations count once
        printOutput("Second run", second);
        assertEquals(0, new BigDecimal("1000.00").compareTo(second.getPool()));
        assertEquals(OutcomeStatus.SKIPPED_ALREADY_PROCESSED, second.getOutcomes().get(0).getStatus());
        assertEquals(OutcomeStatus.SKIPPED_ALREADY_PROCESSED, second.getOutcomes().get(1).getStatus());
        assertEquals(OutcomeStatus.FUNDED, second.getOutcomes().get(2).getStatus());
        assertEquals(new BigDecimal("250.00"), second.getOutcomes().get(2).getAllocatedAmount());
        assertEquals(0, new BigDecimal("450.00").compareTo(second.getRemainingPool()));
        assertEquals(0, new BigDecimal("250.00").compareTo(balance(groceries)));
        assertEquals(0, new BigDecimal("450.00").compareTo(balance(paycheck)));

        List<Allocation> secondRunAllocations = allocationEngine.listAllocations(ownerId, period.getId()).stream()
            .filter(allocation -> second.getId().equals(allocation.getRunId()))
            .toList();
        assertEquals(1, secondRunAllocations.size());
        assertEquals(groceries.getId(), secondRunAllocations.get(0).getDestinationAccountId());

        printSuccess("New template funded 250.00 from a pool of 1000.00");
    }

    @Test
    @DisplayName("Pool-less reprocess redistributes the whole period income")
    void testPoolFromActivityOnReprocess() {
        printTestHeader("Pool From Period Activity On Reprocess");

        // Given
        BudgetTemplate template = fixed(rent, "600.00", 1);
        percentage(savings, "50", 2);
        run(null);
        assertEquals(0, new BigDecimal("400.00").compareTo(balance(savings)));
        templateService.updateTemplate(ownerId, template.getId(), UpdateTemplateCommand.builder()
            .fixedAmount(new BigDecimal("300.00"))
            .build());

        // When
        AllocationRun reprocessed = run(null, true);

        // Then: both earlier transfers are reversed before the pool is read
        printOutput("Reprocessed run", reprocessed);
        assertEquals(0, new BigDecimal("1000.00").compareTo(reprocessed.getPool()));
        assertEquals(new BigDecimal("300.00"), reprocessed.getOutcomes().get(0).getAllocatedAmount());
        assertEquals(new BigDecimal("500.00"), reprocessed.getOutcomes().get(1).getAllocatedAmount());
        assertEquals(0, new BigDecimal("300.00").compareTo(balance(rent)));
        assertEquals(0, new BigDecimal("500.00").compareTo(balance(savings)));
        assertEquals(0, new BigDecimal("200.00").compareTo(balance(paycheck)));

        printSuccess("Reprocess spread 1000.00 again");
    }

    @Test
    @DisplayName("Manual allocations stay out of the derived pool")
    void testPoolFromActivityExcludesManualAllocations() {
        fixed(rent, "100.00", 1);
        allocationEngine.allocateManually(ownerId, ManualAllocationCommand.builder()
            .sourceAccountId(paycheck.getId())
            .destinationAccountId(savings.getId())
            .periodId(period.getId())
            .amount(new BigDecimal("950.00"))
            .build());

        AllocationRun run = run(null);

        assertEquals(0, new BigDecimal("50.00").compareTo(run.getPool()));
        assertEquals(OutcomeStatus.PARTIALLY_FUNDED, run.getOutcomes().get(0).getStatus());

        allocationEngine.allocateManually(ownerId, ManualAllocationCommand.builder()
            .sourceAccountId(paycheck.getId())
            .destinationAccountId(savings.getId())
            .periodId(period.getId())
            .amount(new BigDecimal("50.00"))
            .build());
        printExpectedException("InvalidPoolException", "Nothing left of the period income");
        assertThrows(InvalidPoolException.class, () -> run(null, true));
    }

    @Test
    @DisplayName("Zero, negative or over-precise pools are rejected")
    void testInvalidPool() {
        fixed(rent, "10.00", 1);

        assertThrows(InvalidPoolException.class, () -> run("0"));
        assertThrows(InvalidPoolException.class, () -> run("-25.00"));
        assertThrows(InvalidPoolException.class, () -> run("10.001"));
        assertTrue(allocationEngine.listRuns(ownerId, null).isEmpty());
    }

    @Test
    @DisplayName("Inactive destination fails its template while the rest of the run continues")
    void testInactiveDestinationFailsOutcome() {
        printTestHeader("Inactive Destination");

        fixed(rent, "40.00", 1);
        fixed(savings, "40.00", 2);
        accountService.deactivate(ownerId, rent.getId());

        AllocationRun run = run("100.00");

        AllocationOutcome failed = run.getOutcomes().get(0);
        printOutput("Failed outcome", failed);
        assertEquals(OutcomeStatus.FAILED, failed.getStatus());
        assertEquals(ErrorKind.UNKNOWN_ACCOUNT, failed.getErrorKind());
        assertEquals(OutcomeStatus.FUNDED, run.getOutcomes().get(1).getStatus());
        assertEquals(1, run.countFailed());
        assertEquals(0, new BigDecimal("60.00").compareTo(run.getRemainingPool()));

        printSuccess("Failure isolated to one outcome");
    }

    @Test
    @DisplayName("Template pointing at the source account fails with SAME_ACCOUNT")
    void testDestinationIsSource() {
        fixed(paycheck, "10.00", 1);

        AllocationRun run = run("100.00");

        assertEquals(OutcomeStatus.FAILED, run.getOutcomes().get(0).getStatus());
        assertEquals(ErrorKind.SAME_ACCOUNT, run.getOutcomes().get(0).getErrorKind());
        assertEquals(0, new BigDecimal("1000.00").compareTo(balance(paycheck)));
    }

    @Test
    @DisplayName("Inactive source account aborts the run")
    void testInactiveSource() {
        fixed(rent, "10.00", 1);
        accountService.deactivate(ownerId, paycheck.getId());

        assertThrows(UnknownAccountException.class, () -> run("100.00"));
        assertEquals(0, balance(rent).signum());
    }

    @Test
    @DisplayName("Manual allocations move money but never mark a template processed")
    void testManualAllocation() {
        printTestHeader("Manual Allocation");

        fixed(rent, "70.00", 1);
        Allocation manual = allocationEngine.allocateManually(ownerId, ManualAllocationCommand.builder()
            .periodId(period.getId())
            .sourceAccountId(paycheck.getId())
            .destinationAccountId(rent.getId())
            .amount(new BigDecimal("25.00"))
            .notes("Deposit top-up")
            .build());

        assertTrue(manual.isManual());
        assertNull(manual.getRunId());
        assertEquals("Deposit top-up", manual.getNotes());
        assertEquals(0, new BigDecimal("25.00").compareTo(balance(rent)));

        AllocationRun run = run("100.00");
        assertEquals(OutcomeStatus.FUNDED, run.getOutcomes().get(0).getStatus());
        assertEquals(0, new BigDecimal("95.00").compareTo(balance(rent)));

        assertThrows(SameAccountException.class, () -> allocationEngine.allocateManually(ownerId,
            ManualAllocationCommand.builder()
                .periodId(period.getId())
                .sourceAccountId(rent.getId())
                .destinationAccountId(rent.getId())
                .amount(BigDecimal.ONE)
                .build()));

        printSuccess("Manual allocation independent of templates");
    }
}
