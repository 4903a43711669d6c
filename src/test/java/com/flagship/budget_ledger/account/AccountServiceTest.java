package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.PostgresIntegrationTest;
import com.flagship.budget_ledger.exception.InvalidHierarchyException;
import com.flagship.budget_ledger.exception.UnknownAccountException;
import com.flagship.budget_ledger.ledger.LedgerService;
import com.flagship.budget_ledger.ledger.PostTransactionCommand;
import com.flagship.budget_ledger.ledger.TransactionKind;
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
 * Account tree tests: structure changes must keep the tree acyclic, single-category
 * per subtree and owner-scoped.
 */
class AccountServiceTest extends PostgresIntegrationTest {

    @Autowired
    private LedgerService ledgerService;

    private UUID ownerId;
    private Account expenses;

    @BeforeEach
    void setUp() {
        ownerId = newOwner();
        expenses = root(ownerId, AccountCategory.EXPENSE);
    }

    @Test
    @DisplayName("Default accounts are created once, repeated setup returns the same roots")
    void testSetupDefaultAccountsIsIdempotent() {
        printTestHeader("Setup Default Accounts Twice");

        // When: setup runs again for an owner that already has defaults
        List<Account> again = accountService.setupDefaultAccounts(ownerId);

        // Then: still one root per category, same ids
        printOutput("Roots", again.stream().map(Account::getName).toList());
        assertEquals(AccountCategory.values().length, again.size());
        assertEquals(expenses.getId(), again.stream()
            .filter(account -> account.getCategory() == AccountCategory.EXPENSE)
            .findFirst().orElseThrow().getId());
        assertEquals(AccountCategory.values().length,
            accountService.listAccounts(ownerId, true).stream().filter(Account::isRootAccount).count());

        printSuccess("Default setup is idempotent");
    }

    @Test
    @DisplayName("Child account inherits the category of its parent")
    void testChildInheritsCategory() {
        printTestHeader("Child Inherits Category");

        Account housing = createAccount(ownerId, "Housing", expenses.getId());
        Account rent = createAccount(ownerId, "Rent", housing.getId());

        printOutput("Rent category", rent.getCategory());
        assertEquals(AccountCategory.EXPENSE, rent.getCategory());
        assertEquals(housing.getId(), rent.getParentId());
        assertFalse(rent.isRootAccount());

        printSuccess("Category inherited through two levels");
    }

    @Test
    @DisplayName("Explicit category that differs from the parent's is rejected")
    void testCategoryMismatchRejected() {
        printTestHeader("Category Mismatch");

        InvalidHierarchyException error = assertThrows(InvalidHierarchyException.class,
            () -> accountService.createAccount(ownerId, CreateAccountCommand.builder()
                .name("Salary")
                .category(AccountCategory.INCOME)
                .parentId(expenses.getId())
                .build()));

        printExpectedException("InvalidHierarchyException", error.getMessage());
    }

    @Test
    @DisplayName("Sibling names must be unique ignoring case")
    void testDuplicateSiblingName() {
        printTestHeader("Duplicate Sibling Name");

        createAccount(ownerId, "Groceries", expenses.getId());

        assertThrows(InvalidHierarchyException.class, () -> createAccount(ownerId, "GROCERIES", expenses.getId()));
        Account elsewhere = createAccount(ownerId, "Groceries", createAccount(ownerId, "Food", expenses.getId()).getId());
        assertNotNull(elsewhere.getId(), "Same name under another parent is allowed");

        printSuccess("Duplicate rejected only among siblings");
    }

    @Test
    @DisplayName("Reparenting an account under its own descendant is rejected and leaves the tree unchanged")
    void testReparentCycleRejected() {
        printTestHeader("Reparent Creating Cycle");

        // Given: Expenses > Housing > Rent
        Account housing = createAccount(ownerId, "Housing", expenses.getId());
        Account rent = createAccount(ownerId, "Rent", housing.getId());
        printInput("Move", "Housing under Rent");

        // When / Then
        InvalidHierarchyException error = assertThrows(InvalidHierarchyException.class,
            () -> accountService.reparent(ownerId, housing.getId(), rent.getId()));
        printExpectedException("InvalidHierarchyException", error.getMessage());

        assertEquals(expenses.getId(), accountService.require(ownerId, housing.getId()).getParentId());
        assertEquals(housing.getId(), accountService.require(ownerId, rent.getId()).getParentId());

        printSuccess("Cycle rejected, tree unchanged");
    }

    @Test
    @DisplayName("Valid reparent moves the whole subtree")
    void testReparentMovesSubtree() {
        printTestHeader("Reparent Subtree");

        Account housing = createAccount(ownerId, "Housing", expenses.getId());
        Account utilities = createAccount(ownerId, "Utilities", expenses.getId());
        Account water = createAccount(ownerId, "Water", utilities.getId());

        accountService.reparent(ownerId, utilities.getId(), housing.getId());

        AccountTree.Node waterNode = accountService.tree(ownerId, false).find(water.getId()).orElseThrow();
        printOutput("Path", waterNode.getPath());
        assertEquals("Expenses > Housing > Utilities > Water", waterNode.getPath());
        assertEquals(3, waterNode.getDepth());

        printSuccess("Subtree moved with its parent");
    }

    @Test
    @DisplayName("Root accounts cannot be moved under another account")
    void testRootCannotMove() {
        Account savings = root(ownerId, AccountCategory.SAVINGS);
        Account emergency = createAccount(ownerId, "Emergency", savings.getId());

        assertThrows(InvalidHierarchyException.class,
            () -> accountService.reparent(ownerId, savings.getId(), emergency.getId()));
    }

    @Test
    @DisplayName("Parent owned by another owner is rejected")
    void testCrossOwnerParentRejected() {
        printTestHeader("Cross-Owner Parent");

        UUID otherOwner = newOwner();
        Account foreignExpenses = root(otherOwner, AccountCategory.EXPENSE);

        assertThrows(InvalidHierarchyException.class, () -> createAccount(ownerId, "Sneaky", foreignExpenses.getId()));
        assertThrows(UnknownAccountException.class, () -> accountService.require(ownerId, foreignExpenses.getId()));

        printSuccess("Owners cannot see or attach to each other's accounts");
    }

    @Test
    @DisplayName("Deactivation cascades to descendants; a child cannot be activated under an inactive parent")
    void testDeactivateCascades() {
        printTestHeader("Deactivate Subtree");

        Account housing = createAccount(ownerId, "Housing", expenses.getId());
        Account rent = createAccount(ownerId, "Rent", housing.getId());

        int changed = accountService.deactivate(ownerId, housing.getId());

        printOutput("Accounts deactivated", changed);
        assertEquals(2, changed);
        assertFalse(accountService.require(ownerId, rent.getId()).isActive());
        assertThrows(InvalidHierarchyException.class, () -> accountService.activate(ownerId, rent.getId()));
        assertThrows(InvalidHierarchyException.class, () -> createAccount(ownerId, "Mortgage", housing.getId()));

        accountService.activate(ownerId, housing.getId());
        assertTrue(accountService.require(ownerId, housing.getId()).isActive());
        assertFalse(accountService.require(ownerId, rent.getId()).isActive(), "Descendants keep their own state");

        printSuccess("Deactivation cascaded, activation is per account");
    }

    @Test
    @DisplayName("Account without history is deleted; one with history is deactivated instead")
    void testDeleteAccount() {
        printTestHeader("Delete Account");

        WeeklyPeriod period = currentPeriod(ownerId);
        Account unused = createAccount(ownerId, "Unused", expenses.getId());
        Account unusedChild = createAccount(ownerId, "Unused Child", unused.getId());
        Account used = createAccount(ownerId, "Used", expenses.getId());
        ledgerService.post(ownerId, PostTransactionCommand.builder()
            .accountId(used.getId())
            .periodId(period.getId())
            .amount(new BigDecimal("-12.00"))
            .kind(TransactionKind.EXPENSE)
            .build());

        assertEquals(DeleteOutcome.DELETED, accountService.deleteAccount(ownerId, unused.getId()));
        assertTrue(accountService.find(ownerId, unusedChild.getId()).isEmpty());

        assertEquals(DeleteOutcome.DEACTIVATED, accountService.deleteAccount(ownerId, used.getId()));
        Account kept = accountService.require(ownerId, used.getId());
        assertFalse(kept.isActive());
        assertEquals(new BigDecimal("-12.00"), kept.getCurrentBalance());

        printSuccess("History preserved by deactivation");
    }

    @Test
    @DisplayName("Balance folds the ledger, matches the cache and rolls up subtrees")
    void testBalances() {
        printTestHeader("Balances");

        WeeklyPeriod period = currentPeriod(ownerId);
        Account food = createAccount(ownerId, "Food", expenses.getId());
        Account snacks = createAccount(ownerId, "Snacks", food.getId());
        post(food.getId(), period.getId(), "40.00");
        post(food.getId(), period.getId(), "-15.50");
        post(snacks.getId(), period.getId(), "7.25");

        BigDecimal folded = accountService.balance(ownerId, food.getId(), null);
        BigDecimal cached = accountService.cachedBalance(ownerId, food.getId());
        BigDecimal subtree = accountService.subtreeBalance(ownerId, food.getId());

        printOutput("Folded", folded);
        printOutput("Cached", cached);
        printOutput("Subtree", subtree);
        assertEquals(new BigDecimal("24.50"), folded);
        assertEquals(0, folded.compareTo(cached));
        assertEquals(new BigDecimal("31.75"), subtree);
        assertEquals(new BigDecimal("24.50"), accountService.balance(ownerId, food.getId(), period.getId()));

        printSuccess("Cached balance equals the ledger fold");
    }

    @Test
    @DisplayName("Balance as of an earlier period ignores later transactions")
    void testBalanceAsOfPeriod() {
        WeeklyPeriod current = currentPeriod(ownerId);
        WeeklyPeriod first = periodService.periodContaining(ownerId, current.getStartDate().minusDays(14)).orElseThrow();
        Account food = createAccount(ownerId, "Food", expenses.getId());
        post(food.getId(), first.getId(), "10.00");
        post(food.getId(), current.getId(), "5.00");

        assertEquals(new BigDecimal("10.00"), accountService.balance(ownerId, food.getId(), first.getId()));
        assertEquals(new BigDecimal("15.00"), accountService.balance(ownerId, food.getId(), current.getId()));
    }

    private void post(UUID accountId, UUID periodId, String amount) {
        ledgerService.post(ownerId, PostTransactionCommand.builder()
            .accountId(accountId)
            .periodId(periodId)
            .amount(new BigDecimal(amount))
            .kind(TransactionKind.EXPENSE)
            .build());
    }
}
