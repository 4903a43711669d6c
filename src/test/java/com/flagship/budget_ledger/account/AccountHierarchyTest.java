package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.exception.InvalidHierarchyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccountHierarchyTest {

    private final UUID owner = UUID.randomUUID();
    private final Account expenses = AccountFixtures.root(owner, AccountCategory.EXPENSE);
    private final Account housing = AccountFixtures.child(owner, "Housing", AccountCategory.EXPENSE, expenses.getId());
    private final Account rent = AccountFixtures.child(owner, "Rent", AccountCategory.EXPENSE, housing.getId());
    private final Account income = AccountFixtures.root(owner, AccountCategory.INCOME);
    private final AccountHierarchy hierarchy = AccountHierarchy.of(List.of(expenses, housing, rent, income));

    @Test
    @DisplayName("Moving a parent under its own descendant is rejected as a cycle")
    void cycleRejected() {
        InvalidHierarchyException error = assertThrows(InvalidHierarchyException.class,
            () -> hierarchy.validatePlacement(owner, housing.getId(), "Housing", AccountCategory.EXPENSE, rent));

        assertTrue(error.getMessage().contains("cycle"));
    }

    @Test
    @DisplayName("Child category must match the root category of the new parent")
    void categoryMismatchRejected() {
        assertThrows(InvalidHierarchyException.class,
            () -> hierarchy.validatePlacement(owner, null, "Salary", AccountCategory.INCOME, housing));

        assertDoesNotThrow(
            () -> hierarchy.validatePlacement(owner, null, "Salary", AccountCategory.INCOME, income));
    }

    @Test
    @DisplayName("Sibling names are unique ignoring case, but the account may keep its own name")
    void siblingNamesUnique() {
        assertThrows(InvalidHierarchyException.class,
            () -> hierarchy.validatePlacement(owner, null, "rent", AccountCategory.EXPENSE, housing));

        assertDoesNotThrow(
            () -> hierarchy.validatePlacement(owner, rent.getId(), "RENT", AccountCategory.EXPENSE, housing));
        assertDoesNotThrow(
            () -> hierarchy.validatePlacement(owner, null, "Rent", AccountCategory.EXPENSE, expenses));
    }

    @Test
    @DisplayName("Parent owned by someone else is rejected")
    void foreignParentRejected() {
        Account foreign = AccountFixtures.root(UUID.randomUUID(), AccountCategory.EXPENSE);

        assertThrows(InvalidHierarchyException.class,
            () -> hierarchy.validatePlacement(owner, null, "Food", AccountCategory.EXPENSE, foreign));
    }

    @Test
    @DisplayName("Subtree lists the account and all descendants")
    void subtree() {
        assertEquals(List.of(expenses, housing, rent), hierarchy.subtree(expenses.getId()));
        assertEquals(List.of(rent), hierarchy.subtree(rent.getId()));
        assertTrue(hierarchy.subtree(UUID.randomUUID()).isEmpty());
    }
}
