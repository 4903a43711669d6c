package com.flagship.budget_ledger.account;

/**
 * Top-level classification of an account. Every account in a subtree shares the
 * category of its root.
 */
public enum AccountCategory {
    INCOME,
    EXPENSE,
    SAVINGS,
    DEBT;

    /**
     * Name of the root account {@code setupDefaultAccounts} creates for this category.
     */
    public String defaultRootName() {
        return switch (this) {
            case INCOME -> "Income";
            case EXPENSE -> "Expenses";
            case SAVINGS -> "Savings";
            case DEBT -> "Debt";
        };
    }
}
