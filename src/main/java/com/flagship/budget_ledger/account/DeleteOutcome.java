package com.flagship.budget_ledger.account;

/**
 * What {@link AccountService#deleteAccount} did to the subtree.
 */
public enum DeleteOutcome {
    /** No history anywhere in the subtree: the rows are gone. */
    DELETED,
    /** Some account in the subtree has history: the subtree was deactivated instead. */
    DEACTIVATED
}
