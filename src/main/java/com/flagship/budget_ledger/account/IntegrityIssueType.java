package com.flagship.budget_ledger.account;

public enum IntegrityIssueType {
    /** Parent is missing or owned by someone else. */
    ORPHANED,
    /** A default root account has a parent. */
    ROOT_WITH_PARENT,
    /** Child category differs from its parent's. */
    CATEGORY_MISMATCH,
    /** Parent links form a loop. Reported once per loop. */
    CYCLE,
    /** Cached balance differs from the ledger fold. */
    BALANCE_DRIFT,
    /** No active Income or Expenses root. */
    MISSING_DEFAULT_ACCOUNT
}
