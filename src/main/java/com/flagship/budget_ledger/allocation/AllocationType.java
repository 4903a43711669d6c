package com.flagship.budget_ledger.allocation;

public enum AllocationType {
    /** A fixed amount per period. */
    FIXED,
    /** A percentage of the run's original pool. */
    PERCENTAGE,
    /** As much as possible between a floor and a ceiling; nothing below the floor. */
    RANGE
}
