package com.flagship.budget_ledger.loan;

/**
 * Loan lifecycle. PAID is terminal.
 */
public enum LoanStatus {
    ACTIVE,
    PAID
}
