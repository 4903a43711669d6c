package com.flagship.budget_ledger.ledger;

public enum TransactionKind {
    INCOME,
    EXPENSE,
    TRANSFER,
    LOAN_DISBURSEMENT,
    LOAN_REPAYMENT,
    INTEREST_ACCRUAL
}
