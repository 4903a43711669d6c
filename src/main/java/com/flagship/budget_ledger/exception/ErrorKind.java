package com.flagship.budget_ledger.exception;

/**
 * Classification of every failure the ledger engine reports to callers.
 */
public enum ErrorKind {
    INVALID_HIERARCHY,
    INVALID_AMOUNT,
    SAME_ACCOUNT,
    UNKNOWN_ACCOUNT,
    UNKNOWN_REFERENCE,
    INVALID_POOL,
    INVALID_TEMPLATE,
    OVERPAYMENT,
    PERIOD_GAP,
    ALREADY_REVERSED
}
