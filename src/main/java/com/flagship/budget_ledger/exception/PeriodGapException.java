package com.flagship.budget_ledger.exception;

/**
 * Thrown when no weekly period can be resolved for a date, either because the owner has no epoch or the date precedes the first period.
 */
public class PeriodGapException extends LedgerException {

    public PeriodGapException(String message) {
        super(ErrorKind.PERIOD_GAP, message);
    }
}
