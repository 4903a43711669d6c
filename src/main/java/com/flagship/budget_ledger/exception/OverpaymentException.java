package com.flagship.budget_ledger.exception;

/**
 * Thrown when a repayment exceeds the outstanding balance or targets a paid-off loan.
 */
public class OverpaymentException extends LedgerException {

    public OverpaymentException(String message) {
        super(ErrorKind.OVERPAYMENT, message);
    }
}
