package com.flagship.budget_ledger.exception;

/**
 * Thrown for zero, negative or over-precise amounts where a positive or non-zero amount is required.
 */
public class InvalidAmountException extends LedgerException {

    public InvalidAmountException(String message) {
        super(ErrorKind.INVALID_AMOUNT, message);
    }
}
