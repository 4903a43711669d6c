package com.flagship.budget_ledger.exception;

/**
 * Thrown when reversing a transaction that was already reversed, or that is itself a reversal.
 */
public class AlreadyReversedException extends LedgerException {

    public AlreadyReversedException(String message) {
        super(ErrorKind.ALREADY_REVERSED, message);
    }
}
