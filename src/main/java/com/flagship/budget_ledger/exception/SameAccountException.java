package com.flagship.budget_ledger.exception;

/**
 * Thrown when a transfer, allocation or loan names the same account on both sides.
 */
public class SameAccountException extends LedgerException {

    public SameAccountException(String message) {
        super(ErrorKind.SAME_ACCOUNT, message);
    }
}
