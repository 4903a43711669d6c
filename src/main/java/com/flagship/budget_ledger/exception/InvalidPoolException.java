package com.flagship.budget_ledger.exception;

/**
 * Thrown when an allocation run is requested with a pool that is not strictly positive.
 */
public class InvalidPoolException extends LedgerException {

    public InvalidPoolException(String message) {
        super(ErrorKind.INVALID_POOL, message);
    }
}
