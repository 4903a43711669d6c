package com.flagship.budget_ledger.exception;

import java.util.UUID;

/**
 * Thrown when a period, transaction, template or loan cannot be found in the owner's scope.
 */
public class UnknownReferenceException extends LedgerException {

    public UnknownReferenceException(String message) {
        super(ErrorKind.UNKNOWN_REFERENCE, message);
    }

    public static UnknownReferenceException of(String type, UUID id) {
        return new UnknownReferenceException(type + " not found: " + id);
    }
}
