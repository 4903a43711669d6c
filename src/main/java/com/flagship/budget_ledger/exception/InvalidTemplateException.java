package com.flagship.budget_ledger.exception;

/**
 * Thrown when a budget template's amounts do not fit its allocation type.
 */
public class InvalidTemplateException extends LedgerException {

    public InvalidTemplateException(String message) {
        super(ErrorKind.INVALID_TEMPLATE, message);
    }
}
