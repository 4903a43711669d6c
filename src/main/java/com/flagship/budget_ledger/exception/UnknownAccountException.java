package com.flagship.budget_ledger.exception;

import java.util.UUID;

/**
 * Thrown when an account does not exist, belongs to another owner, or is inactive
 * where an active account is required.
 */
public class UnknownAccountException extends LedgerException {

    public UnknownAccountException(String message) {
        super(ErrorKind.UNKNOWN_ACCOUNT, message);
    }

    public static UnknownAccountException of(UUID accountId) {
        return new UnknownAccountException("Account not found: " + accountId);
    }
}
