package com.flagship.budget_ledger.exception;

/**
 * Thrown when an account operation would break the tree: a cycle, a foreign or inactive parent, a category that differs from the root, or a duplicate sibling name.
 */
public class InvalidHierarchyException extends LedgerException {

    public InvalidHierarchyException(String message) {
        super(ErrorKind.INVALID_HIERARCHY, message);
    }
}
