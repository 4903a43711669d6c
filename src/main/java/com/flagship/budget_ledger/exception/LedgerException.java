package com.flagship.budget_ledger.exception;

/**
 * Base type for all domain failures raised by the ledger engine.
 *
 * Services throw these; the REST layer maps the {@link ErrorKind} to an HTTP status.
 * A thrown LedgerException always means nothing was written: multi-leg operations
 * run in one database transaction and roll back as a unit.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
