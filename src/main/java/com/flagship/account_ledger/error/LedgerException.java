package com.flagship.account_ledger.error;

/**
 * Base class for every failure the ledger core reports to its callers.
 *
 * Inbound adapters switch on {@link #getKind()} instead of on the concrete
 * subclass; storage failures that are not concurrency related never become a
 * LedgerException and propagate as Spring {@code DataAccessException}s.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ErrorCategory getCategory() {
        return kind.category();
    }
}
