package com.flagship.account_ledger.error;

/**
 * Another transaction touched the same account row first: a version mismatch at
 * write time, a lock that could not be acquired in time, or a deadlock/serialization
 * abort reported by the database.
 *
 * The only retryable error. Orchestrators re-run the whole attempt in a fresh
 * unit of work and surface this exception once their attempts are exhausted.
 */
public class ConcurrencyConflictException extends LedgerException {

    public ConcurrencyConflictException(String message) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message, cause);
    }
}
