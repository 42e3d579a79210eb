package com.flagship.account_ledger.store.jdbc;

import com.flagship.account_ledger.error.ConcurrencyConflictException;
import org.springframework.dao.ConcurrencyFailureException;

import java.sql.SQLException;
import java.util.Set;

/**
 * Recognizes storage failures that mean "someone else got to the row first".
 *
 * Spring already maps most of them to {@link ConcurrencyFailureException}
 * (optimistic locking failure, lock acquisition timeout, deadlock loser,
 * serialization failure). Commit-time failures can still arrive wrapped in a
 * {@code TransactionSystemException}, so the SQLState of the cause chain is checked too.
 */
final class ConcurrencyFailures {

    // serialization_failure, deadlock_detected, lock_not_available
    private static final Set<String> CONFLICT_SQL_STATES = Set.of("40001", "40P01", "55P03");

    private ConcurrencyFailures() {
    }

    static boolean isConflict(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof ConcurrencyFailureException) {
                return true;
            }
            if (current instanceof SQLException) {
                String sqlState = ((SQLException) current).getSQLState();
                if (sqlState != null && CONFLICT_SQL_STATES.contains(sqlState)) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Returns the failure to rethrow: a {@link ConcurrencyConflictException} for conflicts,
     * the original exception for everything else.
     */
    static RuntimeException translate(String operation, RuntimeException failure) {
        if (failure instanceof ConcurrencyConflictException) {
            return failure;
        }
        if (isConflict(failure)) {
            return new ConcurrencyConflictException(operation + " failed: concurrent modification or lock contention", failure);
        }
        return failure;
    }
}
