package com.flagship.account_ledger.store.memory;

import com.flagship.account_ledger.store.UnitOfWork;
import com.flagship.account_ledger.store.UnitOfWorkFactory;

/**
 * Opens units of work over one shared {@link InMemoryLedgerDatabase}.
 */
public class InMemoryUnitOfWorkFactory implements UnitOfWorkFactory {

    private final InMemoryLedgerDatabase database;
    private final boolean rowLocking;
    private final long lockTimeoutMs;

    public InMemoryUnitOfWorkFactory(InMemoryLedgerDatabase database, boolean rowLocking, long lockTimeoutMs) {
        this.database = database;
        this.rowLocking = rowLocking;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public UnitOfWork begin() {
        return new InMemoryUnitOfWork(database, rowLocking, lockTimeoutMs);
    }

    public InMemoryLedgerDatabase getDatabase() {
        return database;
    }
}
