package com.flagship.account_ledger.store.memory;

import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.ledger.LedgerEntry;
import com.flagship.account_ledger.store.AccountStore;
import com.flagship.account_ledger.store.LedgerStore;
import com.flagship.account_ledger.store.UnitOfWork;
import com.flagship.account_ledger.store.memory.InMemoryLedgerDatabase.StagedAccount;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unit of work over {@link InMemoryLedgerDatabase}: writes are staged locally and
 * applied atomically on commit; row locks are held until commit or rollback.
 */
class InMemoryUnitOfWork implements UnitOfWork {

    private final InMemoryLedgerDatabase database;
    private final InMemoryAccountStore accounts;
    private final InMemoryLedgerStore ledger;

    private final Map<AccountNumber, StagedAccount> stagedAccounts = new LinkedHashMap<>();
    private final List<LedgerEntry> stagedEntries = new ArrayList<>();

    private boolean active = true;
    private boolean closed;

    InMemoryUnitOfWork(InMemoryLedgerDatabase database, boolean rowLocking, long lockTimeoutMs) {
        this.database = database;
        this.accounts = new InMemoryAccountStore(database, this, rowLocking, lockTimeoutMs);
        this.ledger = new InMemoryLedgerStore(database, this);
    }

    @Override
    public AccountStore accounts() {
        ensureActive();
        return accounts;
    }

    @Override
    public LedgerStore ledger() {
        ensureActive();
        return ledger;
    }

    @Override
    public void commit() {
        ensureActive();
        try {
            database.apply(stagedAccounts.values(), stagedEntries);
        } finally {
            finish();
        }
    }

    @Override
    public void rollback() {
        if (!active) {
            return;
        }
        finish();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        rollback();
    }

    void ensureActive() {
        if (closed) {
            throw new IllegalStateException("Unit of work is closed");
        }
        if (!active) {
            throw new IllegalStateException("Unit of work is no longer active");
        }
    }

    Optional<StagedAccount> stagedAccount(AccountNumber accountNumber) {
        return Optional.ofNullable(stagedAccounts.get(accountNumber));
    }

    void stage(StagedAccount account) {
        stagedAccounts.put(account.getRow().getAccountNumber(), account);
    }

    void stage(LedgerEntry entry) {
        stagedEntries.add(entry);
    }

    List<LedgerEntry> stagedEntries() {
        return stagedEntries;
    }

    private void finish() {
        active = false;
        stagedAccounts.clear();
        stagedEntries.clear();
        database.releaseRowLocks(this);
    }
}
