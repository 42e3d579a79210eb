package com.flagship.account_ledger.store.memory;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.error.ConcurrencyConflictException;
import com.flagship.account_ledger.store.AccountStore;
import com.flagship.account_ledger.store.memory.InMemoryLedgerDatabase.AccountRow;
import com.flagship.account_ledger.store.memory.InMemoryLedgerDatabase.StagedAccount;

import java.util.Optional;

/**
 * Account store view of one in-memory unit of work. Reads see the unit of work's own
 * staged writes first, then committed state; every read returns a fresh Account.
 */
class InMemoryAccountStore implements AccountStore {

    private final InMemoryLedgerDatabase database;
    private final InMemoryUnitOfWork unitOfWork;
    private final boolean rowLocking;
    private final long lockTimeoutMs;

    InMemoryAccountStore(InMemoryLedgerDatabase database, InMemoryUnitOfWork unitOfWork,
                         boolean rowLocking, long lockTimeoutMs) {
        this.database = database;
        this.unitOfWork = unitOfWork;
        this.rowLocking = rowLocking;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public Optional<Account> getByNumber(AccountNumber accountNumber) {
        unitOfWork.ensureActive();
        Optional<StagedAccount> staged = unitOfWork.stagedAccount(accountNumber);
        if (staged.isPresent()) {
            return Optional.of(staged.get().getRow().toAccount());
        }
        return database.findByNumber(accountNumber).map(AccountRow::toAccount);
    }

    @Override
    public Optional<Account> getByNumberForUpdate(AccountNumber accountNumber) {
        unitOfWork.ensureActive();
        if (rowLocking) {
            database.acquireRowLock(accountNumber, unitOfWork, lockTimeoutMs);
        }
        return getByNumber(accountNumber);
    }

    @Override
    public void save(Account account) {
        unitOfWork.ensureActive();
        Optional<StagedAccount> previous = unitOfWork.stagedAccount(account.getAccountNumber());
        long expectedVersion;
        if (previous.isPresent()) {
            // Saved earlier in this unit of work: keep the version originally read.
            if (previous.get().getRow().getVersion() != account.getVersion()) {
                throw new ConcurrencyConflictException(
                    "Account " + account.getAccountNumber() + " was saved from a stale copy in this unit of work");
            }
            expectedVersion = previous.get().getExpectedVersion();
        } else {
            expectedVersion = account.getVersion();
        }
        unitOfWork.stage(new StagedAccount(AccountRow.of(account, account.getVersion() + 1), expectedVersion));
        account.markPersisted();
    }
}
