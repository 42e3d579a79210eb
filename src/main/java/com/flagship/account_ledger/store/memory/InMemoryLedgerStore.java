package com.flagship.account_ledger.store.memory;

import com.flagship.account_ledger.account.AccountId;
import com.flagship.account_ledger.ledger.LedgerEntry;
import com.flagship.account_ledger.store.LedgerStore;

import java.util.ArrayList;
import java.util.List;

class InMemoryLedgerStore implements LedgerStore {

    private final InMemoryLedgerDatabase database;
    private final InMemoryUnitOfWork unitOfWork;

    InMemoryLedgerStore(InMemoryLedgerDatabase database, InMemoryUnitOfWork unitOfWork) {
        this.database = database;
        this.unitOfWork = unitOfWork;
    }

    @Override
    public void save(LedgerEntry entry) {
        unitOfWork.ensureActive();
        unitOfWork.stage(entry);
    }

    @Override
    public List<LedgerEntry> listByAccount(AccountId accountId) {
        unitOfWork.ensureActive();
        List<LedgerEntry> result = new ArrayList<>(database.entriesOf(accountId));
        unitOfWork.stagedEntries().stream()
            .filter(entry -> entry.getAccountId().equals(accountId))
            .forEach(result::add);
        return result;
    }
}
