package com.flagship.account_ledger.store;

import com.flagship.account_ledger.account.AccountId;
import com.flagship.account_ledger.ledger.LedgerEntry;

import java.util.List;

/**
 * Append-only ledger persistence. There is no update and no delete.
 */
public interface LedgerStore {

    void save(LedgerEntry entry);

    /**
     * All entries of one account, in append order (oldest first).
     */
    List<LedgerEntry> listByAccount(AccountId accountId);
}
