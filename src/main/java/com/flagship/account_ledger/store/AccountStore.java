package com.flagship.account_ledger.store;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountNumber;

import java.util.Optional;

/**
 * Account persistence, scoped to the unit of work that handed it out.
 */
public interface AccountStore {

    /**
     * Plain read, no locking.
     */
    Optional<Account> getByNumber(AccountNumber accountNumber);

    /**
     * Read with exclusive intent: until the current unit of work ends, no other unit of
     * work can obtain the same guarantee for this account.
     *
     * Backends that cannot lock rows fall back to {@link #getByNumber} and rely on the
     * version check in {@link #save}.
     *
     * @throws com.flagship.account_ledger.error.ConcurrencyConflictException if the lock
     *         could not be acquired (timeout, row busy, deadlock victim)
     */
    default Optional<Account> getByNumberForUpdate(AccountNumber accountNumber) {
        return getByNumber(accountNumber);
    }

    /**
     * Inserts a never-persisted account or updates an existing one by id.
     * Updates are version-checked; on success the account's version advances by one.
     *
     * @throws com.flagship.account_ledger.error.ConcurrencyConflictException if the stored
     *         version moved since the account was read
     */
    void save(Account account);
}
