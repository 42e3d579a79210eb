package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.error.AccountNotFoundException;
import com.flagship.account_ledger.store.AccountStore;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Loads several accounts with locking intent, always in ascending account-number order.
 *
 * Every code path that locks more than one account goes through here, so two
 * operations touching the same accounts request their locks in the same global
 * order and cannot wait on each other in a cycle.
 */
final class OrderedAccountLocker {

    private OrderedAccountLocker() {
    }

    /**
     * @return the locked accounts keyed by number, in the order they were locked
     * @throws AccountNotFoundException for the first number, in lock order, with no account
     */
    static Map<AccountNumber, Account> lockInOrder(AccountStore accounts, Collection<AccountNumber> numbers) {
        Map<AccountNumber, Account> locked = new LinkedHashMap<>();
        for (AccountNumber number : new TreeSet<>(numbers)) {
            Account account = accounts.getByNumberForUpdate(number)
                .orElseThrow(() -> AccountNotFoundException.forNumber(number.getValue()));
            locked.put(number, account);
        }
        return locked;
    }
}
