package com.flagship.account_ledger.store.memory;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountId;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.account.Money;
import com.flagship.account_ledger.error.ConcurrencyConflictException;
import com.flagship.account_ledger.ledger.LedgerEntry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process-local account and ledger tables shared by all in-memory units of work.
 *
 * Holds committed state only. Units of work stage their writes and hand them to
 * {@link #apply} at commit, where versions and account-number uniqueness are validated
 * atomically. Row locks are owned by a unit of work, not by a thread, and are released
 * when that unit of work commits or rolls back.
 */
@Slf4j
public class InMemoryLedgerDatabase {

    private final Map<AccountId, AccountRow> accountsById = new HashMap<>();
    private final Map<AccountNumber, AccountId> accountIdsByNumber = new HashMap<>();
    private final List<LedgerEntry> entries = new ArrayList<>();

    private final Object lockMonitor = new Object();
    private final Map<AccountNumber, Object> rowLockOwners = new HashMap<>();

    synchronized Optional<AccountRow> findByNumber(AccountNumber accountNumber) {
        AccountId id = accountIdsByNumber.get(accountNumber);
        return id == null ? Optional.empty() : Optional.of(accountsById.get(id));
    }

    synchronized List<LedgerEntry> entriesOf(AccountId accountId) {
        return entries.stream()
            .filter(entry -> entry.getAccountId().equals(accountId))
            .toList();
    }

    /**
     * Validates and applies one unit of work's staged writes, all or nothing.
     *
     * @throws ConcurrencyConflictException if any updated row moved past its expected version
     * @throws DuplicateKeyException if an inserted account number already exists
     */
    synchronized void apply(Collection<StagedAccount> stagedAccounts, List<LedgerEntry> stagedEntries) {
        for (StagedAccount staged : stagedAccounts) {
            AccountRow current = accountsById.get(staged.getRow().getAccountId());
            if (staged.getExpectedVersion() == 0L) {
                if (current != null || accountIdsByNumber.containsKey(staged.getRow().getAccountNumber())) {
                    throw new DuplicateKeyException(
                        "Account number already exists: " + staged.getRow().getAccountNumber());
                }
            } else if (current == null || current.getVersion() != staged.getExpectedVersion()) {
                throw new ConcurrencyConflictException(String.format(
                    "Account %s was modified concurrently (expected version %d, found %s)",
                    staged.getRow().getAccountNumber(), staged.getExpectedVersion(),
                    current == null ? "none" : String.valueOf(current.getVersion())));
            }
        }
        for (StagedAccount staged : stagedAccounts) {
            AccountRow row = staged.getRow();
            accountsById.put(row.getAccountId(), row);
            accountIdsByNumber.put(row.getAccountNumber(), row.getAccountId());
        }
        entries.addAll(stagedEntries);
    }

    /**
     * Blocks until the owner holds the row lock for the account number, or the timeout passes.
     * Re-acquiring a lock the owner already holds returns immediately.
     */
    void acquireRowLock(AccountNumber accountNumber, Object owner, long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        synchronized (lockMonitor) {
            while (true) {
                Object holder = rowLockOwners.get(accountNumber);
                if (holder == null) {
                    rowLockOwners.put(accountNumber, owner);
                    return;
                }
                if (holder == owner) {
                    return;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.debug("Row lock wait timed out for account {}", accountNumber);
                    throw new ConcurrencyConflictException(
                        "Timed out after " + timeoutMs + "ms waiting for lock on account " + accountNumber);
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(lockMonitor, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for lock on account " + accountNumber, e);
                }
            }
        }
    }

    void releaseRowLocks(Object owner) {
        synchronized (lockMonitor) {
            if (rowLockOwners.values().removeIf(holder -> holder == owner)) {
                lockMonitor.notifyAll();
            }
        }
    }

    public synchronized int accountCount() {
        return accountsById.size();
    }

    public synchronized int entryCount() {
        return entries.size();
    }

    /**
     * Committed state of one account.
     */
    @Value
    static class AccountRow {
        AccountId accountId;
        AccountNumber accountNumber;
        long balanceCents;
        String currency;
        long version;

        static AccountRow of(Account account, long version) {
            return new AccountRow(account.getAccountId(), account.getAccountNumber(),
                account.getBalance().getAmountCents(), account.getCurrency(), version);
        }

        Account toAccount() {
            return Account.restore(accountId, accountNumber, Money.of(balanceCents, currency), version);
        }
    }

    /**
     * A write waiting for commit: the new row plus the version it was read at (0 for inserts).
     */
    @Value
    static class StagedAccount {
        AccountRow row;
        long expectedVersion;
    }
}
