package com.flagship.account_ledger.account;

import com.flagship.account_ledger.error.InsufficientFundsException;
import com.flagship.account_ledger.error.InvalidAmountException;
import lombok.Getter;

import java.util.Objects;

/**
 * Account aggregate: identity, account number and current balance.
 *
 * Key invariants:
 * - balance never goes below zero
 * - the balance changes only through {@link #deposit(Money)} and {@link #withdraw(Money)}
 * - version is the persisted version this instance was loaded at (0 = never persisted);
 *   stores compare it on write and advance it by exactly one per persisted mutation
 *
 * Mutations are in-memory only. Persisting them is the caller's job, inside a unit of work.
 * An instance belongs to the unit of work that loaded it and must not be reused after it closes.
 */
@Getter
public class Account {

    private final AccountId accountId;
    private final AccountNumber accountNumber;
    private Money balance;
    private long version;

    private Account(AccountId accountId, AccountNumber accountNumber, Money balance, long version) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.accountNumber = Objects.requireNonNull(accountNumber, "accountNumber");
        this.balance = Objects.requireNonNull(balance, "balance");
        if (version < 0) {
            throw new IllegalArgumentException("Version cannot be negative: " + version);
        }
        this.version = version;
    }

    /**
     * Opens a new account with a zero balance and a fresh identity.
     */
    public static Account open(AccountNumber accountNumber, String currency) {
        return new Account(AccountId.generate(), accountNumber, Money.zero(currency), 0L);
    }

    /**
     * Rebuilds an account from stored state. Only stores should call this.
     */
    public static Account restore(AccountId accountId, AccountNumber accountNumber, Money balance, long version) {
        return new Account(accountId, accountNumber, balance, version);
    }

    public void deposit(Money amount) {
        if (amount.isZero()) {
            throw new InvalidAmountException("Deposit amount must be greater than zero");
        }
        this.balance = balance.add(amount);
    }

    public void withdraw(Money amount) {
        if (amount.isZero()) {
            throw new InvalidAmountException("Withdrawal amount must be greater than zero");
        }
        if (amount.isGreaterThan(balance)) {
            throw new InsufficientFundsException(
                accountNumber.getValue(), balance.getAmountCents(), amount.getAmountCents());
        }
        this.balance = balance.subtract(amount);
    }

    public String getCurrency() {
        return balance.getCurrency();
    }

    public boolean isNew() {
        return version == 0L;
    }

    /**
     * Records that a store has written this state. Called by store implementations only,
     * after the version-checked write succeeded.
     */
    public void markPersisted() {
        this.version = version + 1;
    }

    @Override
    public String toString() {
        return "Account{" + accountNumber + ", balance=" + balance + ", version=" + version + "}";
    }
}
