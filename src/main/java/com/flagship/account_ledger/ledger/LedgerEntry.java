package com.flagship.account_ledger.ledger;

import com.flagship.account_ledger.account.AccountId;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.account.Money;
import com.flagship.account_ledger.error.InvalidAmountException;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable record of one balance-affecting event against one account.
 *
 * Ledger entries are append-only: stores never update or delete them.
 * The two legs of a transfer share a correlationId and each names the other
 * party in counterpartyAccountNumber.
 */
@Value
public class LedgerEntry {
    UUID entryId;
    AccountId accountId;
    LedgerEntryType entryType;
    Money amount;
    UUID correlationId;
    AccountNumber counterpartyAccountNumber;
    Instant occurredAt;

    private LedgerEntry(UUID entryId, AccountId accountId, LedgerEntryType entryType, Money amount,
                        UUID correlationId, AccountNumber counterpartyAccountNumber, Instant occurredAt) {
        this.entryId = Objects.requireNonNull(entryId, "entryId");
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.entryType = Objects.requireNonNull(entryType, "entryType");
        this.amount = Objects.requireNonNull(amount, "amount");
        if (amount.isZero()) {
            throw new InvalidAmountException("Ledger entry amount must be greater than zero");
        }
        this.correlationId = correlationId;
        this.counterpartyAccountNumber = counterpartyAccountNumber;
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt");
    }

    /**
     * Creates a deposit or withdrawal entry stamped with the current time.
     */
    public static LedgerEntry create(AccountId accountId, LedgerEntryType entryType, Money amount) {
        return create(accountId, entryType, amount, null, null, null);
    }

    /**
     * Creates a new entry with a fresh id.
     *
     * @param correlationId optional, links the two legs of a transfer
     * @param counterpartyAccountNumber optional, the other party of a transfer
     * @param occurredAt optional, defaults to now
     */
    public static LedgerEntry create(AccountId accountId, LedgerEntryType entryType, Money amount,
                                     UUID correlationId, AccountNumber counterpartyAccountNumber,
                                     Instant occurredAt) {
        return new LedgerEntry(
            UUID.randomUUID(),
            accountId,
            entryType,
            amount,
            correlationId,
            counterpartyAccountNumber,
            occurredAt != null ? occurredAt : Instant.now()
        );
    }

    /**
     * Rebuilds a stored entry. Only stores should call this.
     */
    public static LedgerEntry restore(UUID entryId, AccountId accountId, LedgerEntryType entryType, Money amount,
                                      UUID correlationId, AccountNumber counterpartyAccountNumber,
                                      Instant occurredAt) {
        return new LedgerEntry(entryId, accountId, entryType, amount, correlationId,
            counterpartyAccountNumber, occurredAt);
    }

    public Optional<UUID> findCorrelationId() {
        return Optional.ofNullable(correlationId);
    }

    public Optional<AccountNumber> findCounterpartyAccountNumber() {
        return Optional.ofNullable(counterpartyAccountNumber);
    }
}
