package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.ledger.LedgerEntry;
import com.flagship.account_ledger.ledger.LedgerEntryType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResult {
    UUID entryId;
    LedgerEntryType entryType;
    long amountCents;
    String currency;
    UUID correlationId;
    Instant occurredAt;
    String counterpartyAccountNumber;

    static LedgerEntryResult from(LedgerEntry entry) {
        return LedgerEntryResult.builder()
            .entryId(entry.getEntryId())
            .entryType(entry.getEntryType())
            .amountCents(entry.getAmount().getAmountCents())
            .currency(entry.getAmount().getCurrency())
            .correlationId(entry.getCorrelationId())
            .occurredAt(entry.getOccurredAt())
            .counterpartyAccountNumber(entry.findCounterpartyAccountNumber()
                .map(AccountNumber::getValue)
                .orElse(null))
            .build();
    }
}
