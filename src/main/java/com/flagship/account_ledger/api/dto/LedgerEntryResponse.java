package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.ledger.LedgerEntryType;
import com.flagship.account_ledger.operation.LedgerEntryResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("entry_id")
    UUID entryId;

    @JsonProperty("entry_type")
    LedgerEntryType entryType;

    @JsonProperty("amount_cents")
    long amountCents;

    @JsonProperty("currency")
    String currency;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("correlation_id")
    UUID correlationId;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("counterparty_account_number")
    String counterpartyAccountNumber;

    public static LedgerEntryResponse from(LedgerEntryResult result) {
        return LedgerEntryResponse.builder()
            .entryId(result.getEntryId())
            .entryType(result.getEntryType())
            .amountCents(result.getAmountCents())
            .currency(result.getCurrency())
            .correlationId(result.getCorrelationId())
            .occurredAt(result.getOccurredAt())
            .counterpartyAccountNumber(result.getCounterpartyAccountNumber())
            .build();
    }
}
