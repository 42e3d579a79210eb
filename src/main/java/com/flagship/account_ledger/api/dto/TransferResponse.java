package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.operation.TransferResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("correlation_id")
    UUID correlationId;

    @JsonProperty("from_account_number")
    String fromAccountNumber;

    @JsonProperty("to_account_number")
    String toAccountNumber;

    @JsonProperty("from_balance_cents")
    long fromBalanceCents;

    @JsonProperty("to_balance_cents")
    long toBalanceCents;

    @JsonProperty("currency")
    String currency;

    public static TransferResponse from(TransferResult result) {
        return TransferResponse.builder()
            .correlationId(result.getCorrelationId())
            .fromAccountNumber(result.getFromAccountNumber())
            .toAccountNumber(result.getToAccountNumber())
            .fromBalanceCents(result.getFromBalanceCents())
            .toBalanceCents(result.getToBalanceCents())
            .currency(result.getCurrency())
            .build();
    }
}
