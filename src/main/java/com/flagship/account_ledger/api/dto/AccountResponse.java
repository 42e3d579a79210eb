package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.operation.AccountCreatedResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("balance_cents")
    long balanceCents;

    @JsonProperty("currency")
    String currency;

    public static AccountResponse from(AccountCreatedResult result) {
        return AccountResponse.builder()
            .accountId(result.getAccountId())
            .accountNumber(result.getAccountNumber())
            .balanceCents(result.getBalanceCents())
            .currency(result.getCurrency())
            .build();
    }
}
