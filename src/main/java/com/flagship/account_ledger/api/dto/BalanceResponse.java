package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.operation.BalanceResult;
import com.flagship.account_ledger.operation.TransactionResult;
import lombok.Builder;
import lombok.Value;

/**
 * Balance of one account, returned by the balance, deposit and withdraw endpoints.
 */
@Value
@Builder
public class BalanceResponse {

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("balance_cents")
    long balanceCents;

    @JsonProperty("currency")
    String currency;

    public static BalanceResponse from(BalanceResult result) {
        return new BalanceResponse(result.getAccountNumber(), result.getBalanceCents(), result.getCurrency());
    }

    public static BalanceResponse from(TransactionResult result) {
        return new BalanceResponse(result.getAccountNumber(), result.getBalanceCents(), result.getCurrency());
    }
}
