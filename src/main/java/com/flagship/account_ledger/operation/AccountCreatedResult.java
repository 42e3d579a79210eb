package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.Account;
import lombok.Value;

import java.util.UUID;

@Value
public class AccountCreatedResult {
    UUID accountId;
    String accountNumber;
    long balanceCents;
    String currency;

    static AccountCreatedResult from(Account account) {
        return new AccountCreatedResult(
            account.getAccountId().getValue(),
            account.getAccountNumber().getValue(),
            account.getBalance().getAmountCents(),
            account.getCurrency());
    }
}
