package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.Account;
import lombok.Value;

/**
 * Current balance of one account.
 */
@Value
public class BalanceResult {
    String accountNumber;
    long balanceCents;
    String currency;

    static BalanceResult from(Account account) {
        return new BalanceResult(
            account.getAccountNumber().getValue(),
            account.getBalance().getAmountCents(),
            account.getCurrency());
    }
}
