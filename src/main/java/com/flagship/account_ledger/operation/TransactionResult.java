package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.Account;
import lombok.Value;

/**
 * Outcome of a deposit or withdrawal: the balance after the committed change.
 */
@Value
public class TransactionResult {
    String accountNumber;
    long balanceCents;
    String currency;

    static TransactionResult from(Account account) {
        return new TransactionResult(
            account.getAccountNumber().getValue(),
            account.getBalance().getAmountCents(),
            account.getCurrency());
    }
}
