package com.flagship.account_ledger.operation;

import lombok.Value;

@Value
public class WithdrawCommand {
    String accountNumber;
    long amountCents;
    String currency;
}
