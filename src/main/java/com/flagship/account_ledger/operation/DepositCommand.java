package com.flagship.account_ledger.operation;

import lombok.Value;

@Value
public class DepositCommand {
    String accountNumber;
    long amountCents;
    String currency;
}
