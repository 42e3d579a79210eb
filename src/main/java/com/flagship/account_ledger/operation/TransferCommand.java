package com.flagship.account_ledger.operation;

import lombok.Value;

@Value
public class TransferCommand {
    String fromAccountNumber;
    String toAccountNumber;
    long amountCents;
    String currency;
}
