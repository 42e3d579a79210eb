package com.flagship.account_ledger.operation;

import lombok.Value;

/**
 * Opens an account, optionally funded with an initial deposit.
 */
@Value
public class CreateAccountCommand {
    String accountNumber;
    long initialBalanceCents;
    String currency;
}
