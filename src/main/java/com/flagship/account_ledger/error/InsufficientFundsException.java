package com.flagship.account_ledger.error;

public class InsufficientFundsException extends LedgerException {

    public InsufficientFundsException(String accountNumber, long balanceCents, long requestedCents) {
        super(ErrorKind.INSUFFICIENT_FUNDS, String.format(
                "Insufficient funds on account %s: balance=%d, requested=%d",
                accountNumber, balanceCents, requestedCents));
    }
}
