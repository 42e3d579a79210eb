package com.flagship.account_ledger.error;

public class CurrencyMismatchException extends LedgerException {

    public CurrencyMismatchException(String message) {
        super(ErrorKind.CURRENCY_MISMATCH, message);
    }
}
