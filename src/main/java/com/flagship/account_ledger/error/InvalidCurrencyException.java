package com.flagship.account_ledger.error;

/**
 * Currency code is empty or not a three-letter code.
 */
public class InvalidCurrencyException extends LedgerException {

    public InvalidCurrencyException(String message) {
        super(ErrorKind.INVALID_CURRENCY, message);
    }
}
