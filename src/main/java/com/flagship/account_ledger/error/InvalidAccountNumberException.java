package com.flagship.account_ledger.error;

/**
 * Account number is not 6 to 12 ASCII digits.
 */
public class InvalidAccountNumberException extends LedgerException {

    public InvalidAccountNumberException(String message) {
        super(ErrorKind.INVALID_ACCOUNT_NUMBER, message);
    }
}
