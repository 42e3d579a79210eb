package com.flagship.account_ledger.error;

/**
 * Money amount is negative, missing, or zero where a positive amount is required.
 */
public class InvalidAmountException extends LedgerException {

    public InvalidAmountException(String message) {
        super(ErrorKind.INVALID_AMOUNT, message);
    }
}
