package com.flagship.account_ledger.error;

public class NegativeResultException extends LedgerException {

    public NegativeResultException(String message) {
        super(ErrorKind.NEGATIVE_RESULT, message);
    }
}
