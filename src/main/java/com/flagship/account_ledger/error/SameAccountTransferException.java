package com.flagship.account_ledger.error;

public class SameAccountTransferException extends LedgerException {

    public SameAccountTransferException(String message) {
        super(ErrorKind.SAME_ACCOUNT_TRANSFER, message);
    }
}
