package com.flagship.account_ledger.error;

public class AccountAlreadyExistsException extends LedgerException {

    public AccountAlreadyExistsException(String message) {
        super(ErrorKind.ACCOUNT_ALREADY_EXISTS, message);
    }
}
