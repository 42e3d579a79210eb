package com.flagship.account_ledger.error;

public class AccountNotFoundException extends LedgerException {

    public AccountNotFoundException(String message) {
        super(ErrorKind.ACCOUNT_NOT_FOUND, message);
    }

    public static AccountNotFoundException forNumber(String accountNumber) {
        return new AccountNotFoundException("Account with number " + accountNumber + " not found");
    }
}
