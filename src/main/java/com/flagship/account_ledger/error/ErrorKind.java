package com.flagship.account_ledger.error;

/**
 * One tag per failure condition the ledger core can report.
 */
public enum ErrorKind {
    INVALID_ACCOUNT_NUMBER(ErrorCategory.VALIDATION),
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_CURRENCY(ErrorCategory.VALIDATION),
    CURRENCY_MISMATCH(ErrorCategory.VALIDATION),
    NEGATIVE_RESULT(ErrorCategory.VALIDATION),
    SAME_ACCOUNT_TRANSFER(ErrorCategory.VALIDATION),
    ACCOUNT_NOT_FOUND(ErrorCategory.BUSINESS_RULE),
    ACCOUNT_ALREADY_EXISTS(ErrorCategory.BUSINESS_RULE),
    INSUFFICIENT_FUNDS(ErrorCategory.BUSINESS_RULE),
    CONCURRENCY_CONFLICT(ErrorCategory.CONCURRENCY);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    public boolean isRetryable() {
        return category == ErrorCategory.CONCURRENCY;
    }
}
