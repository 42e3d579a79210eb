package com.flagship.account_ledger.error;

/**
 * Coarse grouping of ledger errors.
 *
 * VALIDATION errors are detected before any storage access, BUSINESS_RULE errors
 * during the use case, CONCURRENCY errors are the only ones ever retried.
 */
public enum ErrorCategory {
    VALIDATION,
    BUSINESS_RULE,
    CONCURRENCY
}
