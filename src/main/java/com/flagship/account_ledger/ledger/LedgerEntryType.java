package com.flagship.account_ledger.ledger;

/**
 * Kind of balance-affecting event recorded against one account.
 * A transfer always produces exactly one TRANSFER_OUT and one TRANSFER_IN.
 */
public enum LedgerEntryType {
    DEPOSIT,
    WITHDRAWAL,
    TRANSFER_IN,
    TRANSFER_OUT
}
