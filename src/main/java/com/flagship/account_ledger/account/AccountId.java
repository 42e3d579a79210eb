package com.flagship.account_ledger.account;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Internal identity of an account, generated when the account is opened and never reused.
 */
@Value
public class AccountId {

    UUID value;

    private AccountId(UUID value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static AccountId generate() {
        return new AccountId(UUID.randomUUID());
    }

    public static AccountId of(UUID value) {
        return new AccountId(value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
