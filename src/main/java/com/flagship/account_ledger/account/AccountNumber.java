package com.flagship.account_ledger.account;

import com.flagship.account_ledger.error.InvalidAccountNumberException;
import lombok.Value;

/**
 * External, business identity of an account: 6 to 12 ASCII digits.
 *
 * Surrounding whitespace is stripped; anything else that is not a digit is rejected.
 * The natural ordering is the global lock order for multi-account operations.
 */
@Value
public class AccountNumber implements Comparable<AccountNumber> {

    static final int MIN_LENGTH = 6;
    static final int MAX_LENGTH = 12;

    String value;

    private AccountNumber(String value) {
        this.value = value;
    }

    public static AccountNumber of(String raw) {
        if (raw == null) {
            throw new InvalidAccountNumberException("Account number is required");
        }
        String normalized = raw.strip();
        if (normalized.length() < MIN_LENGTH || normalized.length() > MAX_LENGTH) {
            throw new InvalidAccountNumberException(
                String.format("Account number must be between %d and %d digits long", MIN_LENGTH, MAX_LENGTH));
        }
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidAccountNumberException("Account number must contain only digits");
            }
        }
        return new AccountNumber(normalized);
    }

    @Override
    public int compareTo(AccountNumber other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
