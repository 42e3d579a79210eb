package com.flagship.account_ledger.account;

import com.flagship.account_ledger.error.CurrencyMismatchException;
import com.flagship.account_ledger.error.InvalidAmountException;
import com.flagship.account_ledger.error.InvalidCurrencyException;
import com.flagship.account_ledger.error.NegativeResultException;
import lombok.Value;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Non-negative amount of money in minor units (cents) tagged with a currency code.
 *
 * Invariants:
 * - amountCents >= 0, always
 * - amountCents <= Long.MAX_VALUE ({@link #MAX_AMOUNT_CENTS}); a sum past it is rejected, never wrapped
 * - arithmetic and ordering are only defined between equal currencies
 *
 * Immutable: every operation returns a new Money.
 */
@Value
public class Money implements Comparable<Money> {

    public static final long MAX_AMOUNT_CENTS = Long.MAX_VALUE;

    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Z]{3}$");

    long amountCents;
    String currency;

    private Money(long amountCents, String currency) {
        if (amountCents < 0) {
            throw new InvalidAmountException("Money amount cannot be below zero: " + amountCents);
        }
        this.amountCents = amountCents;
        this.currency = normalizeCurrency(currency);
    }

    public static Money of(long amountCents, String currency) {
        return new Money(amountCents, currency);
    }

    /**
     * Builds a Money from an untrusted boxed amount, as received from a request.
     */
    public static Money of(Long amountCents, String currency) {
        if (amountCents == null) {
            throw new InvalidAmountException("Money amount is required");
        }
        return new Money(amountCents, currency);
    }

    public static Money zero(String currency) {
        return new Money(0L, currency);
    }

    public boolean isZero() {
        return amountCents == 0L;
    }

    public Money add(Money other) {
        ensureSameCurrency(other);
        try {
            return new Money(Math.addExact(amountCents, other.amountCents), currency);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(String.format(
                "Adding %s to %s would exceed the maximum amount of %d cents", other, this, MAX_AMOUNT_CENTS));
        }
    }

    public Money subtract(Money other) {
        ensureSameCurrency(other);
        if (other.amountCents > amountCents) {
            throw new NegativeResultException(
                String.format("Resulting amount cannot be negative: %d - %d", amountCents, other.amountCents));
        }
        return new Money(amountCents - other.amountCents, currency);
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Money other) {
        ensureSameCurrency(other);
        return Long.compare(amountCents, other.amountCents);
    }

    private void ensureSameCurrency(Money other) {
        if (!currency.equals(other.currency)) {
            throw new CurrencyMismatchException(
                String.format("Money currency mismatch: %s vs %s", currency, other.currency));
        }
    }

    private static String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new InvalidCurrencyException("Currency is required");
        }
        String normalized = currency.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY_CODE.matcher(normalized).matches()) {
            throw new InvalidCurrencyException("Currency must be a 3-letter code: " + currency);
        }
        return normalized;
    }

    @Override
    public String toString() {
        return amountCents + " " + currency;
    }
}
