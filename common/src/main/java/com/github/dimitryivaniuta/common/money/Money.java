package com.github.dimitryivaniuta.common.money;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Amount of an in-game currency (COIN, GEM, ...). Amounts are whole units; there are no
 * fractional digits, unlike ISO currencies.
 */
public record Money(String currency, long amount) {

    private static final Pattern CODE = Pattern.compile("^[A-Z][A-Z0-9_]{1,15}$");

    public Money {
        Objects.requireNonNull(currency, "currency");
        currency = currency.trim().toUpperCase();
        if (!CODE.matcher(currency).matches()) {
            throw new IllegalArgumentException("Invalid currency code: " + currency);
        }
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
    }

    public static Money of(String currency, long amount) {
        return new Money(currency, amount);
    }

    public static Money zero(String currency) {
        return new Money(currency, 0);
    }

    public boolean isZero() { return amount == 0; }

    public Money plus(Money other) {
        requireSameCurrency(other);
        return new Money(currency, Math.addExact(amount, other.amount));
    }

    /** Throws if the result would be negative. */
    public Money minus(Money other) {
        requireSameCurrency(other);
        return new Money(currency, amount - other.amount);
    }

    public Money times(long factor) {
        return new Money(currency, Math.multiplyExact(amount, factor));
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "other");
        if (!currency.equals(other.currency)) {
            throw new IllegalArgumentException("Currency mismatch: " + currency + " vs " + other.currency);
        }
    }
}
