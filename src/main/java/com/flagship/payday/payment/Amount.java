package com.flagship.payday.payment;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Monetary amount. BTC values are expressed in satoshis.
 */
public record Amount(Currency currency, long value) {

    public Amount {
        if (currency == null) {
            throw new IllegalArgumentException("Currency is required");
        }
        if (value < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + value);
        }
    }

    public static Amount sats(long sats) {
        return new Amount(Currency.BTC, sats);
    }

    public static Amount zero(Currency currency) {
        return new Amount(currency, 0);
    }

    @JsonIgnore
    public boolean isBtc() {
        return currency == Currency.BTC;
    }

    public boolean isLessThan(Amount other) {
        requireSameCurrency(other);
        return value < other.value;
    }

    public boolean isGreaterThan(Amount other) {
        requireSameCurrency(other);
        return value > other.value;
    }

    private void requireSameCurrency(Amount other) {
        if (other.currency != currency) {
            throw new IllegalArgumentException(
                String.format("Cannot compare %s with %s", currency, other.currency));
        }
    }

    @Override
    public String toString() {
        return value + " " + currency;
    }
}
