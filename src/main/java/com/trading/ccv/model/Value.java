package com.trading.ccv.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A scalar amount denominated in a single currency.
 */
public record Value(double amount, Currency currency) {

    public Value {
        Objects.requireNonNull(currency, "currency");
    }

    public static Value of(double amount, Currency currency) {
        return new Value(amount, currency);
    }

    public Value negate() {
        return new Value(-amount, currency);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%.6f %s", amount, currency);
    }
}
