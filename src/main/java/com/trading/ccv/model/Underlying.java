package com.trading.ccv.model;

import com.trading.ccv.error.MalformedContractException;

/**
 * Spot price of a named asset, resolved against the market model at
 * evaluation time.
 */
public record Underlying(String name) implements Observable {

    public Underlying {
        if (name == null || name.isBlank()) {
            throw new MalformedContractException("Underlying name must not be blank");
        }
    }

    @Override
    public ObservableKind kind() {
        return ObservableKind.UNDERLYING;
    }

    @Override
    public String toString() {
        return name;
    }
}
