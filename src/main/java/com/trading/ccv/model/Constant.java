package com.trading.ccv.model;

import com.trading.ccv.error.MalformedContractException;

/**
 * A literal number.
 */
public record Constant(double value) implements Observable {

    public Constant {
        if (!Double.isFinite(value)) {
            throw new MalformedContractException("Constant must be finite, got " + value);
        }
    }

    @Override
    public ObservableKind kind() {
        return ObservableKind.CONSTANT;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
