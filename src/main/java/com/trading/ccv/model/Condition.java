package com.trading.ccv.model;

import com.trading.ccv.error.MalformedContractException;

/**
 * Boolean comparison of two numeric sub-observables. Only {@link When} and
 * {@link Anytime} accept a condition.
 */
public record Condition(ComparisonOp op, Observable left, Observable right) implements Observable {

    public Condition {
        if (op == null || left == null || right == null) {
            throw new MalformedContractException("Condition requires an operator and two operands");
        }
        if (left.isBoolean() || right.isBoolean()) {
            throw new MalformedContractException("Operands of '" + op.symbol() + "' must be numeric");
        }
    }

    @Override
    public ObservableKind kind() {
        return ObservableKind.CONDITION;
    }

    @Override
    public String toString() {
        return "(" + left + " " + op.symbol() + " " + right + ")";
    }
}
