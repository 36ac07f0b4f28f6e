package com.trading.ccv.model;

import com.trading.ccv.error.MalformedContractException;

/**
 * Numeric operator applied to two numeric sub-observables.
 */
public record BinaryOp(ArithmeticOp op, Observable left, Observable right) implements Observable {

    public BinaryOp {
        if (op == null || left == null || right == null) {
            throw new MalformedContractException("BinaryOp requires an operator and two operands");
        }
        if (left.isBoolean() || right.isBoolean()) {
            throw new MalformedContractException("Operands of '" + op.symbol() + "' must be numeric");
        }
    }

    @Override
    public ObservableKind kind() {
        return ObservableKind.BINARY_OP;
    }

    @Override
    public String toString() {
        if (op.isPrefix()) {
            return op.symbol() + "(" + left + ", " + right + ")";
        }
        return "(" + left + " " + op.symbol() + " " + right + ")";
    }
}
