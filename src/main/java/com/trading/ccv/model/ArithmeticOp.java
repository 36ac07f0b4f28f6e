package com.trading.ccv.model;

import java.util.function.DoubleBinaryOperator;

/**
 * Numeric operators of {@link BinaryOp}.
 *
 * <p>
 * {@link #MAX} and {@link #MIN} express intrinsic payoffs such as
 * {@code max(0, S - K)}. {@link #AVG} is the arithmetic mean of its two
 * operands; averaging along a price path is not modelled.
 */
public enum ArithmeticOp {
    ADD("+", false, (a, b) -> a + b),
    SUB("-", false, (a, b) -> a - b),
    MUL("*", false, (a, b) -> a * b),
    DIV("/", false, (a, b) -> a / b),
    MAX("max", true, Math::max),
    MIN("min", true, Math::min),
    AVG("avg", true, (a, b) -> 0.5 * (a + b));

    private final String symbol;
    private final boolean prefix;
    private final DoubleBinaryOperator fn;

    ArithmeticOp(String symbol, boolean prefix, DoubleBinaryOperator fn) {
        this.symbol = symbol;
        this.prefix = prefix;
        this.fn = fn;
    }

    public double apply(double left, double right) {
        return fn.applyAsDouble(left, right);
    }

    public String symbol() {
        return symbol;
    }

    /** True for function-style operators printed as {@code op(a, b)}. */
    public boolean isPrefix() {
        return prefix;
    }
}
