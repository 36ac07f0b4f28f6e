package com.trading.ccv.model;

/**
 * Comparison operators of {@link Condition}.
 */
public enum ComparisonOp {
    GT(">") {
        @Override
        public boolean test(double a, double b) {
            return a > b;
        }
    },
    LT("<") {
        @Override
        public boolean test(double a, double b) {
            return a < b;
        }
    },
    GE(">=") {
        @Override
        public boolean test(double a, double b) {
            return a >= b;
        }
    },
    LE("<=") {
        @Override
        public boolean test(double a, double b) {
            return a <= b;
        }
    },
    EQ("==") {
        @Override
        public boolean test(double a, double b) {
            return Math.abs(a - b) <= EQUALITY_TOLERANCE * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        }
    };

    /** Relative tolerance of {@link #EQ}; exact float equality is never meaningful for prices. */
    public static final double EQUALITY_TOLERANCE = 1e-12;

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    public abstract boolean test(double a, double b);

    public String symbol() {
        return symbol;
    }
}
