package com.trading.ccv.dsl;

import com.trading.ccv.model.ArithmeticOp;
import com.trading.ccv.model.BinaryOp;
import com.trading.ccv.model.ComparisonOp;
import com.trading.ccv.model.Condition;
import com.trading.ccv.model.Constant;
import com.trading.ccv.model.Observable;
import com.trading.ccv.model.Underlying;

/**
 * Static builders for observables.
 *
 * <pre>
 * import static com.trading.ccv.dsl.Observables.*;
 *
 * Observable payoff = max(constant(0), sub(underlying("SPX"), constant(4500)));
 * Observable knocked = gt(underlying("SPX"), constant(5000));
 * </pre>
 */
public final class Observables {
    private Observables() {
        // Utility class
    }

    public static Constant constant(double value) {
        return new Constant(value);
    }

    public static Underlying underlying(String name) {
        return new Underlying(name);
    }

    public static BinaryOp add(Observable a, Observable b) {
        return new BinaryOp(ArithmeticOp.ADD, a, b);
    }

    public static BinaryOp sub(Observable a, Observable b) {
        return new BinaryOp(ArithmeticOp.SUB, a, b);
    }

    public static BinaryOp mul(Observable a, Observable b) {
        return new BinaryOp(ArithmeticOp.MUL, a, b);
    }

    public static BinaryOp div(Observable a, Observable b) {
        return new BinaryOp(ArithmeticOp.DIV, a, b);
    }

    public static BinaryOp max(Observable a, Observable b) {
        return new BinaryOp(ArithmeticOp.MAX, a, b);
    }

    public static BinaryOp min(Observable a, Observable b) {
        return new BinaryOp(ArithmeticOp.MIN, a, b);
    }

    public static BinaryOp avg(Observable a, Observable b) {
        return new BinaryOp(ArithmeticOp.AVG, a, b);
    }

    public static Condition gt(Observable a, Observable b) {
        return new Condition(ComparisonOp.GT, a, b);
    }

    public static Condition lt(Observable a, Observable b) {
        return new Condition(ComparisonOp.LT, a, b);
    }

    public static Condition ge(Observable a, Observable b) {
        return new Condition(ComparisonOp.GE, a, b);
    }

    public static Condition le(Observable a, Observable b) {
        return new Condition(ComparisonOp.LE, a, b);
    }

    public static Condition eq(Observable a, Observable b) {
        return new Condition(ComparisonOp.EQ, a, b);
    }

    /** {@code max(0, spot - strike)}. */
    public static BinaryOp callPayoff(Observable spot, double strike) {
        return max(constant(0.0), sub(spot, constant(strike)));
    }

    /** {@code max(0, strike - spot)}. */
    public static BinaryOp putPayoff(Observable spot, double strike) {
        return max(constant(0.0), sub(constant(strike), spot));
    }
}
