package com.trading.ccv.engine;

import com.trading.ccv.error.MalformedContractException;
import com.trading.ccv.error.NumericDomainException;
import com.trading.ccv.model.ArithmeticOp;
import com.trading.ccv.model.BinaryOp;
import com.trading.ccv.model.Condition;
import com.trading.ccv.model.Constant;
import com.trading.ccv.model.Observable;
import com.trading.ccv.model.ObservableKind;
import com.trading.ccv.model.Underlying;
import com.trading.ccv.market.MarketModel;

/**
 * Interpreter of the observable sub-language.
 *
 * <p>
 * The snapshot handed in is the market as of the evaluation day, so an
 * {@link Underlying} read on a snapshot rolled forward by
 * {@link MarketModel#asOf(int)} yields the risk-neutral forward. Evaluation
 * is pure.
 */
public final class ObservableEvaluator {
    private ObservableEvaluator() {
        // Utility class
    }

    /**
     * Numeric value of {@code observable} under {@code model}.
     *
     * @throws MalformedContractException if {@code observable} is a condition.
     * @throws NumericDomainException     on division by zero.
     * @throws com.trading.ccv.error.UnknownUnderlyingException if an
     *                                                          underlying is
     *                                                          missing.
     */
    public static double evaluate(Observable observable, MarketModel model) {
        return switch (observable.kind()) {
            case CONSTANT -> ((Constant) observable).value();
            case UNDERLYING -> model.spot(((Underlying) observable).name());
            case BINARY_OP -> {
                BinaryOp b = (BinaryOp) observable;
                double left = evaluate(b.left(), model);
                double right = evaluate(b.right(), model);
                if (b.op() == ArithmeticOp.DIV && right == 0.0) {
                    throw new NumericDomainException("Division by zero in " + b);
                }
                yield b.op().apply(left, right);
            }
            case CONDITION -> throw new MalformedContractException("Condition used where a number is expected: "
                    + observable);
        };
    }

    /**
     * Truth value of a condition under {@code model}.
     *
     * @throws MalformedContractException if {@code condition} is numeric.
     */
    public static boolean test(Observable condition, MarketModel model) {
        if (condition.kind() != ObservableKind.CONDITION) {
            throw new MalformedContractException("Number used where a condition is expected: " + condition);
        }
        Condition c = (Condition) condition;
        return c.op().test(evaluate(c.left(), model), evaluate(c.right(), model));
    }

    /**
     * Value of an observable that references no underlying.
     *
     * @throws IllegalArgumentException if an underlying is reached.
     */
    public static double evaluateFixed(Observable observable) {
        if (!isMarketIndependent(observable)) {
            throw new IllegalArgumentException("Observable depends on the market: " + observable);
        }
        return evaluate(observable, null);
    }

    /** True when no {@link Underlying} occurs anywhere in the expression. */
    public static boolean isMarketIndependent(Observable observable) {
        return switch (observable.kind()) {
            case CONSTANT -> true;
            case UNDERLYING -> false;
            case BINARY_OP -> isMarketIndependent(((BinaryOp) observable).left())
                    && isMarketIndependent(((BinaryOp) observable).right());
            case CONDITION -> isMarketIndependent(((Condition) observable).left())
                    && isMarketIndependent(((Condition) observable).right());
        };
    }

    /**
     * True when the expression is affine in the underlyings. For such an
     * expression the value on a forward snapshot equals the risk-neutral
     * expectation, so evaluating it on a rolled market is exact; anything else
     * is a certainty-equivalent approximation.
     */
    public static boolean isAffine(Observable observable) {
        return switch (observable.kind()) {
            case CONSTANT, UNDERLYING -> true;
            case BINARY_OP -> {
                BinaryOp b = (BinaryOp) observable;
                yield switch (b.op()) {
                    case ADD, SUB, AVG -> isAffine(b.left()) && isAffine(b.right());
                    case MUL -> (isMarketIndependent(b.left()) && isAffine(b.right()))
                            || (isMarketIndependent(b.right()) && isAffine(b.left()));
                    case DIV -> isMarketIndependent(b.right()) && isAffine(b.left());
                    case MAX, MIN -> isMarketIndependent(b);
                };
            }
            case CONDITION -> isMarketIndependent(observable);
        };
    }
}
