package com.trading.ccv.model;

/**
 * A market-derived quantity: either a number ({@link Constant},
 * {@link Underlying}, {@link BinaryOp}) or a boolean ({@link Condition}).
 *
 * <p>
 * Observables are immutable expression trees. They are interpreted by
 * {@link com.trading.ccv.engine.ObservableEvaluator}, which dispatches on
 * {@link #kind()}.
 */
public sealed interface Observable permits Constant, Underlying, BinaryOp, Condition {

    ObservableKind kind();

    /** True when the observable evaluates to a boolean rather than a number. */
    default boolean isBoolean() {
        return kind() == ObservableKind.CONDITION;
    }
}
