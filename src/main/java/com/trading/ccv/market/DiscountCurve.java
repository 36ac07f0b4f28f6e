package com.trading.ccv.market;

/**
 * Risk-free discounting, anchored at the day the curve was built.
 *
 * <p>
 * Day offsets are calendar days under an Actual/365 fixed convention.
 * Implementations are immutable.
 */
public interface DiscountCurve {

    /** Days per year used to convert day offsets into year fractions. */
    double DAYS_PER_YEAR = 365.0;

    /**
     * Returns the continuously-compounded zero rate for the given day offset.
     */
    double zeroRate(double days);

    /**
     * Discount factor from the anchor to {@code days}. Negative offsets are
     * allowed and yield factors above one.
     */
    default double discountFactor(double days) {
        return Math.exp(-zeroRate(days) * days / DAYS_PER_YEAR);
    }

    /**
     * Returns a new curve with every zero rate moved by {@code shift}.
     */
    DiscountCurve shifted(double shift);
}
