package com.trading.ccv.risk;

/**
 * Fixed finite-difference steps and the scalings that bring each result into
 * the units of {@link Greek}.
 */
public final class BumpSizes {
    private BumpSizes() {
        // Utility class
    }

    /** Spot bump as a fraction of spot; used as an absolute step when spot is zero. */
    public static final double SPOT_RELATIVE = 1e-4;

    /** Absolute volatility bump. */
    public static final double VOLATILITY = 1e-4;

    /** Parallel zero-rate shift. */
    public static final double RATE = 1e-4;

    /** Calendar days moved each way for theta. */
    public static final int THETA_DAYS = 1;

    /** Vega is reported per volatility point. */
    public static final double VEGA_UNIT = 0.01;

    /** Rho is reported per percent of rate. */
    public static final double RHO_UNIT = 0.01;

    public static double spotStep(double spot) {
        return spot > 0.0 ? SPOT_RELATIVE * spot : SPOT_RELATIVE;
    }
}
