package com.trading.ccv.risk;

import java.util.Locale;

/**
 * First- and second-order sensitivities reported by the aggregator.
 *
 * <p>
 * Units: delta per unit of underlying, gamma per unit squared, vega per one
 * volatility point, theta per calendar day, rho per one percent of rate.
 */
public enum Greek {
    DELTA,
    GAMMA,
    VEGA,
    THETA,
    RHO;

    /** Lower-case name used as the key of {@link Greeks#asMap()}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
