package com.trading.ccv.error;

/**
 * Volatility must be strictly positive and finite.
 */
public class NonPositiveVolatilityException extends NumericDomainException {

    private final String underlying;
    private final double volatility;

    public NonPositiveVolatilityException(String underlying, double volatility) {
        super(String.format("Volatility for '%s' must be > 0, got %s", underlying, volatility));
        this.underlying = underlying;
        this.volatility = volatility;
    }

    public String getUnderlying() {
        return underlying;
    }

    public double getVolatility() {
        return volatility;
    }
}
