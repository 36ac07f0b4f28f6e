package com.trading.ccv.market;

import com.trading.ccv.error.NonPositiveVolatilityException;
import com.trading.ccv.error.NumericDomainException;

/**
 * Market state of one underlying: spot, Black-Scholes volatility and a
 * continuous dividend yield. Validated on construction.
 */
public record UnderlyingQuote(String name, double spot, double volatility, double dividendYield) {

    public UnderlyingQuote {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Underlying name must not be blank");
        }
        if (!Double.isFinite(spot) || spot < 0.0) {
            throw new NumericDomainException(String.format("Spot for '%s' must be finite and >= 0, got %s", name, spot));
        }
        if (!Double.isFinite(volatility) || volatility <= 0.0) {
            throw new NonPositiveVolatilityException(name, volatility);
        }
        if (!Double.isFinite(dividendYield)) {
            throw new NumericDomainException(String.format("Dividend yield for '%s' must be finite, got %s", name, dividendYield));
        }
    }

    public UnderlyingQuote withSpot(double newSpot) {
        return new UnderlyingQuote(name, newSpot, volatility, dividendYield);
    }

    public UnderlyingQuote withVolatility(double newVolatility) {
        return new UnderlyingQuote(name, spot, newVolatility, dividendYield);
    }
}
