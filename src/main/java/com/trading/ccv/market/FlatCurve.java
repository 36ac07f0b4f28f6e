package com.trading.ccv.market;

import com.trading.ccv.error.NumericDomainException;

/**
 * Single continuously-compounded rate for every maturity.
 */
public record FlatCurve(double rate) implements DiscountCurve {

    public FlatCurve {
        if (!Double.isFinite(rate)) {
            throw new NumericDomainException("Flat rate must be finite, got " + rate);
        }
    }

    @Override
    public double zeroRate(double days) {
        return rate;
    }

    @Override
    public DiscountCurve shifted(double shift) {
        return new FlatCurve(rate + shift);
    }
}
