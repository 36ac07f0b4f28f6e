package com.trading.ccv.pricing;

import com.trading.ccv.risk.Greeks;

import java.util.Objects;

/**
 * Discounted price of one option together with its analytic Greeks.
 */
public record PricingResult(double price, Greeks greeks) {

    public PricingResult {
        Objects.requireNonNull(greeks, "greeks");
    }

    public PricingResult scale(double factor) {
        return new PricingResult(price * factor, greeks.scale(factor));
    }
}
