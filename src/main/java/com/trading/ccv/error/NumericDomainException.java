package com.trading.ccv.error;

/**
 * Thrown instead of returning NaN or infinity when an input lies outside the
 * domain of a numeric routine (non-positive maturity, negative spot, division
 * by zero, degenerate discount factor).
 */
public class NumericDomainException extends ContractValuationException {

    public NumericDomainException(String message) {
        super(message);
    }
}
