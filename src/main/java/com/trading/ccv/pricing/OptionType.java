package com.trading.ccv.pricing;

/**
 * Exercise direction of a vanilla European option.
 */
public enum OptionType {
    CALL,
    PUT
}
