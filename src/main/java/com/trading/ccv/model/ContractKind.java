package com.trading.ccv.model;

/**
 * Tag of the closed {@link Contract} variant, one constant per primitive
 * combinator.
 */
public enum ContractKind {
    ZERO,
    ONE,
    GIVE,
    AND,
    OR,
    THEN,
    SCALE,
    WHEN,
    TRUNCATE,
    ANYTIME
}
