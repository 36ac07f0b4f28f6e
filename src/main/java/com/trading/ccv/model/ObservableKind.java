package com.trading.ccv.model;

/**
 * Tag of the closed {@link Observable} variant. Interpreters switch on it
 * without a {@code default} branch so that a new form fails to compile until
 * every consumer handles it.
 */
public enum ObservableKind {
    CONSTANT,
    UNDERLYING,
    BINARY_OP,
    CONDITION
}
