package com.trading.ccv.model;

/**
 * The worthless contract: no rights, no obligations.
 */
public record Zero() implements Contract {

    public static final Zero INSTANCE = new Zero();

    @Override
    public ContractKind kind() {
        return ContractKind.ZERO;
    }

    @Override
    public String toString() {
        return "Zero";
    }
}
