package com.trading.ccv.model;

/**
 * Restrict acquisition and exercise decisions inside {@code contract} to no
 * later than day {@code day}. Worthless once that day has passed.
 */
public record Truncate(int day, Contract contract) implements Contract {

    public Truncate {
        Invariants.requireDay(day, "Truncate bound");
        Invariants.requireChild(contract, "Truncate");
    }

    @Override
    public ContractKind kind() {
        return ContractKind.TRUNCATE;
    }

    @Override
    public String toString() {
        return "Truncate(" + day + ", " + contract + ")";
    }
}
