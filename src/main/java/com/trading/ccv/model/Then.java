package com.trading.ccv.model;

/**
 * Acquire {@code contract} on day {@code day}, counted from the evaluation
 * epoch. If that day has already passed the contract is acquired at once.
 */
public record Then(int day, Contract contract) implements Contract {

    public Then {
        Invariants.requireDay(day, "Then offset");
        Invariants.requireChild(contract, "Then");
    }

    @Override
    public ContractKind kind() {
        return ContractKind.THEN;
    }

    @Override
    public String toString() {
        return "Then(" + day + ", " + contract + ")";
    }
}
