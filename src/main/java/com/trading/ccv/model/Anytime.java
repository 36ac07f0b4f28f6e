package com.trading.ccv.model;

/**
 * The holder may acquire {@code contract} at any time {@code condition} holds,
 * or never.
 */
public record Anytime(Observable condition, Contract contract) implements Contract {

    public Anytime {
        Invariants.requireCondition(condition, "Anytime");
        Invariants.requireChild(contract, "Anytime");
    }

    @Override
    public ContractKind kind() {
        return ContractKind.ANYTIME;
    }

    @Override
    public String toString() {
        return "Anytime(" + condition + ", " + contract + ")";
    }
}
