package com.trading.ccv.model;

/**
 * Acquire {@code contract} as soon as {@code condition} first holds.
 */
public record When(Observable condition, Contract contract) implements Contract {

    public When {
        Invariants.requireCondition(condition, "When");
        Invariants.requireChild(contract, "When");
    }

    @Override
    public ContractKind kind() {
        return ContractKind.WHEN;
    }

    @Override
    public String toString() {
        return "When(" + condition + ", " + contract + ")";
    }
}
