package com.trading.ccv.model;

/**
 * Acquire both contracts.
 */
public record And(Contract left, Contract right) implements Contract {

    public And {
        Invariants.requireChild(left, "And");
        Invariants.requireChild(right, "And");
    }

    @Override
    public ContractKind kind() {
        return ContractKind.AND;
    }

    @Override
    public String toString() {
        return "(" + left + " & " + right + ")";
    }
}
