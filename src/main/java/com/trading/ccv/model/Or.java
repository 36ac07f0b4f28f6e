package com.trading.ccv.model;

/**
 * Acquire whichever of the two contracts the holder prefers.
 */
public record Or(Contract left, Contract right) implements Contract {

    public Or {
        Invariants.requireChild(left, "Or");
        Invariants.requireChild(right, "Or");
    }

    @Override
    public ContractKind kind() {
        return ContractKind.OR;
    }

    @Override
    public String toString() {
        return "(" + left + " | " + right + ")";
    }
}
