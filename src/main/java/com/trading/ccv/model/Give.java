package com.trading.ccv.model;

/**
 * Swaps rights and obligations of the wrapped contract.
 */
public record Give(Contract contract) implements Contract {

    public Give {
        Invariants.requireChild(contract, "Give");
    }

    @Override
    public ContractKind kind() {
        return ContractKind.GIVE;
    }

    @Override
    public String toString() {
        return "Give(" + contract + ")";
    }
}
