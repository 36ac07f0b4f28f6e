package com.trading.ccv.model;

import com.trading.ccv.error.MalformedContractException;

/**
 * Multiply every payment of {@code contract} by the value of a numeric
 * observable at acquisition.
 */
public record Scale(Observable observable, Contract contract) implements Contract {

    public Scale {
        if (observable == null) {
            throw new MalformedContractException("Scale requires an observable");
        }
        if (observable.isBoolean()) {
            throw new MalformedContractException("Scale requires a numeric observable, got " + observable);
        }
        Invariants.requireChild(contract, "Scale");
    }

    @Override
    public ContractKind kind() {
        return ContractKind.SCALE;
    }

    @Override
    public String toString() {
        return "Scale(" + observable + ", " + contract + ")";
    }
}
