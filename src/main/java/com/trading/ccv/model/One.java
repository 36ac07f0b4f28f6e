package com.trading.ccv.model;

import com.trading.ccv.error.MalformedContractException;

/**
 * Immediate receipt of one unit of a currency.
 */
public record One(Currency currency) implements Contract {

    public One {
        if (currency == null) {
            throw new MalformedContractException("One requires a currency");
        }
    }

    @Override
    public ContractKind kind() {
        return ContractKind.ONE;
    }

    @Override
    public String toString() {
        return "One(" + currency + ")";
    }
}
