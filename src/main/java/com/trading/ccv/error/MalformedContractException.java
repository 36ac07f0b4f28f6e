package com.trading.ccv.error;

/**
 * Thrown when a contract or observable violates a structural invariant:
 * a null child, a boolean observable used as a number (or the reverse), or a
 * tree that exceeds the configured depth or size bound.
 */
public class MalformedContractException extends ContractValuationException {

    public MalformedContractException(String message) {
        super(message);
    }
}
