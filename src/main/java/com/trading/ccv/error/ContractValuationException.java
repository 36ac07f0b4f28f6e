package com.trading.ccv.error;

/**
 * Root of every error raised while building or valuing contracts.
 *
 * All subclasses are unchecked and are meant to reach the caller untouched.
 */
public class ContractValuationException extends RuntimeException {

    public ContractValuationException(String message) {
        super(message);
    }

    public ContractValuationException(String message, Throwable cause) {
        super(message, cause);
    }
}
