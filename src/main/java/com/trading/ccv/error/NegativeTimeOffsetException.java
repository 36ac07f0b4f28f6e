package com.trading.ccv.error;

/**
 * Thrown when a time offset, time bound or evaluation time is negative.
 */
public class NegativeTimeOffsetException extends MalformedContractException {

    private final int offset;

    public NegativeTimeOffsetException(String what, int offset) {
        super(String.format("%s must be a non-negative day offset, got %d", what, offset));
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
