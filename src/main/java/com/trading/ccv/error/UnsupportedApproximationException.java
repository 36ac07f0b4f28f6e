package com.trading.ccv.error;

/**
 * Strict-mode signal: the engine would have to fall back to one of its
 * simplified approximations (European-style When/Anytime/Truncate, or a
 * certainty-equivalent non-linear observable) to produce this value.
 */
public class UnsupportedApproximationException extends ContractValuationException {

    private final String construct;

    public UnsupportedApproximationException(String construct, String detail) {
        super(String.format("%s is only valued approximately (%s); strict mode forbids it", construct, detail));
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
