package com.trading.ccv.error;

/**
 * Thrown when an observable references an underlying the market model does
 * not quote.
 */
public class UnknownUnderlyingException extends ContractValuationException {

    private final String underlying;

    public UnknownUnderlyingException(String underlying) {
        super("No market data for underlying '" + underlying + "'");
        this.underlying = underlying;
    }

    protected UnknownUnderlyingException(String underlying, String message) {
        super(message);
        this.underlying = underlying;
    }

    public String getUnderlying() {
        return underlying;
    }
}
