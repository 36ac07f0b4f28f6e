package com.trading.ccv.error;

import java.util.List;

/**
 * Raised by the pre-valuation pass when a contract references market data
 * (underlyings or FX rates) that the supplied snapshot does not contain.
 * Lists every missing entry, not just the first one.
 */
public class MarketModelIncompleteException extends UnknownUnderlyingException {

    private final List<String> missingUnderlyings;
    private final List<String> missingCurrencies;

    public MarketModelIncompleteException(List<String> missingUnderlyings, List<String> missingCurrencies) {
        super(missingUnderlyings.isEmpty() ? null : missingUnderlyings.get(0),
                String.format("Market model is incomplete: missing underlyings %s, missing FX rates %s",
                        missingUnderlyings, missingCurrencies));
        this.missingUnderlyings = List.copyOf(missingUnderlyings);
        this.missingCurrencies = List.copyOf(missingCurrencies);
    }

    public List<String> getMissingUnderlyings() {
        return missingUnderlyings;
    }

    public List<String> getMissingCurrencies() {
        return missingCurrencies;
    }
}
