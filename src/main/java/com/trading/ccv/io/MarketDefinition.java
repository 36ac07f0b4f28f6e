package com.trading.ccv.io;

import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.trading.ccv.model.Currency;

import lombok.Data;

/**
 * POJO representation of a market snapshot document.
 *
 * <pre>
 * {
 *   "evaluationDate": "2024-01-02",
 *   "baseCurrency": "USD",
 *   "rate": 0.05,                        or  "zeroCurve": { "30": 0.049, "365": 0.05 }
 *   "underlyings": { "SPX": { "spot": 4700, "volatility": 0.18, "dividendYield": 0.015 } },
 *   "fxRates": { "EUR": 1.09 }
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class MarketDefinition {
    private LocalDate evaluationDate;
    private Currency baseCurrency = Currency.USD;
    private Double rate;
    private Map<Integer, Double> zeroCurve;
    private Map<String, QuoteDef> underlyings;
    private Map<Currency, Double> fxRates;

    /** Market state of one underlying. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class QuoteDef {
        private Double spot;
        private Double volatility;
        private double dividendYield;
    }
}
