package com.trading.ccv.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.market.ZeroCurve;
import com.trading.ccv.model.Currency;

import lombok.extern.log4j.Log4j2;

/**
 * Builds a {@link MarketModel} from a JSON document (see
 * {@link MarketDefinition} for the layout).
 *
 * <p>
 * Malformed JSON or a structurally wrong document raises
 * {@link IllegalArgumentException}. Values that parse but are out of range
 * (negative spot, non-positive volatility) raise the same domain exceptions
 * as the builder.
 */
@Log4j2
public final class MarketModelReader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private MarketModelReader() {
        // Utility class
    }

    public static MarketModel read(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read market snapshot " + path, e);
        }
    }

    public static MarketModel parse(String json) {
        MarketDefinition def;
        try {
            def = MAPPER.readValue(json, MarketDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed market snapshot: " + e.getOriginalMessage(), e);
        }
        return toModel(def);
    }

    public static MarketModel toModel(MarketDefinition def) {
        if (def.getEvaluationDate() == null) {
            throw new IllegalArgumentException("Market snapshot needs an evaluationDate");
        }
        boolean hasCurve = def.getZeroCurve() != null && !def.getZeroCurve().isEmpty();
        if ((def.getRate() == null) == !hasCurve) {
            throw new IllegalArgumentException("Market snapshot needs exactly one of 'rate' or 'zeroCurve'");
        }

        MarketModel.Builder b = MarketModel.builder()
                .evaluationDate(def.getEvaluationDate())
                .baseCurrency(def.getBaseCurrency() != null ? def.getBaseCurrency() : Currency.USD);
        if (hasCurve) {
            b.curve(ZeroCurve.of(def.getZeroCurve()));
        } else {
            b.flatRate(def.getRate());
        }
        if (def.getUnderlyings() != null) {
            for (Map.Entry<String, MarketDefinition.QuoteDef> e : def.getUnderlyings().entrySet()) {
                MarketDefinition.QuoteDef q = e.getValue();
                if (q == null) {
                    throw new IllegalArgumentException("Underlying '" + e.getKey() + "' has no quote");
                }
                b.underlying(e.getKey(),
                        q.getSpot() != null ? q.getSpot() : Double.NaN,
                        q.getVolatility() != null ? q.getVolatility() : 0.0,
                        q.getDividendYield());
            }
        }
        if (def.getFxRates() != null) {
            def.getFxRates().forEach(b::fxRate);
        }
        MarketModel model = b.build();
        log.info("Loaded market snapshot {}: {} underlyings, {} FX rates", model.evaluationDate(),
                model.underlyings().size(), def.getFxRates() != null ? def.getFxRates().size() : 0);
        return model;
    }
}
