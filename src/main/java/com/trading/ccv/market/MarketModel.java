package com.trading.ccv.market;

import com.trading.ccv.error.MarketModelIncompleteException;
import com.trading.ccv.error.NegativeTimeOffsetException;
import com.trading.ccv.error.NumericDomainException;
import com.trading.ccv.error.UnknownUnderlyingException;
import com.trading.ccv.model.Currency;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the market a contract is valued against.
 *
 * <p>
 * A snapshot holds, per underlying, spot, volatility and dividend yield, a
 * {@link DiscountCurve}, static FX rates into a base currency, and the date it
 * describes. It is passed explicitly through every valuation call; there is
 * no ambient market state.
 *
 * <p>
 * Every "bump" ({@link #withSpot}, {@link #withVolatility},
 * {@link #withRateShift}, {@link #withTimeShift}) and the forward roll
 * {@link #asOf(int)} return a new snapshot. The receiver is never altered, so
 * snapshots can be handed to concurrent workers without copying.
 *
 * <p>
 * The curve is anchored at the epoch; {@code originDay} records how far this
 * snapshot has moved from that anchor so that {@link #discountFactor(int)} is
 * always measured from the snapshot's own date.
 */
public final class MarketModel {
    /**
     * Date a snapshot carries when the builder is given none. Valuation reads
     * only day offsets, so the date labels snapshots but never moves prices.
     */
    public static final LocalDate DEFAULT_EVALUATION_DATE = LocalDate.EPOCH;

    private final LocalDate evaluationDate;
    private final Currency baseCurrency;
    private final Map<String, UnderlyingQuote> quotes;
    private final DiscountCurve curve;
    private final int originDay;
    private final Map<Currency, Double> fxRates;

    private MarketModel(LocalDate evaluationDate, Currency baseCurrency, Map<String, UnderlyingQuote> quotes,
            DiscountCurve curve, int originDay, Map<Currency, Double> fxRates) {
        this.evaluationDate = evaluationDate;
        this.baseCurrency = baseCurrency;
        this.quotes = quotes;
        this.curve = curve;
        this.originDay = originDay;
        this.fxRates = fxRates;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Accessors ────────────────────────────────────────────────

    public LocalDate evaluationDate() {
        return evaluationDate;
    }

    public Currency baseCurrency() {
        return baseCurrency;
    }

    public DiscountCurve curve() {
        return curve;
    }

    public Set<String> underlyings() {
        return quotes.keySet();
    }

    public boolean hasUnderlying(String name) {
        return quotes.containsKey(name);
    }

    public UnderlyingQuote quote(String name) {
        UnderlyingQuote q = quotes.get(name);
        if (q == null) {
            throw new UnknownUnderlyingException(name);
        }
        return q;
    }

    public double spot(String name) {
        return quote(name).spot();
    }

    public double volatility(String name) {
        return quote(name).volatility();
    }

    public double dividendYield(String name) {
        return quote(name).dividendYield();
    }

    public boolean hasFxRate(Currency currency) {
        return currency == baseCurrency || fxRates.containsKey(currency);
    }

    /**
     * Units of base currency per unit of {@code currency}.
     */
    public double fxRate(Currency currency) {
        if (currency == baseCurrency) {
            return 1.0;
        }
        Double rate = fxRates.get(currency);
        if (rate == null) {
            throw new MarketModelIncompleteException(List.of(), List.of(currency.name()));
        }
        return rate;
    }

    /**
     * Discount factor from this snapshot's date to {@code days} later.
     *
     * @throws NumericDomainException if the curve produces a non-finite or
     *                                non-positive factor.
     */
    public double discountFactor(int days) {
        double df = curve.discountFactor(originDay + days) / curve.discountFactor(originDay);
        if (!Double.isFinite(df) || df <= 0.0) {
            throw new NumericDomainException(String.format("Degenerate discount factor %s for %d days", df, days));
        }
        return df;
    }

    /**
     * Continuously-compounded zero rate from this snapshot's date to
     * {@code days} later, implied by {@link #discountFactor(int)}.
     */
    public double zeroRate(int days) {
        if (days == 0) {
            return curve.zeroRate(originDay);
        }
        return -Math.log(discountFactor(days)) * DiscountCurve.DAYS_PER_YEAR / days;
    }

    /**
     * Risk-neutral forward of an underlying {@code days} after this snapshot.
     */
    public double forward(String name, int days) {
        UnderlyingQuote q = quote(name);
        return q.spot() * Math.exp(-q.dividendYield() * days / DiscountCurve.DAYS_PER_YEAR) / discountFactor(days);
    }

    // ── Derived snapshots ────────────────────────────────────────

    /**
     * The market as seen {@code days} from now under the risk-neutral measure:
     * every spot is replaced by its forward, the curve origin and evaluation
     * date move forward. Volatilities and FX rates are unchanged.
     */
    public MarketModel asOf(int days) {
        if (days < 0) {
            throw new NegativeTimeOffsetException("asOf offset", days);
        }
        if (days == 0) {
            return this;
        }
        Map<String, UnderlyingQuote> rolled = new LinkedHashMap<>(quotes.size() * 2);
        for (UnderlyingQuote q : quotes.values()) {
            rolled.put(q.name(), q.withSpot(forward(q.name(), days)));
        }
        return new MarketModel(evaluationDate.plusDays(days), baseCurrency,
                Collections.unmodifiableMap(rolled), curve, originDay + days, fxRates);
    }

    /**
     * The same spots observed {@code days} later (or earlier, if negative).
     * Used for theta: time passes, nothing else moves.
     */
    public MarketModel withTimeShift(int days) {
        if (days == 0) {
            return this;
        }
        return new MarketModel(evaluationDate.plusDays(days), baseCurrency, quotes, curve, originDay + days, fxRates);
    }

    public MarketModel withSpot(String name, double spot) {
        return withQuote(quote(name).withSpot(spot));
    }

    public MarketModel withVolatility(String name, double volatility) {
        return withQuote(quote(name).withVolatility(volatility));
    }

    /**
     * Parallel shift of every zero rate.
     */
    public MarketModel withRateShift(double shift) {
        return new MarketModel(evaluationDate, baseCurrency, quotes, curve.shifted(shift), originDay, fxRates);
    }

    private MarketModel withQuote(UnderlyingQuote q) {
        Map<String, UnderlyingQuote> copy = new LinkedHashMap<>(quotes);
        copy.put(q.name(), q);
        return new MarketModel(evaluationDate, baseCurrency, Collections.unmodifiableMap(copy), curve, originDay,
                fxRates);
    }

    @Override
    public String toString() {
        return "MarketModel{date=" + evaluationDate + ", base=" + baseCurrency + ", underlyings=" + quotes.values()
                + ", curve=" + curve + ", fx=" + fxRates + "}";
    }

    /**
     * Fluent builder. Validation happens per entry (see
     * {@link UnderlyingQuote}) and on {@link #build()}.
     */
    public static final class Builder {
        private LocalDate evaluationDate = DEFAULT_EVALUATION_DATE;
        private Currency baseCurrency = Currency.USD;
        private final Map<String, UnderlyingQuote> quotes = new LinkedHashMap<>();
        private DiscountCurve curve;
        private final Map<Currency, Double> fxRates = new EnumMap<>(Currency.class);

        private Builder() {
        }

        public Builder evaluationDate(LocalDate date) {
            this.evaluationDate = Objects.requireNonNull(date, "evaluationDate");
            return this;
        }

        public Builder baseCurrency(Currency currency) {
            this.baseCurrency = Objects.requireNonNull(currency, "baseCurrency");
            return this;
        }

        public Builder flatRate(double rate) {
            this.curve = new FlatCurve(rate);
            return this;
        }

        public Builder curve(DiscountCurve curve) {
            this.curve = Objects.requireNonNull(curve, "curve");
            return this;
        }

        public Builder underlying(String name, double spot, double volatility) {
            return underlying(name, spot, volatility, 0.0);
        }

        public Builder underlying(String name, double spot, double volatility, double dividendYield) {
            quotes.put(name, new UnderlyingQuote(name, spot, volatility, dividendYield));
            return this;
        }

        public Builder fxRate(Currency currency, double rate) {
            if (!Double.isFinite(rate) || rate <= 0.0) {
                throw new NumericDomainException("FX rate for " + currency + " must be > 0, got " + rate);
            }
            fxRates.put(Objects.requireNonNull(currency, "currency"), rate);
            return this;
        }

        public MarketModel build() {
            if (curve == null) {
                throw new IllegalStateException("A flat rate or discount curve is required");
            }
            Map<Currency, Double> fx = new EnumMap<>(Currency.class);
            fx.putAll(fxRates);
            fx.remove(baseCurrency);
            return new MarketModel(evaluationDate, baseCurrency,
                    Collections.unmodifiableMap(new LinkedHashMap<>(quotes)), curve, 0,
                    Collections.unmodifiableMap(fx));
        }
    }
}
