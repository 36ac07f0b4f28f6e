package com.trading.ccv.wiring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.lmax.disruptor.EventHandler;
import com.trading.ccv.api.ValuationListener;
import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.Value;
import com.trading.ccv.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that folds market updates into a snapshot and
 * reprices a {@link Portfolio}.
 *
 * <p>
 * Runs on the single consumer thread of the ring buffer. Each
 * {@link MarketEvent} replaces the pending snapshot with a bumped copy; the
 * snapshots themselves are immutable.
 *
 * <p>
 * Batching: while the Disruptor reports {@code endOfBatch == false} more
 * updates are already waiting, so only the snapshot is updated. The portfolio
 * is repriced once when the batch ends (or an event asks for it), so a burst
 * of ticks costs one revaluation.
 *
 * <p>
 * Failures never escape {@link #onEvent}: a bad update is dropped and logged,
 * a contract that cannot be valued is reported to the listener and skipped.
 * Logging is throttled through {@link ErrorRateLimiter}.
 */
public final class RevaluationPublisher implements EventHandler<MarketEvent> {
    private static final Logger log = LogManager.getLogger(RevaluationPublisher.class);

    private final ValuationEngine engine;
    private final Portfolio portfolio;
    private final int valuationDay;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    private MarketModel market;
    private ValuationListener listener;
    private long epoch;

    // Published for readers on other threads
    private volatile Map<String, Value> latest = Collections.emptyMap();
    private volatile MarketModel lastValuedMarket;

    public RevaluationPublisher(ValuationEngine engine, Portfolio portfolio, MarketModel initial) {
        this(engine, portfolio, initial, 0);
    }

    public RevaluationPublisher(ValuationEngine engine, Portfolio portfolio, MarketModel initial, int valuationDay) {
        this.engine = engine;
        this.portfolio = portfolio;
        this.market = initial;
        this.valuationDay = valuationDay;
    }

    public void setListener(ValuationListener listener) {
        this.listener = listener;
    }

    @Override
    public void onEvent(MarketEvent event, long sequence, boolean endOfBatch) {
        try {
            market = apply(market, event);
        } catch (RuntimeException e) {
            errLimiter.log(String.format("Dropped %s: %s", event, e.getMessage()), e);
            // Keep the consumer alive and the last good snapshot; the batch end still reprices
        }
        if (event.isBatchEnd() || endOfBatch) {
            revalue();
        }
    }

    /**
     * Reprices every position on the current snapshot. Called by
     * {@link #onEvent} at batch end; callable directly for an initial pass.
     *
     * @return number of positions valued.
     */
    public int revalue() {
        epoch++;
        final ValuationListener l = listener;
        if (l != null) {
            l.onRevaluationStart(epoch);
        }
        Map<String, Value> values = new LinkedHashMap<>();
        for (Map.Entry<String, Contract> e : portfolio.positions().entrySet()) {
            long start = System.nanoTime();
            try {
                Value v = engine.value(e.getValue(), market, valuationDay);
                values.put(e.getKey(), v);
                if (l != null) {
                    l.onContractValued(epoch, e.getKey(), v, System.nanoTime() - start);
                }
            } catch (RuntimeException ex) {
                errLimiter.log(String.format("Revaluation of '%s' failed at epoch %d: %s", e.getKey(), epoch,
                        ex.getMessage()), ex);
                if (l != null) {
                    l.onContractError(epoch, e.getKey(), ex);
                }
            }
        }
        latest = Collections.unmodifiableMap(values);
        lastValuedMarket = market;
        if (l != null) {
            l.onRevaluationEnd(epoch, values.size());
        }
        return values.size();
    }

    /** Values of the last completed pass, keyed by position name. */
    public Map<String, Value> latest() {
        return latest;
    }

    /** Snapshot the last completed pass was valued on. */
    public MarketModel lastValuedMarket() {
        return lastValuedMarket;
    }

    public long epoch() {
        return epoch;
    }

    private static MarketModel apply(MarketModel m, MarketEvent event) {
        if (event.type() == null) {
            throw new IllegalArgumentException("Event carries no update");
        }
        return switch (event.type()) {
            case SPOT -> m.withSpot(event.underlying(), event.value());
            case VOLATILITY -> m.withVolatility(event.underlying(), event.value());
            case RATE_SHIFT -> m.withRateShift(event.value());
        };
    }
}
