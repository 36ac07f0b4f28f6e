package com.trading.ccv.risk;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.ccv.engine.ContractInspector;
import com.trading.ccv.engine.ObservableEvaluator;
import com.trading.ccv.engine.PayoffRecognizer;
import com.trading.ccv.engine.PayoffRecognizer.EuropeanLeaf;
import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.error.UnknownUnderlyingException;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.And;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.Give;
import com.trading.ccv.model.Scale;
import com.trading.ccv.model.Then;

import lombok.extern.log4j.Log4j2;

/**
 * Computes Greeks by walking the contract the way the engine values it.
 *
 * <p>
 * Linear combinators compose analytically: {@code Zero} and {@code One} have
 * no sensitivity, {@code Give} negates, {@code And} sums, {@code Scale} by a
 * market-independent factor multiplies. A recognised European leaf takes the
 * pricer's analytic Greeks. Every other node is handed whole to
 * {@link BumpAndReprice}. {@code Then} over anything but a leaf is bumped too,
 * so that the rate sensitivity of its discount factor is kept.
 *
 * <p>
 * With {@code parallelism > 1} bump scenarios run on a pool of daemon
 * threads; {@link #close()} releases it.
 */
@Log4j2
public final class GreeksAggregator implements AutoCloseable {
    private final ValuationEngine engine;
    private final ExecutorService executor;
    private final BumpAndReprice bumps;

    public GreeksAggregator(ValuationEngine engine) {
        this.engine = engine;
        int parallelism = engine.config().getParallelism();
        this.executor = parallelism > 1
                ? Executors.newFixedThreadPool(parallelism, DaemonThreadFactory.INSTANCE)
                : null;
        this.bumps = new BumpAndReprice(engine, executor);
        if (executor != null) {
            log.info("Bump scenarios run on {} threads", parallelism);
        }
    }

    /**
     * Net Greeks: delta, gamma and vega summed over every referenced
     * underlying.
     */
    public Greeks greeks(Contract contract, MarketModel model, int time) {
        engine.inspect(contract, model);
        return walk(contract, model, time, null);
    }

    /**
     * Delta, gamma and vega with respect to {@code underlying} alone; theta
     * and rho of the whole contract.
     *
     * @throws UnknownUnderlyingException if the snapshot lacks
     *                                    {@code underlying}.
     */
    public Greeks greeks(Contract contract, MarketModel model, int time, String underlying) {
        if (!model.hasUnderlying(underlying)) {
            throw new UnknownUnderlyingException(underlying);
        }
        engine.inspect(contract, model);
        return walk(contract, model, time, underlying);
    }

    private Greeks walk(Contract c, MarketModel model, int time, String only) {
        return switch (c.kind()) {
            case ZERO, ONE -> Greeks.ZERO;
            case GIVE -> walk(((Give) c).contract(), model, time, only).negate();
            case AND -> walk(((And) c).left(), model, time, only).plus(walk(((And) c).right(), model, time, only));
            case SCALE -> {
                Scale s = (Scale) c;
                if (ObservableEvaluator.isMarketIndependent(s.observable())) {
                    double k = ObservableEvaluator.evaluateFixed(s.observable());
                    yield walk(s.contract(), model, time, only).scale(k);
                }
                yield bump(c, model, time, only);
            }
            case THEN -> {
                Optional<EuropeanLeaf> leaf = PayoffRecognizer.match(c);
                if (leaf.isPresent() && ((Then) c).day() > time) {
                    Greeks g = engine.priceLeaf(leaf.get(), model, time).greeks();
                    yield only == null || only.equals(leaf.get().underlying()) ? g : g.timeAndRateOnly();
                }
                yield bump(c, model, time, only);
            }
            case OR, WHEN, TRUNCATE, ANYTIME -> bump(c, model, time, only);
        };
    }

    private Greeks bump(Contract c, MarketModel model, int time, String only) {
        ContractInspector.Report report = engine.inspect(c, model);
        Set<String> referenced = report.underlyings();
        List<String> targets;
        if (only == null) {
            targets = List.copyOf(referenced);
        } else {
            targets = referenced.contains(only) ? List.of(only) : List.of();
        }
        if (log.isTraceEnabled()) {
            log.trace("Bumping {} over {}", c.kind(), targets);
        }
        return bumps.greeks(c, model, time, targets);
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
        }
    }
}
