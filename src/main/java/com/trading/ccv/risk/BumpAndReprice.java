package com.trading.ccv.risk;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.DoubleSupplier;

import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.market.UnderlyingQuote;
import com.trading.ccv.model.Contract;

/**
 * Finite-difference Greeks of a contract, each scenario a full revaluation on
 * a bumped snapshot.
 *
 * <pre>
 *   delta  (V(S+h) - V(S-h)) / 2h                 h = 1e-4 * S
 *   gamma  (V(S+h) - 2 V(S) + V(S-h)) / h^2
 *   vega   (V(vol+h) - V(vol-h)) / 2h * 0.01      h = 1e-4
 *   rho    (V(r+h) - V(r-h)) / 2h * 0.01          h = 1e-4, parallel
 *   theta  (V(t+1d) - V(t-1d)) / 2
 * </pre>
 *
 * Where the lower bump would leave the domain (zero spot, volatility not above
 * its step) a one-sided difference replaces the centred one.
 *
 * <p>
 * Scenarios are independent. Given an executor they run concurrently; a
 * failure in any of them is rethrown unwrapped on the caller.
 */
public final class BumpAndReprice {
    private final ValuationEngine engine;
    private final ExecutorService executor;

    /**
     * @param executor runs scenarios; {@code null} runs them on the caller.
     */
    public BumpAndReprice(ValuationEngine engine, ExecutorService executor) {
        this.engine = engine;
        this.executor = executor;
    }

    /**
     * Delta, gamma and vega summed over {@code underlyings}; theta and rho of
     * the whole contract.
     */
    public Greeks greeks(Contract contract, MarketModel model, int time, Collection<String> underlyings) {
        List<DoubleSupplier> scenarios = new ArrayList<>();
        scenarios.add(() -> engine.revalue(contract, model, time));
        scenarios.add(() -> engine.valueAfter(contract, model, time, BumpSizes.THETA_DAYS));
        scenarios.add(() -> engine.valueAfter(contract, model, time, -BumpSizes.THETA_DAYS));
        scenarios.add(() -> engine.revalue(contract, model.withRateShift(BumpSizes.RATE), time));
        scenarios.add(() -> engine.revalue(contract, model.withRateShift(-BumpSizes.RATE), time));

        List<UnderlyingQuote> quotes = new ArrayList<>();
        for (String name : underlyings) {
            UnderlyingQuote q = model.quote(name);
            quotes.add(q);
            double h = BumpSizes.spotStep(q.spot());
            double lowSpot = q.spot() > 0.0 ? q.spot() - h : q.spot() + 2.0 * h;
            double hv = BumpSizes.VOLATILITY;
            double lowVol = q.volatility() > hv ? q.volatility() - hv : q.volatility();
            scenarios.add(() -> engine.revalue(contract, model.withSpot(name, q.spot() + h), time));
            scenarios.add(() -> engine.revalue(contract, model.withSpot(name, lowSpot), time));
            scenarios.add(() -> engine.revalue(contract, model.withVolatility(name, q.volatility() + hv), time));
            scenarios.add(() -> engine.revalue(contract, model.withVolatility(name, lowVol), time));
        }

        double[] v = run(scenarios);
        double v0 = v[0];
        double theta = (v[1] - v[2]) / (2.0 * BumpSizes.THETA_DAYS);
        double rho = (v[3] - v[4]) / (2.0 * BumpSizes.RATE) * BumpSizes.RHO_UNIT;

        double delta = 0.0, gamma = 0.0, vega = 0.0;
        int i = 5;
        for (UnderlyingQuote q : quotes) {
            double h = BumpSizes.spotStep(q.spot());
            double up = v[i++], down = v[i++], volUp = v[i++], volDown = v[i++];
            if (q.spot() > 0.0) {
                delta += (up - down) / (2.0 * h);
                gamma += (up - 2.0 * v0 + down) / (h * h);
            } else {
                // down holds V(S + 2h) here
                delta += (up - v0) / h;
                gamma += (down - 2.0 * up + v0) / (h * h);
            }
            double hv = BumpSizes.VOLATILITY;
            if (q.volatility() > hv) {
                vega += (volUp - volDown) / (2.0 * hv) * BumpSizes.VEGA_UNIT;
            } else {
                vega += (volUp - volDown) / hv * BumpSizes.VEGA_UNIT;
            }
        }
        return Greeks.of(delta, gamma, vega, theta, rho);
    }

    private double[] run(List<DoubleSupplier> scenarios) {
        double[] out = new double[scenarios.size()];
        if (executor == null) {
            for (int i = 0; i < out.length; i++) {
                out[i] = scenarios.get(i).getAsDouble();
            }
            return out;
        }
        List<CompletableFuture<Double>> futures = new ArrayList<>(scenarios.size());
        for (DoubleSupplier s : scenarios) {
            futures.add(CompletableFuture.supplyAsync(s::getAsDouble, executor));
        }
        try {
            for (int i = 0; i < out.length; i++) {
                out[i] = futures.get(i).join();
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            if (e.getCause() instanceof Error err) {
                throw err;
            }
            throw e;
        }
        return out;
    }
}
