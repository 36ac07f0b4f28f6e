package com.trading.ccv;

import com.trading.ccv.api.EuropeanPricer;
import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.io.ValuationConfig;
import com.trading.ccv.io.ValuationConfigReader;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.Value;
import com.trading.ccv.pricing.BlackScholesPricer;
import com.trading.ccv.risk.Greeks;
import com.trading.ccv.risk.GreeksAggregator;

/**
 * Contract Valuation: composable financial contracts priced by structural
 * recursion.
 *
 * <h2>Model</h2>
 * <p>
 * A {@link Contract} is an immutable tree of ten combinators ({@code Zero},
 * {@code One}, {@code Give}, {@code And}, {@code Or}, {@code Then},
 * {@code Scale}, {@code When}, {@code Truncate}, {@code Anytime}). Products
 * are built with {@link com.trading.ccv.dsl.Contracts}; their value on a
 * {@link MarketModel} follows from one rule per combinator under risk-neutral,
 * no-arbitrage assumptions.
 *
 * <h3>Entry points</h3>
 * <ul>
 * <li>{@link #value(Contract, MarketModel)}: present value in the snapshot's
 * base currency.</li>
 * <li>{@link #greeks(Contract, MarketModel)}: delta, gamma, vega, theta,
 * rho.</li>
 * <li>{@link #priceAndGreeks(Contract, MarketModel)}: both at once.</li>
 * </ul>
 *
 * <p>
 * Instances are thread-safe. {@link #close()} releases the bump-scenario
 * pool when {@code parallelism > 1}.
 */
public final class ContractValuation implements AutoCloseable {
    private final ValuationEngine engine;
    private final GreeksAggregator aggregator;

    /** Configured from the classpath {@code valuation.json}, Black-Scholes leaves. */
    public ContractValuation() {
        this(ValuationConfigReader.loadDefault());
    }

    public ContractValuation(ValuationConfig config) {
        this(config, new BlackScholesPricer());
    }

    public ContractValuation(ValuationConfig config, EuropeanPricer pricer) {
        this.engine = new ValuationEngine(config, pricer);
        this.aggregator = new GreeksAggregator(engine);
    }

    public ValuationEngine engine() {
        return engine;
    }

    public Value value(Contract contract, MarketModel model) {
        return engine.value(contract, model, 0);
    }

    /**
     * @param time day offset from the epoch; {@code model} is the market as of
     *             that day.
     */
    public Value value(Contract contract, MarketModel model, int time) {
        return engine.value(contract, model, time);
    }

    public Greeks greeks(Contract contract, MarketModel model) {
        return aggregator.greeks(contract, model, 0);
    }

    public Greeks greeks(Contract contract, MarketModel model, int time) {
        return aggregator.greeks(contract, model, time);
    }

    /** Spot and volatility Greeks with respect to one underlying. */
    public Greeks greeks(Contract contract, MarketModel model, String underlying) {
        return aggregator.greeks(contract, model, 0, underlying);
    }

    public ValuationResult priceAndGreeks(Contract contract, MarketModel model) {
        return new ValuationResult(value(contract, model), greeks(contract, model));
    }

    @Override
    public void close() {
        aggregator.close();
    }
}
