package com.trading.ccv.engine;

import java.util.Optional;

import com.trading.ccv.api.EuropeanPricer;
import com.trading.ccv.engine.PayoffRecognizer.EuropeanLeaf;
import com.trading.ccv.error.NegativeTimeOffsetException;
import com.trading.ccv.error.NumericDomainException;
import com.trading.ccv.error.UnsupportedApproximationException;
import com.trading.ccv.io.ValuationConfig;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.And;
import com.trading.ccv.model.Anytime;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.ContractKind;
import com.trading.ccv.model.Give;
import com.trading.ccv.model.One;
import com.trading.ccv.model.Or;
import com.trading.ccv.model.Scale;
import com.trading.ccv.model.Then;
import com.trading.ccv.model.Truncate;
import com.trading.ccv.model.Value;
import com.trading.ccv.model.When;
import com.trading.ccv.pricing.BlackScholesPricer;
import com.trading.ccv.pricing.PricingResult;

import lombok.extern.log4j.Log4j2;

/**
 * Values a contract by structural recursion over its combinators.
 *
 * <p>
 * Every valuation first runs a {@link ContractInspector} pass that bounds the
 * tree and checks the snapshot covers it, then recurses with one rule per
 * combinator:
 *
 * <pre>
 *   Zero            0
 *   One(ccy)        FX rate of ccy into the base currency
 *   Give(c)         -V(c)
 *   And(a, b)       V(a) + V(b)
 *   Or(a, b)        max(V(a), V(b))
 *   Then(t, c)      t &lt;= now: V(c);  else df(t - now) * V(c) on the market rolled to t
 *   Scale(o, c)     o * V(c)
 *   When(o, c)      first scanned day d where o holds: df(d - now) * V(c) at d;  never: 0
 *   Truncate(t, c)  now &gt; t: 0;  else V(c) with exercise deadline t
 *   Anytime(o, c)   max(0, best df(d - now) * V(c) at d over a grid where o holds)
 * </pre>
 *
 * <p>
 * Rolling to a later day replaces every spot with its risk-neutral forward.
 * {@code Then} over a vanilla European payoff (see {@link PayoffRecognizer}) is
 * handed to the {@link EuropeanPricer} instead, whose price is already
 * discounted.
 *
 * <p>
 * {@code When}, {@code Anytime}, {@code Truncate} and non-affine observables
 * read on a rolled market are approximations. With
 * {@link ValuationConfig#isStrict()} they raise
 * {@link UnsupportedApproximationException}.
 *
 * <p>
 * The engine holds no mutable state; one instance may serve any number of
 * threads.
 */
@Log4j2
public final class ValuationEngine {
    private final ValuationConfig config;
    private final EuropeanPricer pricer;
    private final ContractInspector inspector;

    public ValuationEngine(ValuationConfig config) {
        this(config, new BlackScholesPricer());
    }

    public ValuationEngine(ValuationConfig config, EuropeanPricer pricer) {
        this.config = config.copy().validate();
        this.pricer = pricer;
        this.inspector = new ContractInspector(this.config.getMaxDepth(), this.config.getMaxNodes());
    }

    /** A copy of the settings this engine was built with. */
    public ValuationConfig config() {
        return config.copy();
    }

    public EuropeanPricer pricer() {
        return pricer;
    }

    /**
     * Values {@code contract} at day {@code time}, with {@code model} being the
     * market as of that day.
     *
     * @return the value in the snapshot's base currency.
     */
    public Value value(Contract contract, MarketModel model, int time) {
        if (time < 0) {
            throw new NegativeTimeOffsetException("Valuation time", time);
        }
        long start = System.nanoTime();
        ContractInspector.Report report = inspect(contract, model);
        double amount = revalue(contract, model, time);
        if (log.isDebugEnabled()) {
            log.debug("Valued {} at day {}: {} nodes, depth {}, {} in {} us", contract.kind(), time,
                    report.nodes(), report.depth(), amount, (System.nanoTime() - start) / 1000);
        }
        return Value.of(amount, model.baseCurrency());
    }

    /**
     * Runs the pre-pass alone.
     *
     * @throws com.trading.ccv.error.MalformedContractException     if a bound is
     *                                                              exceeded.
     * @throws com.trading.ccv.error.MarketModelIncompleteException if market
     *                                                              data is
     *                                                              missing.
     * @throws UnsupportedApproximationException                    in strict mode,
     *                                                              if the tree
     *                                                              contains an
     *                                                              approximated
     *                                                              combinator.
     */
    public ContractInspector.Report inspect(Contract contract, MarketModel model) {
        ContractInspector.Report report = inspector.inspect(contract);
        ContractInspector.requireCovered(report, model);
        if (config.isStrict() && !report.approximating().isEmpty()) {
            ContractKind first = report.approximating().iterator().next();
            throw new UnsupportedApproximationException(first.name(), approximationOf(first));
        }
        return report;
    }

    /**
     * Values a contract that already passed {@link #inspect}. Bump scenarios
     * call this directly; {@code now} may be negative for a backward theta
     * step.
     *
     * @return the amount in the snapshot's base currency.
     */
    public double revalue(Contract contract, MarketModel model, int now) {
        double amount = eval(contract, ValuationContext.start(model, now));
        if (!Double.isFinite(amount)) {
            throw new NumericDomainException("Valuation of " + contract.kind() + " produced " + amount);
        }
        return amount;
    }

    /**
     * Value after {@code elapsedDays} pass with nothing else moving: spots,
     * volatilities and the curve shape stay, the evaluation day moves.
     */
    public double valueAfter(Contract contract, MarketModel model, int time, int elapsedDays) {
        return revalue(contract, model.withTimeShift(elapsedDays), time + elapsedDays);
    }

    /**
     * Closed-form price of a recognised leaf, scaled by its factor and
     * converted into the base currency.
     */
    public PricingResult priceLeaf(EuropeanLeaf leaf, MarketModel model, int now) {
        PricingResult unit = pricer.priceEuropean(leaf.type(), leaf.strike(), leaf.day() - now,
                leaf.underlying(), model);
        return unit.scale(leaf.factor() * model.fxRate(leaf.currency()));
    }

    private double eval(Contract c, ValuationContext ctx) {
        return switch (c.kind()) {
            case ZERO -> 0.0;
            case ONE -> ctx.model().fxRate(((One) c).currency());
            case GIVE -> -eval(((Give) c).contract(), ctx);
            case AND -> eval(((And) c).left(), ctx) + eval(((And) c).right(), ctx);
            case OR -> Math.max(eval(((Or) c).left(), ctx), eval(((Or) c).right(), ctx));
            case THEN -> then((Then) c, ctx);
            case SCALE -> scale((Scale) c, ctx);
            case WHEN -> when((When) c, ctx);
            case TRUNCATE -> truncate((Truncate) c, ctx);
            case ANYTIME -> anytime((Anytime) c, ctx);
        };
    }

    private double then(Then c, ValuationContext ctx) {
        if (c.day() <= ctx.now()) {
            return eval(c.contract(), ctx);
        }
        Optional<EuropeanLeaf> leaf = PayoffRecognizer.match(c);
        if (leaf.isPresent()) {
            return priceLeaf(leaf.get(), ctx.model(), ctx.now()).price();
        }
        return ctx.discountTo(c.day()) * eval(c.contract(), ctx.rollTo(c.day()));
    }

    private double scale(Scale c, ValuationContext ctx) {
        if (ctx.forward() && config.isStrict() && !ObservableEvaluator.isAffine(c.observable())) {
            throw new UnsupportedApproximationException("Scale",
                    "certainty-equivalent value of " + c.observable() + " on a forward market");
        }
        return ObservableEvaluator.evaluate(c.observable(), ctx.model()) * eval(c.contract(), ctx);
    }

    private double when(When c, ValuationContext ctx) {
        requireLenient(ContractKind.WHEN);
        int limit = ctx.limit(config.getMaxHorizonDays());
        int step = config.getTriggerStepDays();
        for (long d = ctx.now(); d <= limit; d += step) {
            ValuationContext at = ctx.rollTo((int) d);
            if (ObservableEvaluator.test(c.condition(), at.model())) {
                return ctx.discountTo((int) d) * eval(c.contract(), at);
            }
        }
        return 0.0;
    }

    private double truncate(Truncate c, ValuationContext ctx) {
        requireLenient(ContractKind.TRUNCATE);
        if (ctx.now() > c.day()) {
            return 0.0;
        }
        return eval(c.contract(), ctx.withDeadline(c.day()));
    }

    private double anytime(Anytime c, ValuationContext ctx) {
        requireLenient(ContractKind.ANYTIME);
        int now = ctx.now();
        int limit = ctx.limit(config.getMaxHorizonDays());
        long span = Math.max(0L, (long) limit - now);
        int intervals = config.getExerciseGridPoints() - 1;
        double best = 0.0;
        long previous = Long.MIN_VALUE;
        for (int i = 0; i <= intervals; i++) {
            long d = now + Math.round((double) span * i / intervals);
            if (d == previous) {
                continue;
            }
            previous = d;
            ValuationContext at = ctx.rollTo((int) d);
            if (ObservableEvaluator.test(c.condition(), at.model())) {
                best = Math.max(best, ctx.discountTo((int) d) * eval(c.contract(), at));
            }
        }
        return best;
    }

    private void requireLenient(ContractKind kind) {
        if (config.isStrict()) {
            throw new UnsupportedApproximationException(kind.name(), approximationOf(kind));
        }
    }

    private static String approximationOf(ContractKind kind) {
        return switch (kind) {
            case WHEN -> "trigger scanned on the deterministic forward path";
            case ANYTIME -> "exercise searched on a day grid of the forward path";
            case TRUNCATE -> "deadline applied to forward-path exercise only";
            default -> "approximated combinator";
        };
    }
}
