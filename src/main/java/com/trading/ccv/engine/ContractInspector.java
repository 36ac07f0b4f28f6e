package com.trading.ccv.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.trading.ccv.error.MalformedContractException;
import com.trading.ccv.error.MarketModelIncompleteException;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.And;
import com.trading.ccv.model.Anytime;
import com.trading.ccv.model.BinaryOp;
import com.trading.ccv.model.Condition;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.ContractKind;
import com.trading.ccv.model.Currency;
import com.trading.ccv.model.Give;
import com.trading.ccv.model.Observable;
import com.trading.ccv.model.One;
import com.trading.ccv.model.Or;
import com.trading.ccv.model.Scale;
import com.trading.ccv.model.Then;
import com.trading.ccv.model.Truncate;
import com.trading.ccv.model.Underlying;
import com.trading.ccv.model.When;

/**
 * Single pass over a contract tree made before any valuation.
 *
 * <p>
 * The walk uses an explicit stack, so arbitrarily deep input cannot overflow
 * the thread stack here; trees deeper than {@code maxDepth} or larger than
 * {@code maxNodes} visits are rejected before the recursive valuation starts.
 * Observable expressions are walked the same way and share the depth bound.
 * Shared subtrees are counted every time they are reached, which is also how
 * often the valuation would visit them.
 */
public final class ContractInspector {
    private final int maxDepth;
    private final int maxNodes;

    public ContractInspector(int maxDepth, int maxNodes) {
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
    }

    /**
     * What a contract needs from the market, and how big it is.
     *
     * @param underlyings   referenced underlying names, sorted.
     * @param currencies    currencies of every {@code One} leaf.
     * @param nodes         node visits.
     * @param depth         deepest node, the root being depth 1.
     * @param approximating kinds present whose valuation is approximate.
     */
    public record Report(Set<String> underlyings, Set<Currency> currencies, int nodes, int depth,
            Set<ContractKind> approximating) {
    }

    private record Frame(Contract contract, int depth) {
    }

    private record ObservableFrame(Observable observable, int depth) {
    }

    /**
     * Walks {@code contract}.
     *
     * @throws MalformedContractException when a bound is exceeded.
     */
    public Report inspect(Contract contract) {
        if (contract == null) {
            throw new MalformedContractException("Contract must not be null");
        }
        Set<String> underlyings = new TreeSet<>();
        Set<Currency> currencies = EnumSet.noneOf(Currency.class);
        Set<ContractKind> approximating = EnumSet.noneOf(ContractKind.class);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(contract, 1));
        int nodes = 0;
        int observableNodes = 0;
        int deepest = 0;

        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            if (++nodes > maxNodes) {
                throw new MalformedContractException("Contract exceeds " + maxNodes + " node visits");
            }
            if (f.depth() > maxDepth) {
                throw new MalformedContractException("Contract exceeds maximum depth " + maxDepth);
            }
            deepest = Math.max(deepest, f.depth());
            int next = f.depth() + 1;
            Contract c = f.contract();
            switch (c.kind()) {
                case ZERO -> {
                }
                case ONE -> currencies.add(((One) c).currency());
                case GIVE -> stack.push(new Frame(((Give) c).contract(), next));
                case AND -> {
                    stack.push(new Frame(((And) c).right(), next));
                    stack.push(new Frame(((And) c).left(), next));
                }
                case OR -> {
                    stack.push(new Frame(((Or) c).right(), next));
                    stack.push(new Frame(((Or) c).left(), next));
                }
                case THEN -> stack.push(new Frame(((Then) c).contract(), next));
                case SCALE -> {
                    observableNodes += collect(((Scale) c).observable(), next, maxNodes - observableNodes,
                            underlyings);
                    stack.push(new Frame(((Scale) c).contract(), next));
                }
                case WHEN -> {
                    approximating.add(ContractKind.WHEN);
                    observableNodes += collect(((When) c).condition(), next, maxNodes - observableNodes,
                            underlyings);
                    stack.push(new Frame(((When) c).contract(), next));
                }
                case TRUNCATE -> {
                    approximating.add(ContractKind.TRUNCATE);
                    stack.push(new Frame(((Truncate) c).contract(), next));
                }
                case ANYTIME -> {
                    approximating.add(ContractKind.ANYTIME);
                    observableNodes += collect(((Anytime) c).condition(), next, maxNodes - observableNodes,
                            underlyings);
                    stack.push(new Frame(((Anytime) c).contract(), next));
                }
            }
        }
        return new Report(Collections.unmodifiableSet(underlyings), Collections.unmodifiableSet(currencies),
                nodes, deepest, Collections.unmodifiableSet(approximating));
    }

    /**
     * Checks that {@code model} can satisfy {@code report}.
     *
     * @throws MarketModelIncompleteException listing every missing underlying
     *                                        and FX rate.
     */
    public static void requireCovered(Report report, MarketModel model) {
        List<String> missingUnderlyings = new ArrayList<>();
        for (String name : report.underlyings()) {
            if (!model.hasUnderlying(name)) {
                missingUnderlyings.add(name);
            }
        }
        List<String> missingCurrencies = new ArrayList<>();
        for (Currency ccy : report.currencies()) {
            if (!model.hasFxRate(ccy)) {
                missingCurrencies.add(ccy.name());
            }
        }
        if (!missingUnderlyings.isEmpty() || !missingCurrencies.isEmpty()) {
            throw new MarketModelIncompleteException(missingUnderlyings, missingCurrencies);
        }
    }

    /**
     * Adds the underlyings read by {@code root} and returns the number of
     * observable nodes visited. Observable nesting counts on top of the depth
     * of the contract node holding it, since evaluation recurses through both.
     * Observable visits have a budget of their own, {@code maxNodes} per
     * contract.
     */
    private int collect(Observable root, int depth, int budget, Set<String> into) {
        Deque<ObservableFrame> stack = new ArrayDeque<>();
        stack.push(new ObservableFrame(root, depth));
        int visits = 0;
        while (!stack.isEmpty()) {
            ObservableFrame f = stack.pop();
            if (++visits > budget) {
                throw new MalformedContractException("Observables exceed " + maxNodes + " node visits");
            }
            if (f.depth() > maxDepth) {
                throw new MalformedContractException("Observable exceeds maximum depth " + maxDepth);
            }
            Observable o = f.observable();
            int next = f.depth() + 1;
            switch (o.kind()) {
                case CONSTANT -> {
                }
                case UNDERLYING -> into.add(((Underlying) o).name());
                case BINARY_OP -> {
                    stack.push(new ObservableFrame(((BinaryOp) o).left(), next));
                    stack.push(new ObservableFrame(((BinaryOp) o).right(), next));
                }
                case CONDITION -> {
                    stack.push(new ObservableFrame(((Condition) o).left(), next));
                    stack.push(new ObservableFrame(((Condition) o).right(), next));
                }
            }
        }
        return visits;
    }
}
