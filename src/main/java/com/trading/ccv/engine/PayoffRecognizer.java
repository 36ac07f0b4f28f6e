package com.trading.ccv.engine;

import java.util.Optional;

import com.trading.ccv.model.ArithmeticOp;
import com.trading.ccv.model.BinaryOp;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.ContractKind;
import com.trading.ccv.model.Currency;
import com.trading.ccv.model.Observable;
import com.trading.ccv.model.ObservableKind;
import com.trading.ccv.model.One;
import com.trading.ccv.model.Scale;
import com.trading.ccv.model.Then;
import com.trading.ccv.model.Underlying;
import com.trading.ccv.pricing.OptionType;

/**
 * Spots vanilla European payoffs that a closed-form pricer can value.
 *
 * <p>
 * Recognised shape: {@code Then(t, Scale(payoff, One(ccy)))} where payoff is
 * one of
 *
 * <pre>
 *   max(0, S - K)    max(S - K, 0)    (call)
 *   max(0, K - S)    max(K - S, 0)    (put)
 * </pre>
 *
 * optionally multiplied, on either side, by a market-independent factor.
 * {@code S} must be an {@link Underlying}; {@code K} and the zero must not
 * reference the market, and {@code K} must be strictly positive. Anything else
 * is left to the generic recursion.
 */
public final class PayoffRecognizer {
    private PayoffRecognizer() {
        // Utility class
    }

    /**
     * A recognised European leaf.
     *
     * @param factor notional multiplier, applied to price and Greeks.
     * @param day    absolute payment day.
     */
    public record EuropeanLeaf(OptionType type, String underlying, double strike, double factor,
            Currency currency, int day) {
    }

    public static Optional<EuropeanLeaf> match(Contract contract) {
        if (contract.kind() != ContractKind.THEN) {
            return Optional.empty();
        }
        Then then = (Then) contract;
        if (then.contract().kind() != ContractKind.SCALE) {
            return Optional.empty();
        }
        Scale scale = (Scale) then.contract();
        if (scale.contract().kind() != ContractKind.ONE) {
            return Optional.empty();
        }
        Currency ccy = ((One) scale.contract()).currency();

        Observable payoff = scale.observable();
        double factor = 1.0;
        if (payoff instanceof BinaryOp mul && mul.op() == ArithmeticOp.MUL) {
            if (ObservableEvaluator.isMarketIndependent(mul.left())) {
                factor = ObservableEvaluator.evaluateFixed(mul.left());
                payoff = mul.right();
            } else if (ObservableEvaluator.isMarketIndependent(mul.right())) {
                factor = ObservableEvaluator.evaluateFixed(mul.right());
                payoff = mul.left();
            } else {
                return Optional.empty();
            }
        }
        if (!(payoff instanceof BinaryOp max) || max.op() != ArithmeticOp.MAX) {
            return Optional.empty();
        }

        Observable spread;
        if (isFixedZero(max.left())) {
            spread = max.right();
        } else if (isFixedZero(max.right())) {
            spread = max.left();
        } else {
            return Optional.empty();
        }
        if (!(spread instanceof BinaryOp sub) || sub.op() != ArithmeticOp.SUB) {
            return Optional.empty();
        }

        OptionType type;
        Observable strikeObs;
        Underlying underlying;
        if (sub.left().kind() == ObservableKind.UNDERLYING && ObservableEvaluator.isMarketIndependent(sub.right())) {
            type = OptionType.CALL;
            underlying = (Underlying) sub.left();
            strikeObs = sub.right();
        } else if (sub.right().kind() == ObservableKind.UNDERLYING
                && ObservableEvaluator.isMarketIndependent(sub.left())) {
            type = OptionType.PUT;
            underlying = (Underlying) sub.right();
            strikeObs = sub.left();
        } else {
            return Optional.empty();
        }

        double strike = ObservableEvaluator.evaluateFixed(strikeObs);
        if (!(strike > 0.0) || !Double.isFinite(strike) || !Double.isFinite(factor)) {
            return Optional.empty();
        }
        return Optional.of(new EuropeanLeaf(type, underlying.name(), strike, factor, ccy, then.day()));
    }

    private static boolean isFixedZero(Observable o) {
        return ObservableEvaluator.isMarketIndependent(o) && ObservableEvaluator.evaluateFixed(o) == 0.0;
    }
}
