package com.trading.ccv.pricing;

import org.apache.commons.math3.distribution.NormalDistribution;

import com.trading.ccv.api.EuropeanPricer;
import com.trading.ccv.error.NumericDomainException;
import com.trading.ccv.market.DiscountCurve;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.market.UnderlyingQuote;
import com.trading.ccv.risk.Greeks;

/**
 * Black-Scholes-Merton pricer with a continuous dividend yield.
 *
 * <p>
 * Formulas, with {@code T} in years and {@code r} the zero rate to expiry:
 * <ul>
 * <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T)), d2 = d1 -
 * sigma * sqrt(T)</li>
 * <li>Call: S * e^(-qT) * N(d1) - K * e^(-rT) * N(d2)</li>
 * <li>Put: K * e^(-rT) * N(-d2) - S * e^(-qT) * N(-d1)</li>
 * <li>Delta: e^(-qT) * N(d1) for calls, e^(-qT) * (N(d1) - 1) for puts</li>
 * <li>Gamma: e^(-qT) * n(d1) / (S * sigma * sqrt(T))</li>
 * <li>Vega: S * e^(-qT) * n(d1) * sqrt(T) / 100</li>
 * <li>Theta: per calendar day, /365</li>
 * <li>Rho: K * T * e^(-rT) * N(d2) / 100 for calls, -K * T * e^(-rT) * N(-d2) /
 * 100 for puts</li>
 * </ul>
 *
 * <p>
 * The discount factor comes from the snapshot's curve, so a term-structured
 * curve is honoured for the price. Theta assumes the zero rate to expiry stays
 * put as time passes, which is exact for a flat curve.
 *
 * <p>
 * A zero spot is handled without taking {@code ln(0)}: the call is worthless
 * and the put is a discounted strike.
 */
public final class BlackScholesPricer implements EuropeanPricer {

    // Thread-safe for density and cumulativeProbability
    private static final NormalDistribution NORM = new NormalDistribution();

    @Override
    public PricingResult priceEuropean(OptionType type, double strike, int maturityDays, String underlying,
            MarketModel model) {
        if (maturityDays <= 0) {
            throw new NumericDomainException("Option maturity must be > 0 days, got " + maturityDays);
        }
        if (!(strike > 0.0) || !Double.isFinite(strike)) {
            throw new NumericDomainException("Option strike must be > 0, got " + strike);
        }

        UnderlyingQuote quote = model.quote(underlying);
        double s = quote.spot();
        double sigma = quote.volatility();
        double q = quote.dividendYield();
        double t = maturityDays / DiscountCurve.DAYS_PER_YEAR;
        double df = model.discountFactor(maturityDays);
        double r = model.zeroRate(maturityDays);
        double expQT = Math.exp(-q * t);

        if (s == 0.0) {
            return zeroSpot(type, strike, t, r, df, expQT);
        }

        double sqrtT = Math.sqrt(t);
        double d1 = (Math.log(s / strike) + (r - q + 0.5 * sigma * sigma) * t) / (sigma * sqrtT);
        double d2 = d1 - sigma * sqrtT;

        double nd1 = NORM.density(d1);
        double gamma = expQT * nd1 / (s * sigma * sqrtT);
        double vega = s * expQT * nd1 * sqrtT / 100.0;
        double decay = -s * expQT * nd1 * sigma / (2.0 * sqrtT);

        double price, delta, theta, rho;
        if (type == OptionType.CALL) {
            double cd1 = NORM.cumulativeProbability(d1);
            double cd2 = NORM.cumulativeProbability(d2);
            price = s * expQT * cd1 - strike * df * cd2;
            delta = expQT * cd1;
            theta = (decay + q * s * expQT * cd1 - r * strike * df * cd2) / DiscountCurve.DAYS_PER_YEAR;
            rho = strike * t * df * cd2 / 100.0;
        } else {
            double pd1 = NORM.cumulativeProbability(-d1);
            double pd2 = NORM.cumulativeProbability(-d2);
            price = strike * df * pd2 - s * expQT * pd1;
            delta = -expQT * pd1;
            theta = (decay - q * s * expQT * pd1 + r * strike * df * pd2) / DiscountCurve.DAYS_PER_YEAR;
            rho = -strike * t * df * pd2 / 100.0;
        }
        return new PricingResult(price, Greeks.of(delta, gamma, vega, theta, rho));
    }

    private static PricingResult zeroSpot(OptionType type, double strike, double t, double r, double df,
            double expQT) {
        if (type == OptionType.CALL) {
            return new PricingResult(0.0, Greeks.ZERO);
        }
        double price = strike * df;
        return new PricingResult(price, Greeks.of(-expQT, 0.0, 0.0,
                r * price / DiscountCurve.DAYS_PER_YEAR, -t * price / 100.0));
    }
}
