package com.trading.ccv.dsl;

import static com.trading.ccv.dsl.Observables.callPayoff;
import static com.trading.ccv.dsl.Observables.constant;
import static com.trading.ccv.dsl.Observables.ge;
import static com.trading.ccv.dsl.Observables.gt;
import static com.trading.ccv.dsl.Observables.le;
import static com.trading.ccv.dsl.Observables.lt;
import static com.trading.ccv.dsl.Observables.max;
import static com.trading.ccv.dsl.Observables.min;
import static com.trading.ccv.dsl.Observables.mul;
import static com.trading.ccv.dsl.Observables.putPayoff;
import static com.trading.ccv.dsl.Observables.sub;
import static com.trading.ccv.dsl.Observables.underlying;

import java.util.List;

import com.trading.ccv.model.And;
import com.trading.ccv.model.Anytime;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.Currency;
import com.trading.ccv.model.Give;
import com.trading.ccv.model.Observable;
import com.trading.ccv.model.One;
import com.trading.ccv.model.Or;
import com.trading.ccv.model.Scale;
import com.trading.ccv.model.Then;
import com.trading.ccv.model.Truncate;
import com.trading.ccv.model.When;
import com.trading.ccv.model.Zero;

/**
 * Construction API: the ten primitives and the standard products built from
 * them.
 *
 * <p>
 * Every method returns a fresh immutable tree; nothing here values anything.
 * Day arguments are absolute offsets from the valuation epoch.
 *
 * <pre>
 * Contract spread = bullCallSpread(100, 110, 90, "SPX", Currency.USD);
 * Contract hedged = share("SPX", Currency.USD).and(europeanPut(95, 90, "SPX", Currency.USD));
 * </pre>
 */
public final class Contracts {
    private Contracts() {
        // Utility class
    }

    // ── Primitives ───────────────────────────────────────────────

    public static Contract zero() {
        return Zero.INSTANCE;
    }

    public static Contract one(Currency currency) {
        return new One(currency);
    }

    public static Contract give(Contract c) {
        return new Give(c);
    }

    public static Contract and(Contract a, Contract b) {
        return new And(a, b);
    }

    public static Contract or(Contract a, Contract b) {
        return new Or(a, b);
    }

    public static Contract then(int day, Contract c) {
        return new Then(day, c);
    }

    public static Contract scale(Observable factor, Contract c) {
        return new Scale(factor, c);
    }

    public static Contract scale(double factor, Contract c) {
        return new Scale(constant(factor), c);
    }

    public static Contract when(Observable condition, Contract c) {
        return new When(condition, c);
    }

    public static Contract truncate(int day, Contract c) {
        return new Truncate(day, c);
    }

    public static Contract anytime(Observable condition, Contract c) {
        return new Anytime(condition, c);
    }

    /** {@code And} of every leg, {@code Zero} when there are none. */
    public static Contract all(List<Contract> legs) {
        Contract result = null;
        for (Contract leg : legs) {
            result = result == null ? leg : new And(result, leg);
        }
        return result == null ? zero() : result;
    }

    public static Contract all(Contract... legs) {
        return all(List.of(legs));
    }

    // ── Bonds, forwards, vanillas ────────────────────────────────

    public static Contract zeroCouponBond(int maturity, double notional, Currency ccy) {
        return then(maturity, scale(notional, one(ccy)));
    }

    /** One unit of the underlying held now. */
    public static Contract share(String name, Currency ccy) {
        return scale(underlying(name), one(ccy));
    }

    public static Contract forward(double strike, int maturity, String name, Currency ccy) {
        return then(maturity, scale(sub(underlying(name), constant(strike)), one(ccy)));
    }

    public static Contract europeanCall(double strike, int maturity, String name, Currency ccy) {
        return then(maturity, scale(callPayoff(underlying(name), strike), one(ccy)));
    }

    public static Contract europeanPut(double strike, int maturity, String name, Currency ccy) {
        return then(maturity, scale(putPayoff(underlying(name), strike), one(ccy)));
    }

    /** Exercisable on any day up to maturity while in the money. */
    public static Contract americanCall(double strike, int maturity, String name, Currency ccy) {
        return truncate(maturity, anytime(gt(underlying(name), constant(strike)),
                scale(callPayoff(underlying(name), strike), one(ccy))));
    }

    public static Contract americanPut(double strike, int maturity, String name, Currency ccy) {
        return truncate(maturity, anytime(lt(underlying(name), constant(strike)),
                scale(putPayoff(underlying(name), strike), one(ccy))));
    }

    /** Pays {@code payout} at maturity if the underlying then exceeds the strike. */
    public static Contract digitalCall(double strike, int maturity, double payout, String name, Currency ccy) {
        return then(maturity, truncate(maturity, when(gt(underlying(name), constant(strike)),
                scale(payout, one(ccy)))));
    }

    // ── Barriers ─────────────────────────────────────────────────

    /**
     * Up-and-in call: becomes a European call once the underlying trades
     * above {@code barrier} before maturity.
     */
    public static Contract knockInCall(double strike, double barrier, int maturity, String name, Currency ccy) {
        return truncate(maturity, when(gt(underlying(name), constant(barrier)),
                europeanCall(strike, maturity, name, ccy)));
    }

    /** Up-and-out call, from in-out parity: the call minus its knock-in twin. */
    public static Contract knockOutCall(double strike, double barrier, int maturity, String name, Currency ccy) {
        return europeanCall(strike, maturity, name, ccy)
                .and(give(knockInCall(strike, barrier, maturity, name, ccy)));
    }

    // ── Option strategies ────────────────────────────────────────

    public static Contract straddle(double strike, int maturity, String name, Currency ccy) {
        return europeanCall(strike, maturity, name, ccy).and(europeanPut(strike, maturity, name, ccy));
    }

    public static Contract strangle(double putStrike, double callStrike, int maturity, String name, Currency ccy) {
        return europeanPut(putStrike, maturity, name, ccy).and(europeanCall(callStrike, maturity, name, ccy));
    }

    public static Contract bullCallSpread(double lowStrike, double highStrike, int maturity, String name,
            Currency ccy) {
        return europeanCall(lowStrike, maturity, name, ccy).and(give(europeanCall(highStrike, maturity, name, ccy)));
    }

    public static Contract bearPutSpread(double lowStrike, double highStrike, int maturity, String name,
            Currency ccy) {
        return europeanPut(highStrike, maturity, name, ccy).and(give(europeanPut(lowStrike, maturity, name, ccy)));
    }

    /** Long the wings, short two at the body. */
    public static Contract butterfly(double lowStrike, double midStrike, double highStrike, int maturity,
            String name, Currency ccy) {
        return all(europeanCall(lowStrike, maturity, name, ccy),
                europeanCall(highStrike, maturity, name, ccy),
                give(scale(2.0, europeanCall(midStrike, maturity, name, ccy))));
    }

    /** Share plus a protective put, financed by a covered call. */
    public static Contract collar(double putStrike, double callStrike, int maturity, String name, Currency ccy) {
        return all(share(name, ccy),
                europeanPut(putStrike, maturity, name, ccy),
                give(europeanCall(callStrike, maturity, name, ccy)));
    }

    /** Short strangle inside, long strangle outside. */
    public static Contract ironCondor(double putLow, double putHigh, double callLow, double callHigh, int maturity,
            String name, Currency ccy) {
        return all(europeanPut(putLow, maturity, name, ccy),
                give(europeanPut(putHigh, maturity, name, ccy)),
                give(europeanCall(callLow, maturity, name, ccy)),
                europeanCall(callHigh, maturity, name, ccy));
    }

    /** Long the far expiry, short the near one, same strike. */
    public static Contract calendarSpread(double strike, int nearMaturity, int farMaturity, String name,
            Currency ccy) {
        return europeanCall(strike, farMaturity, name, ccy).and(give(europeanCall(strike, nearMaturity, name, ccy)));
    }

    public static Contract protectivePut(double strike, int maturity, String name, Currency ccy) {
        return share(name, ccy).and(europeanPut(strike, maturity, name, ccy));
    }

    // ── Rates and structured products ────────────────────────────

    /**
     * Receive fixed, pay floating. Each payment day exchanges
     * {@code notional * fixedRate} against {@code notional * index}, where
     * {@code index} names a rate quoted as an underlying.
     */
    public static Contract fixedForFloatingSwap(double notional, double fixedRate, List<Integer> paymentDays,
            String index, Currency ccy) {
        Contract fixed = zero();
        Contract floating = zero();
        for (int day : paymentDays) {
            fixed = fixed.and(then(day, scale(notional * fixedRate, one(ccy))));
            floating = floating.and(then(day, scale(mul(constant(notional), underlying(index)), one(ccy))));
        }
        return fixed.and(give(floating));
    }

    /** Notional back at maturity plus {@code participation} calls on the upside. */
    public static Contract principalProtectedNote(double notional, double participation, double strike,
            int maturity, String name, Currency ccy) {
        return zeroCouponBond(maturity, notional, ccy)
                .and(scale(participation, europeanCall(strike, maturity, name, ccy)));
    }

    /**
     * Enhanced coupon bond whose holder has sold {@code notional / strike}
     * puts: below the strike the note repays in depreciated shares.
     */
    public static Contract reverseConvertible(double notional, double couponRate, double strike, int maturity,
            String name, Currency ccy) {
        return zeroCouponBond(maturity, notional * (1.0 + couponRate), ccy)
                .and(give(scale(notional / strike, europeanPut(strike, maturity, name, ccy))));
    }

    /** Call on {@code first - second}. */
    public static Contract spreadOption(double strike, int maturity, String first, String second, Currency ccy) {
        return then(maturity, scale(callPayoff(sub(underlying(first), underlying(second)), strike), one(ccy)));
    }

    /** Call on the better of two assets. */
    public static Contract bestOfCall(double strike, int maturity, String first, String second, Currency ccy) {
        return then(maturity, scale(callPayoff(max(underlying(first), underlying(second)), strike), one(ccy)));
    }

    /** Call on the worse of two assets. */
    public static Contract worstOfCall(double strike, int maturity, String first, String second, Currency ccy) {
        return then(maturity, scale(callPayoff(min(underlying(first), underlying(second)), strike), one(ccy)));
    }

    /**
     * Call on a foreign asset paid in {@code ccy} at the fixed conversion
     * {@code quantoRate} rather than the spot FX rate.
     */
    public static Contract quantoCall(double strike, int maturity, String foreignName, double quantoRate,
            Currency ccy) {
        return then(maturity, scale(mul(constant(quantoRate), callPayoff(underlying(foreignName), strike)),
                one(ccy)));
    }

    /**
     * Ratchet strip: one call per reset period, each with its own strike and
     * expiry.
     */
    public static Contract cliquet(List<Double> strikes, List<Integer> maturities, String name, Currency ccy) {
        if (strikes.size() != maturities.size()) {
            throw new IllegalArgumentException("Cliquet needs one strike per maturity, got " + strikes.size()
                    + " strikes and " + maturities.size() + " maturities");
        }
        Contract result = zero();
        for (int i = 0; i < strikes.size(); i++) {
            result = result.and(europeanCall(strikes.get(i), maturities.get(i), name, ccy));
        }
        return result;
    }

    /**
     * Note redeemed early, with accrued coupons, on the first observation day
     * the underlying is at or above {@code barrier}. The holder takes the best
     * of the redemption schedules.
     */
    public static Contract autocallable(double notional, double barrier, double couponRate,
            List<Integer> observationDays, String name, Currency ccy) {
        Contract result = zero();
        for (int i = 0; i < observationDays.size(); i++) {
            int day = observationDays.get(i);
            double redemption = notional * (1.0 + couponRate * (i + 1));
            Contract call = truncate(day, when(ge(underlying(name), constant(barrier)),
                    then(day, scale(redemption, one(ccy)))));
            result = result.or(call);
        }
        return result;
    }

    /**
     * Obligation to buy {@code sharesPerDay} shares at {@code strike} on each
     * observation day. A purchase is entered only while the underlying is at
     * or below {@code knockOut}; it settles as
     * {@code sharesPerDay * (S - strike)} on its day.
     */
    public static Contract accumulator(double strike, double knockOut, List<Integer> observationDays, String name,
            double sharesPerDay, Currency ccy) {
        Observable purchase = mul(constant(sharesPerDay), sub(underlying(name), constant(strike)));
        Contract result = zero();
        for (int day : observationDays) {
            result = result.and(truncate(day, when(le(underlying(name), constant(knockOut)),
                    then(day, scale(purchase, one(ccy))))));
        }
        return result;
    }
}
