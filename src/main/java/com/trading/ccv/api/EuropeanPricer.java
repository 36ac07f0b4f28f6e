package com.trading.ccv.api;

import com.trading.ccv.market.MarketModel;
import com.trading.ccv.pricing.OptionType;
import com.trading.ccv.pricing.PricingResult;

/**
 * Closed-form pricer for vanilla European options.
 *
 * <p>
 * The valuation engine delegates {@code Then(t, Scale(max(0, S - K), One(c)))}
 * and its put mirror to this seam instead of recursing. Implementations must
 * be stateless and thread-safe; the engine may call them concurrently from
 * bump scenarios.
 *
 * <p>
 * Conventions of the returned {@link PricingResult}:
 * <ul>
 * <li>price is already discounted to the snapshot's date</li>
 * <li>delta per one unit of the underlying</li>
 * <li>vega per one volatility point (0.01)</li>
 * <li>theta per calendar day</li>
 * <li>rho per one percent of rate</li>
 * </ul>
 */
public interface EuropeanPricer {

    /**
     * Prices one unit of a European option.
     *
     * @param type         call or put.
     * @param strike       strike, strictly positive.
     * @param maturityDays days from the snapshot's date to expiry, strictly
     *                     positive.
     * @param underlying   name of the underlying in {@code model}.
     * @param model        the market snapshot.
     * @throws com.trading.ccv.error.NumericDomainException if the maturity or
     *                                                       strike is not
     *                                                       positive.
     */
    PricingResult priceEuropean(OptionType type, double strike, int maturityDays, String underlying,
            MarketModel model);
}
