package com.trading.ccv;

import static com.trading.ccv.dsl.Contracts.*;
import static org.junit.Assert.*;

import org.junit.Test;

import com.trading.ccv.api.EuropeanPricer;
import com.trading.ccv.io.ValuationConfig;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.Currency;
import com.trading.ccv.pricing.PricingResult;
import com.trading.ccv.risk.Greeks;

public class ContractValuationTest {
    private final MarketModel market = MarketModel.builder().flatRate(0.05).underlying("SPX", 100.0, 0.25).build();

    @Test
    public void testPriceAndGreeksOfCall() {
        try (ContractValuation cv = new ContractValuation()) {
            ValuationResult r = cv.priceAndGreeks(europeanCall(100, 90, "SPX", Currency.USD), market);
            assertEquals(5.555864832239791, r.value().amount(), 1e-9);
            assertEquals(Currency.USD, r.value().currency());
            assertEquals(0.5641041807873175, r.greeks().delta(), 1e-9);
        }
    }

    @Test
    public void testValueAtLaterTime() {
        try (ContractValuation cv = new ContractValuation(ValuationConfig.defaults())) {
            Contract bond = zeroCouponBond(365, 1000, Currency.USD);
            assertEquals(1000 * Math.exp(-0.05 * 265 / 365.0), cv.value(bond, market, 100).amount(), 1e-9);
            Greeks g = cv.greeks(bond, market, 100);
            assertEquals(0.0, g.delta(), 0.0);
            assertTrue(g.rho() < 0.0);
        }
    }

    @Test
    public void testPerUnderlyingGreeks() {
        try (ContractValuation cv = new ContractValuation(ValuationConfig.defaults())) {
            Greeks g = cv.greeks(share("SPX", Currency.USD), market, "SPX");
            assertEquals(1.0, g.delta(), 1e-8);
        }
    }

    @Test
    public void testPluggablePricer() {
        EuropeanPricer flat = (type, strike, maturityDays, underlying, model) -> new PricingResult(1.0,
                Greeks.of(0.5, 0, 0, 0, 0));
        try (ContractValuation cv = new ContractValuation(ValuationConfig.defaults(), flat)) {
            Contract c = straddle(100, 90, "SPX", Currency.USD);
            assertEquals(2.0, cv.value(c, market).amount(), 0.0);
            assertEquals(1.0, cv.greeks(c, market).delta(), 0.0);
        }
    }
}
