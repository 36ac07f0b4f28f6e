package com.trading.ccv.risk;

import static com.trading.ccv.dsl.Contracts.*;
import static org.junit.Assert.*;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.error.UnknownUnderlyingException;
import com.trading.ccv.io.ValuationConfig;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.Currency;

public class GreeksAggregatorTest {
    private static final Greeks CALL = Greeks.of(0.5641041807873175, 0.031720479149912585, 0.19553720023918714,
            -0.034124321634718575, 0.12539478882696647);
    private static final Greeks PUT = Greeks.of(-0.4358958192126825, 0.031720479149912585, 0.19553720023918714,
            -0.02059354189827065, -0.11815924642909627);

    private GreeksAggregator aggregator;
    private MarketModel market;

    @Before
    public void setUp() {
        aggregator = new GreeksAggregator(new ValuationEngine(ValuationConfig.defaults()));
        market = MarketModel.builder()
                .flatRate(0.05)
                .underlying("SPX", 100.0, 0.25)
                .underlying("NDX", 200.0, 0.30)
                .build();
    }

    @After
    public void tearDown() {
        aggregator.close();
    }

    private static void assertGreeks(Greeks expected, Greeks actual, double deltaTol, double gammaTol,
            double vegaTol, double thetaTol, double rhoTol) {
        assertEquals("delta", expected.delta(), actual.delta(), deltaTol);
        assertEquals("gamma", expected.gamma(), actual.gamma(), gammaTol);
        assertEquals("vega", expected.vega(), actual.vega(), vegaTol);
        assertEquals("theta", expected.theta(), actual.theta(), thetaTol);
        assertEquals("rho", expected.rho(), actual.rho(), rhoTol);
    }

    @Test
    public void testLeafUsesAnalyticGreeks() {
        Greeks g = aggregator.greeks(europeanCall(100, 90, "SPX", Currency.USD), market, 0);
        assertGreeks(CALL, g, 1e-12, 1e-12, 1e-12, 1e-12, 1e-12);
    }

    @Test
    public void testBumpedGreeksAgreeWithAnalytic() {
        // Or forces the generic bump path over the same payoff
        Contract wrapped = europeanCall(100, 90, "SPX", Currency.USD).or(zero());
        Greeks g = aggregator.greeks(wrapped, market, 0);
        assertGreeks(CALL, g, 1e-4, 1e-5, 1e-6, 1e-3, 1e-6);
    }

    @Test
    public void testZeroCouponBondRateAndTime() {
        Greeks g = aggregator.greeks(zeroCouponBond(365, 1000, Currency.USD), market, 0);
        assertEquals(0.0, g.delta(), 0.0);
        assertEquals(0.0, g.gamma(), 0.0);
        assertEquals(0.0, g.vega(), 0.0);
        assertEquals(-9.51229424500714, g.rho(), 1e-4);
        assertEquals(0.1303054006165362, g.theta(), 1e-6);
    }

    @Test
    public void testStraddleIsSumOfLegs() {
        Greeks g = aggregator.greeks(straddle(100, 90, "SPX", Currency.USD), market, 0);
        assertGreeks(CALL.plus(PUT), g, 1e-12, 1e-12, 1e-12, 1e-12, 1e-12);
    }

    @Test
    public void testGiveNegatesAndScaleMultiplies() {
        Contract call = europeanCall(100, 90, "SPX", Currency.USD);
        assertEquals(CALL.negate().delta(), aggregator.greeks(give(call), market, 0).delta(), 1e-12);
        assertEquals(3 * CALL.vega(), aggregator.greeks(scale(3.0, call), market, 0).vega(), 1e-12);
    }

    @Test
    public void testShareHasUnitDelta() {
        Greeks g = aggregator.greeks(share("SPX", Currency.USD), market, 0);
        assertEquals(1.0, g.delta(), 1e-8);
        assertEquals(0.0, g.gamma(), 1e-6);
        assertEquals(0.0, g.vega(), 1e-12);
    }

    @Test
    public void testPerUnderlyingGreeks() {
        Contract book = europeanCall(100, 90, "SPX", Currency.USD).and(share("NDX", Currency.USD));
        Greeks net = aggregator.greeks(book, market, 0);
        Greeks spx = aggregator.greeks(book, market, 0, "SPX");
        Greeks ndx = aggregator.greeks(book, market, 0, "NDX");

        assertEquals(CALL.delta(), spx.delta(), 1e-12);
        assertEquals(1.0, ndx.delta(), 1e-8);
        assertEquals(net.delta(), spx.delta() + ndx.delta(), 1e-8);
        // theta and rho belong to the whole contract
        assertEquals(net.theta(), spx.theta(), 1e-12);
        assertEquals(net.rho(), ndx.rho(), 1e-12);
    }

    @Test(expected = UnknownUnderlyingException.class)
    public void testUnknownUnderlyingRejected() {
        aggregator.greeks(zero(), market, 0, "DAX");
    }

    @Test
    public void testParallelScenariosMatchSequential() {
        ValuationConfig cfg = ValuationConfig.defaults();
        cfg.setParallelism(4);
        Contract c = bestOfCall(150, 120, "SPX", "NDX", Currency.USD).or(zeroCouponBond(30, 1, Currency.USD));
        Greeks sequential = aggregator.greeks(c, market, 0);
        try (GreeksAggregator parallel = new GreeksAggregator(new ValuationEngine(cfg))) {
            assertEquals(sequential, parallel.greeks(c, market, 0));
        }
    }
}
