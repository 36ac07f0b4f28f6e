package com.trading.ccv.engine;

import static com.trading.ccv.dsl.Contracts.*;
import static com.trading.ccv.dsl.Observables.*;
import static org.junit.Assert.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import com.trading.ccv.error.MalformedContractException;
import com.trading.ccv.error.MarketModelIncompleteException;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.ContractKind;
import com.trading.ccv.model.Currency;
import com.trading.ccv.model.Observable;

public class ContractInspectorTest {
    private final ContractInspector inspector = new ContractInspector(512, 1_000_000);

    @Test
    public void testCollectsUnderlyingsAndCurrencies() {
        Contract c = all(europeanCall(100, 90, "SPX", Currency.USD),
                spreadOption(0, 30, "NDX", "DAX", Currency.EUR),
                when(gt(underlying("VIX"), constant(30)), one(Currency.GBP)));
        ContractInspector.Report r = inspector.inspect(c);
        assertEquals(List.of("DAX", "NDX", "SPX", "VIX"), List.copyOf(r.underlyings()));
        assertEquals(EnumSet.of(Currency.USD, Currency.EUR, Currency.GBP), r.currencies());
        assertEquals(Set.of(ContractKind.WHEN), r.approximating());
    }

    @Test
    public void testCountsNodesAndDepth() {
        ContractInspector.Report r = inspector.inspect(zeroCouponBond(30, 5, Currency.USD));
        // Then -> Scale -> One
        assertEquals(3, r.nodes());
        assertEquals(3, r.depth());

        Contract leg = one(Currency.USD);
        ContractInspector.Report shared = inspector.inspect(leg.and(leg));
        assertEquals(3, shared.nodes());
        assertEquals(2, shared.depth());
    }

    @Test
    public void testApproximatingKinds() {
        ContractInspector.Report r = inspector.inspect(americanPut(100, 30, "SPX", Currency.USD));
        assertEquals(EnumSet.of(ContractKind.TRUNCATE, ContractKind.ANYTIME), r.approximating());
        assertTrue(inspector.inspect(straddle(100, 30, "SPX", Currency.USD)).approximating().isEmpty());
    }

    @Test
    public void testDeepTreeDoesNotOverflowStack() {
        ContractInspector wide = new ContractInspector(200_000, 1_000_000);
        Contract c = one(Currency.USD);
        for (int i = 0; i < 100_000; i++) {
            c = c.give();
        }
        assertEquals(100_001, wide.inspect(c).depth());
    }

    @Test(expected = MalformedContractException.class)
    public void testDepthLimit() {
        Contract c = zero();
        for (int i = 0; i < 10; i++) {
            c = c.give();
        }
        new ContractInspector(10, 1000).inspect(c);
    }

    @Test
    public void testObservableDepthAddsToContractDepth() {
        ContractInspector shallow = new ContractInspector(10, 1000);
        Observable level = underlying("SPX");
        for (int i = 0; i < 7; i++) {
            level = add(level, constant(1));
        }
        // Give -> Scale -> seven nested additions -> leaf sits at depth 10
        Contract c = scale(level, one(Currency.USD)).give();
        assertEquals(3, shallow.inspect(c).depth());
        try {
            shallow.inspect(c.give());
            fail("Expected MalformedContractException");
        } catch (MalformedContractException e) {
            assertTrue(e.getMessage().contains("depth 10"));
        }
    }

    @Test(timeout = 5000)
    public void testSharedObservableCountsEveryVisit() {
        Observable doubled = underlying("SPX");
        for (int i = 0; i < 40; i++) {
            doubled = add(doubled, doubled);
        }
        try {
            inspector.inspect(scale(doubled, one(Currency.USD)));
            fail("Expected MalformedContractException");
        } catch (MalformedContractException e) {
            assertTrue(e.getMessage().contains("1000000 node visits"));
        }
    }

    @Test(expected = MalformedContractException.class)
    public void testNullRejected() {
        inspector.inspect(null);
    }

    @Test
    public void testRequireCovered() {
        MarketModel m = MarketModel.builder().flatRate(0.01).underlying("SPX", 100, 0.2)
                .fxRate(Currency.EUR, 1.1).build();
        ContractInspector.requireCovered(
                inspector.inspect(europeanCall(100, 30, "SPX", Currency.EUR)), m);
        try {
            ContractInspector.requireCovered(inspector.inspect(all(
                    share("NDX", Currency.GBP), share("DAX", Currency.JPY))), m);
            fail("Expected MarketModelIncompleteException");
        } catch (MarketModelIncompleteException e) {
            assertEquals(List.of("DAX", "NDX"), e.getMissingUnderlyings());
            assertEquals(List.of("GBP", "JPY"), e.getMissingCurrencies());
        }
    }
}
