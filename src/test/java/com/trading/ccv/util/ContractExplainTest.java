package com.trading.ccv.util;

import static com.trading.ccv.dsl.Contracts.*;
import static com.trading.ccv.dsl.Observables.constant;
import static com.trading.ccv.dsl.Observables.gt;
import static com.trading.ccv.dsl.Observables.underlying;
import static org.junit.Assert.*;

import org.junit.Test;

import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.io.ValuationConfig;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.Currency;

public class ContractExplainTest {
    private final MarketModel market = MarketModel.builder().flatRate(0.05).underlying("SPX", 100.0, 0.25).build();

    @Test
    public void testDumpTree() {
        String expected = "And\n"
                + "  Then day 90\n"
                + "    Scale max(0.0, (SPX - 100.0))\n"
                + "      One USD\n"
                + "  Give\n"
                + "    Then day 90\n"
                + "      Scale max(0.0, (SPX - 110.0))\n"
                + "        One USD\n";
        assertEquals(expected, ContractExplain.dumpTree(bullCallSpread(100, 110, 90, "SPX", Currency.USD)));
    }

    @Test
    public void testDumpTreeLabels() {
        String dump = ContractExplain.dumpTree(americanPut(100, 30, "SPX", Currency.EUR));
        assertTrue(dump.startsWith("Truncate day 30\n  Anytime (SPX < 100.0)\n"));
        assertTrue(dump.endsWith("      One EUR\n"));
    }

    @Test
    public void testMermaidStructure() {
        String graph = new ContractExplain(null).toMermaid(zeroCouponBond(30, 5, Currency.USD));
        assertTrue(graph.startsWith("graph TD;\n"));
        assertTrue(graph.contains("n0[\"Then day 30\"];"));
        assertTrue(graph.contains("n2[\"One USD\"];"));
        assertTrue(graph.contains("n0 --> n1;"));
        assertTrue(graph.contains("n1 --> n2;"));
    }

    @Test
    public void testMermaidEscapesAndAnnotates() {
        ContractExplain explain = new ContractExplain(new ValuationEngine(ValuationConfig.defaults()));
        Contract c = truncate(10, anytime(gt(underlying("SPX"), constant(1)), one(Currency.USD)));
        String graph = explain.toMermaid(c, market);
        assertTrue(graph.contains("Anytime (SPX #gt; 1.0)"));
        assertTrue(graph.contains("<br/><b>1.0000</b>"));
    }

    @Test
    public void testExplainLegs() {
        ContractExplain explain = new ContractExplain(new ValuationEngine(ValuationConfig.defaults()));
        String text = explain.explainLegs(straddle(100, 90, "SPX", Currency.USD), market, 0);
        String[] lines = text.split("\\R");
        assertEquals(3, lines.length);
        assertTrue(lines[0].contains("5.555865"));
        assertTrue(lines[1].contains("4.330557"));
        assertTrue(lines[2].contains("9.886422"));
        assertTrue(lines[2].endsWith("USD"));
    }

    @Test(expected = IllegalStateException.class)
    public void testExplainLegsNeedsEngine() {
        new ContractExplain(null).explainLegs(zero(), market, 0);
    }
}
