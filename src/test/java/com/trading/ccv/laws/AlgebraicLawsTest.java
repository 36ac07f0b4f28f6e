package com.trading.ccv.laws;

import static org.junit.Assert.*;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.io.ValuationConfig;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.Contract;
import com.trading.ccv.risk.GreeksAggregator;

public class AlgebraicLawsTest {
    private static final long SEED = 20240102L;
    private static final int TRIALS = 150;

    private GreeksAggregator aggregator;
    private AlgebraicLawChecker checker;

    @Before
    public void setUp() {
        // Coarse scan and grid keep nested When/Anytime trees cheap
        ValuationConfig cfg = ValuationConfig.defaults();
        cfg.setMaxHorizonDays(60);
        cfg.setTriggerStepDays(10);
        cfg.setExerciseGridPoints(5);
        ValuationEngine engine = new ValuationEngine(cfg);
        aggregator = new GreeksAggregator(engine);
        checker = new AlgebraicLawChecker(engine, aggregator);
    }

    @After
    public void tearDown() {
        aggregator.close();
    }

    @Test
    public void testCombinatorIdentities() {
        RandomContracts gen = new RandomContracts(SEED);
        for (int i = 0; i < TRIALS; i++) {
            MarketModel m = gen.market();
            Contract c = gen.contract(3);
            Contract d = gen.contract(3);
            checker.zeroIsWorthless(m);
            checker.single(c, m);
            checker.pair(c, d, gen.constant(), m);
        }
        assertTrue(checker.violations().toString(), checker.violations().isEmpty());
        assertTrue(checker.checks() >= TRIALS * 10);
    }

    @Test
    public void testGreeksCompose() {
        RandomContracts gen = new RandomContracts(SEED + 1);
        for (int i = 0; i < 40; i++) {
            checker.greeks(gen.contract(2), gen.contract(2), gen.market());
        }
        assertTrue(checker.violations().toString(), checker.violations().isEmpty());
    }

    @Test
    public void testParityAndDiscounting() {
        RandomContracts gen = new RandomContracts(SEED + 2);
        for (int i = 0; i < TRIALS; i++) {
            MarketModel m = gen.market();
            checker.putCallParity(gen.underlying(), gen.strike(), 1 + gen.day(), m);
            int early = gen.day();
            checker.discountMonotonicity(early, early + 1 + gen.day(), m);
        }
        assertTrue(checker.violations().toString(), checker.violations().isEmpty());
    }
}
