package com.trading.ccv.wiring;

import static com.trading.ccv.dsl.Contracts.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Before;
import org.junit.Test;

import com.trading.ccv.api.ValuationListener;
import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.io.ValuationConfig;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.Currency;
import com.trading.ccv.model.Value;

public class RevaluationPublisherTest {

    private static class RecordingListener implements ValuationListener {
        final List<Long> ends = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        int valued;

        @Override
        public void onRevaluationStart(long epoch) {
        }

        @Override
        public void onContractValued(long epoch, String name, Value value, long durationNanos) {
            valued++;
        }

        @Override
        public void onContractError(long epoch, String name, Throwable error) {
            errors.add(name);
        }

        @Override
        public void onRevaluationEnd(long epoch, int contractsValued) {
            ends.add(epoch);
        }
    }

    private ValuationEngine engine;
    private MarketModel market;
    private Portfolio book;

    @Before
    public void setUp() {
        engine = new ValuationEngine(ValuationConfig.defaults());
        market = MarketModel.builder().flatRate(0.05).underlying("SPX", 100.0, 0.25).build();
        book = Portfolio.builder()
                .add("call", europeanCall(100, 90, "SPX", Currency.USD))
                .add("stock", share("SPX", Currency.USD))
                .build();
    }

    @Test
    public void testBatchRevaluesOnce() {
        RevaluationPublisher pub = new RevaluationPublisher(engine, book, market);
        RecordingListener l = new RecordingListener();
        pub.setListener(l);

        MarketEvent e = new MarketEvent();
        e.setSpotUpdate("SPX", 101.0, false, 1);
        pub.onEvent(e, 0, false);
        e.setSpotUpdate("SPX", 102.0, false, 2);
        pub.onEvent(e, 1, false);
        assertTrue(l.ends.isEmpty());

        e.setVolatilityUpdate("SPX", 0.30, false, 3);
        pub.onEvent(e, 2, true);

        assertEquals(List.of(1L), l.ends);
        assertEquals(2, l.valued);
        assertEquals(102.0, pub.latest().get("stock").amount(), 1e-12);
        assertEquals(0.30, pub.lastValuedMarket().volatility("SPX"), 0.0);
    }

    @Test
    public void testBatchEndFlagForcesRevaluation() {
        RevaluationPublisher pub = new RevaluationPublisher(engine, book, market);
        MarketEvent e = new MarketEvent();
        e.setRateShift(0.01, true, 1);
        pub.onEvent(e, 0, false);
        assertEquals(1, pub.epoch());
        assertEquals(0.06, pub.lastValuedMarket().zeroRate(365), 1e-12);
    }

    @Test
    public void testBadUpdateDroppedConsumerSurvives() {
        RevaluationPublisher pub = new RevaluationPublisher(engine, book, market);
        MarketEvent e = new MarketEvent();
        e.setSpotUpdate("NDX", 50.0, false, 1);
        pub.onEvent(e, 0, false);
        e.setVolatilityUpdate("SPX", -1.0, false, 2);
        pub.onEvent(e, 1, true);

        assertEquals(1, pub.epoch());
        assertEquals(2, pub.latest().size());
        assertEquals(100.0, pub.latest().get("stock").amount(), 1e-12);

        e.clear();
        pub.onEvent(e, 2, true);
        assertEquals(2, pub.epoch());
    }

    @Test
    public void testClearedSlotCarriesNothing() {
        MarketEvent e = new MarketEvent();
        e.setSpotUpdate("SPX", 101.0, true, 7);
        e.clear();
        assertNull(e.type());
        assertNull(e.underlying());
        assertFalse(e.isBatchEnd());
        assertEquals(0L, e.sequenceId());
    }

    @Test
    public void testFailingPositionReportedAndSkipped() {
        Portfolio withBad = Portfolio.builder()
                .add("ok", share("SPX", Currency.USD))
                .add("unpriced", share("NDX", Currency.USD))
                .build();
        RevaluationPublisher pub = new RevaluationPublisher(engine, withBad, market);
        RecordingListener l = new RecordingListener();
        pub.setListener(l);

        assertEquals(1, pub.revalue());
        assertEquals(List.of("unpriced"), l.errors);
        assertFalse(pub.latest().containsKey("unpriced"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicatePositionRejected() {
        Portfolio.builder().add("a", zero()).add("a", zero());
    }

    @Test
    public void testServiceEndToEnd() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        try (RevaluationService svc = new RevaluationService(engine, book, market, 64)) {
            svc.setListener(new RecordingListener() {
                @Override
                public void onRevaluationEnd(long epoch, int contractsValued) {
                    if (svc.publisher().lastValuedMarket().spot("SPX") == 110.0) {
                        done.countDown();
                    }
                }
            });
            svc.start();
            svc.publishVolatility("SPX", 0.2);
            svc.publishRateShift(0.0);
            svc.publishSpot("SPX", 110.0);
            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(110.0, svc.publisher().latest().get("stock").amount(), 1e-12);
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testPublishBeforeStart() {
        try (RevaluationService svc = new RevaluationService(engine, book, market, 64)) {
            svc.publishSpot("SPX", 1.0);
        }
    }
}
