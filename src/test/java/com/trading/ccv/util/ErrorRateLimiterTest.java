package com.trading.ccv.util;

import static org.junit.Assert.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

public class ErrorRateLimiterTest {
    private static final Logger log = LogManager.getLogger(ErrorRateLimiterTest.class);

    @Test
    public void testSuppressesWithinInterval() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(log, 60_000);
        assertTrue(limiter.log("first", new RuntimeException("boom")));
        assertFalse(limiter.log("second", null));
        assertFalse(limiter.log("third", null));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testListenersTrackPasses() {
        LatencyTrackingListener latency = new LatencyTrackingListener();
        LatencyTrackingListener other = new LatencyTrackingListener();
        CompositeValuationListener all = new CompositeValuationListener().add(latency).add(other);

        all.onRevaluationStart(1);
        all.onContractError(1, "bad", new IllegalStateException("no quote"));
        all.onRevaluationEnd(1, 4);

        assertEquals(1, latency.totalPasses());
        assertEquals(1, other.totalErrors());
        assertEquals(4, latency.lastContractsValued());
        assertTrue(latency.dump().contains("Revaluations"));

        latency.reset();
        assertEquals(0, latency.totalPasses());
        assertEquals(0, latency.minLatencyNanos());
    }
}
