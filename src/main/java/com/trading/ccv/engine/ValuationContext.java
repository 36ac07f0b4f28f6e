package com.trading.ccv.engine;

import com.trading.ccv.market.MarketModel;

/**
 * Where the recursion currently stands: the snapshot as of {@code now}, the
 * latest day an option may still be exercised, and whether the snapshot has
 * been rolled forward from the caller's market.
 */
record ValuationContext(MarketModel model, int now, int deadline, boolean forward) {

    static ValuationContext start(MarketModel model, int now) {
        return new ValuationContext(model, now, Integer.MAX_VALUE, false);
    }

    /** The same position moved to {@code day} on the risk-neutral forward market. */
    ValuationContext rollTo(int day) {
        if (day == now) {
            return this;
        }
        return new ValuationContext(model.asOf(day - now), day, deadline, true);
    }

    ValuationContext withDeadline(int day) {
        return new ValuationContext(model, now, Math.min(deadline, day), forward);
    }

    /** Last day a trigger scan or exercise search may look at. */
    int limit(int maxHorizonDays) {
        long horizon = (long) now + maxHorizonDays;
        return (int) Math.min(deadline, Math.min(horizon, Integer.MAX_VALUE));
    }

    double discountTo(int day) {
        return model.discountFactor(day - now);
    }
}
