package com.trading.ccv.util;

import java.util.Arrays;

import com.trading.ccv.api.ValuationListener;
import com.trading.ccv.model.Value;

/**
 * Fans every callback out to several {@link ValuationListener}s, in the order
 * they were added.
 */
public class CompositeValuationListener implements ValuationListener {
    private ValuationListener[] listeners = new ValuationListener[0];

    public CompositeValuationListener add(ValuationListener listener) {
        ValuationListener[] old = listeners;
        ValuationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onRevaluationStart(long epoch) {
        for (ValuationListener l : listeners)
            l.onRevaluationStart(epoch);
    }

    @Override
    public void onContractValued(long epoch, String name, Value value, long durationNanos) {
        for (ValuationListener l : listeners)
            l.onContractValued(epoch, name, value, durationNanos);
    }

    @Override
    public void onContractError(long epoch, String name, Throwable error) {
        for (ValuationListener l : listeners)
            l.onContractError(epoch, name, error);
    }

    @Override
    public void onRevaluationEnd(long epoch, int contractsValued) {
        for (ValuationListener l : listeners)
            l.onRevaluationEnd(epoch, contractsValued);
    }
}
