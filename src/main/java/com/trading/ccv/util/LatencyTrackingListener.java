package com.trading.ccv.util;

import com.trading.ccv.api.ValuationListener;
import com.trading.ccv.model.Value;

/**
 * A listener that tracks revaluation performance.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> min, max and average time per revaluation pass (in
 * nanoseconds).</li>
 * <li><b>Throughput:</b> total number of passes.</li>
 * <li><b>Failures:</b> contracts that could not be valued.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe; attach it to a single revaluation thread.
 */
public final class LatencyTrackingListener implements ValuationListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(LatencyTrackingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long passStartNanos, lastLatencyNanos;
    private long totalPasses, totalLatencyNanos, totalErrors;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastContractsValued;

    @Override
    public void onRevaluationStart(long epoch) {
        passStartNanos = System.nanoTime();
    }

    @Override
    public void onContractValued(long epoch, String name, Value value, long durationNanos) {
        // Per-contract timings are not aggregated
    }

    @Override
    public void onContractError(long epoch, String name, Throwable error) {
        totalErrors++;
        errLimiter.log(String.format("Valuation failure for '%s': %s", name, error.getMessage()), null);
    }

    @Override
    public void onRevaluationEnd(long epoch, int contractsValued) {
        lastLatencyNanos = System.nanoTime() - passStartNanos;
        lastContractsValued = contractsValued;
        totalPasses++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public int lastContractsValued() {
        return lastContractsValued;
    }

    public long totalPasses() {
        return totalPasses;
    }

    public long totalErrors() {
        return totalErrors;
    }

    public double avgLatencyNanos() {
        return totalPasses > 0 ? (double) totalLatencyNanos / totalPasses : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalPasses = 0;
        totalLatencyNanos = 0;
        totalErrors = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-18s | %10s | %10s | %10s | %10s | %8s%n", "Metric", "Value", "Avg (us)",
                "Min (us)", "Max (us)", "Errors"));
        sb.append("--------------------------------------------------------------------------------\n");
        sb.append(String.format("%-18s | %10d | %10.2f | %10.2f | %10.2f | %8d%n",
                "Revaluations",
                totalPasses,
                avgLatencyNanos() / 1000.0,
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0,
                totalErrors));
        return sb.toString();
    }
}
