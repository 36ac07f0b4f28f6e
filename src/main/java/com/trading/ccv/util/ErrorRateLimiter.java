package com.trading.ccv.util;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Logger;

/**
 * Limits how often errors are logged.
 * Useful on the revaluation thread, where a persistently bad market input
 * would otherwise log once per tick.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong(0);

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at error level unless another error was logged within the
     * interval; suppressed errors are counted and reported with the next one
     * that gets through.
     *
     * @return true if this call logged.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if ((last == 0 || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0) {
                logger.error("{} ({} similar errors suppressed)", message, dropped, t);
            } else {
                logger.error(message, t);
            }
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
