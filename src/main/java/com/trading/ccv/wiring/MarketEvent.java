package com.trading.ccv.wiring;

/**
 * A mutable market update carried by the Disruptor ring buffer.
 *
 * <p>
 * <b>Flyweight:</b> instances are pre-allocated when the ring buffer is built
 * and reused for its lifetime. Producers overwrite them through the
 * {@code set...} methods; nothing else should hold on to one.
 */
public final class MarketEvent {

    /** What the event changes. */
    public enum Type {
        SPOT,
        VOLATILITY,
        /** Parallel shift added to every zero rate. */
        RATE_SHIFT
    }

    private Type type;
    private String underlying;
    private double value;
    private boolean batchEnd;
    private long sequenceId;

    public void setSpotUpdate(String underlying, double spot, boolean batchEnd, long seqId) {
        set(Type.SPOT, underlying, spot, batchEnd, seqId);
    }

    public void setVolatilityUpdate(String underlying, double volatility, boolean batchEnd, long seqId) {
        set(Type.VOLATILITY, underlying, volatility, batchEnd, seqId);
    }

    public void setRateShift(double shift, boolean batchEnd, long seqId) {
        set(Type.RATE_SHIFT, null, shift, batchEnd, seqId);
    }

    private void set(Type type, String underlying, double value, boolean batchEnd, long seqId) {
        this.type = type;
        this.underlying = underlying;
        this.value = value;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    public Type type() {
        return type;
    }

    public String underlying() {
        return underlying;
    }

    public double value() {
        return value;
    }

    /** Forces a revaluation after this event even mid-batch. */
    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        type = null;
        underlying = null;
        value = 0;
        batchEnd = false;
        sequenceId = 0;
    }

    @Override
    public String toString() {
        return "MarketEvent{" + type + (underlying != null ? " " + underlying : "") + " = " + value
                + ", seq=" + sequenceId + "}";
    }
}
