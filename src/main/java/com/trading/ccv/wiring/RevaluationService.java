package com.trading.ccv.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.ccv.api.ValuationListener;
import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.market.MarketModel;

import lombok.extern.log4j.Log4j2;

/**
 * Owns the ring buffer that feeds a {@link RevaluationPublisher}.
 *
 * <p>
 * Single producer: the {@code publish...} methods must be called from one
 * thread. The consumer is a daemon thread created by the Disruptor.
 *
 * <pre>
 * try (RevaluationService svc = new RevaluationService(engine, book, market, 1024)) {
 *     svc.start();
 *     svc.publishSpot("SPX", 4510.25);
 * }
 * </pre>
 */
@Log4j2
public final class RevaluationService implements AutoCloseable {
    private final Disruptor<MarketEvent> disruptor;
    private final RevaluationPublisher publisher;
    private RingBuffer<MarketEvent> ringBuffer;
    private long seq;

    /**
     * @param bufferSize ring size, a power of two.
     */
    public RevaluationService(ValuationEngine engine, Portfolio portfolio, MarketModel initial, int bufferSize) {
        this.publisher = new RevaluationPublisher(engine, portfolio, initial);
        this.disruptor = new Disruptor<>(
                MarketEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        // Slots are cleared once revalued so they do not pin the last update's fields.
        disruptor.handleEventsWith(publisher).then((event, sequence, endOfBatch) -> event.clear());
    }

    public void setListener(ValuationListener listener) {
        publisher.setListener(listener);
    }

    public RevaluationPublisher publisher() {
        return publisher;
    }

    public void start() {
        ringBuffer = disruptor.start();
        log.info("Revaluation service started: ring buffer {}", ringBuffer.getBufferSize());
    }

    public void publishSpot(String underlying, double spot) {
        requireStarted().publishEvent((e, s) -> e.setSpotUpdate(underlying, spot, false, ++seq));
    }

    public void publishVolatility(String underlying, double volatility) {
        requireStarted().publishEvent((e, s) -> e.setVolatilityUpdate(underlying, volatility, false, ++seq));
    }

    public void publishRateShift(double shift) {
        requireStarted().publishEvent((e, s) -> e.setRateShift(shift, false, ++seq));
    }

    private RingBuffer<MarketEvent> requireStarted() {
        if (ringBuffer == null) {
            throw new IllegalStateException("Revaluation service not started");
        }
        return ringBuffer;
    }

    /** Drains pending events, then stops the consumer thread. */
    @Override
    public void close() {
        if (ringBuffer != null) {
            disruptor.shutdown();
            log.info("Revaluation service stopped after {} passes", publisher.epoch());
        }
    }
}
