package com.fintech.ticks.ingestion;

import com.fintech.ticks.config.TickProperties;
import com.fintech.ticks.domain.Trade;
import com.fintech.ticks.storage.TickLogException;
import com.fintech.ticks.symbol.SymbolHandle;
import com.fintech.ticks.symbol.SymbolRegistry;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands decoded trades from the feed thread to the tick logs through an LMAX Disruptor
 * ring buffer.
 *
 * <p>Producers never touch files. A single handler thread appends each trade to its
 * symbol's log, so a slow disk backs up the ring buffer instead of the socket reader.
 * Append failures are logged and counted; the handler keeps consuming.
 */
@Component
public class TickIngestionPublisher {

    private static final Logger log = LoggerFactory.getLogger(TickIngestionPublisher.class);

    private final SymbolRegistry registry;
    private final TickProperties properties;
    private final Timer appendTimer;

    private final AtomicLong ticksIngested = new AtomicLong(0);
    private final AtomicLong unknownSymbolDrops = new AtomicLong(0);
    private final AtomicLong appendFailures = new AtomicLong(0);
    private final AtomicLong ringBufferEventsDropped = new AtomicLong(0);

    private Disruptor<TradeEventWrapper> disruptor;
    private RingBuffer<TradeEventWrapper> ringBuffer;

    public TickIngestionPublisher(SymbolRegistry registry, TickProperties properties, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.properties = properties;
        this.appendTimer = meterRegistry.timer("ticks.ingestion.append.time");

        meterRegistry.gauge("ticks.ingestion.ticks", ticksIngested);
        meterRegistry.gauge("ticks.ingestion.unknown.symbol", unknownSymbolDrops);
        meterRegistry.gauge("ticks.ingestion.append.failures", appendFailures);
        meterRegistry.gauge("ticks.ingestion.ringbuffer.dropped", ringBufferEventsDropped);
    }

    @PostConstruct
    public void start() {
        int bufferSize = properties.getIngestion().getBufferSize();

        EventFactory<TradeEventWrapper> eventFactory = TradeEventWrapper::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("tick-ingestion-handler-" + counter.incrementAndGet());
                thread.setDaemon(false);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();

        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,
            waitStrategy
        );

        disruptor.handleEventsWith(this::handleEvent);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<TradeEventWrapper>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, TradeEventWrapper event) {
                log.error("Exception ingesting trade at sequence {}: {}", sequence, event.trade, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during ingestion Disruptor startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during ingestion Disruptor shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Ingestion Disruptor started: bufferSize={}, waitStrategy={}",
                bufferSize, waitStrategy.getClass().getSimpleName());
    }

    /**
     * Publishes a trade for appending. Blocks while the ring buffer is full.
     */
    public void publish(Trade trade) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).trade = trade;
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Publishes without blocking.
     *
     * @return false if the ring buffer is full and the trade was dropped
     */
    public boolean tryPublish(Trade trade) {
        try {
            long sequence = ringBuffer.tryNext();
            try {
                ringBuffer.get(sequence).trade = trade;
                return true;
            } finally {
                ringBuffer.publish(sequence);
            }
        } catch (InsufficientCapacityException e) {
            ringBufferEventsDropped.incrementAndGet();
            return false;
        }
    }

    /**
     * Appends {@code trade} to its symbol's log on the calling thread.
     * Trades for untracked symbols are dropped.
     *
     * @return true if the trade was appended
     */
    public boolean ingest(Trade trade) {
        Optional<SymbolHandle> handle = registry.find(trade.symbol());
        if (handle.isEmpty()) {
            unknownSymbolDrops.incrementAndGet();
            log.debug("Dropping trade for untracked symbol: {}", trade.symbol());
            return false;
        }

        Timer.Sample sample = Timer.start();
        try {
            handle.get().append(trade);
            ticksIngested.incrementAndGet();
            return true;
        } catch (TickLogException e) {
            appendFailures.incrementAndGet();
            log.error("Failed to append trade for {}: {}", trade.symbol(), e.getMessage(), e);
            return false;
        } finally {
            sample.stop(appendTimer);
        }
    }

    private void handleEvent(TradeEventWrapper wrapper, long sequence, boolean endOfBatch) {
        if (wrapper.trade != null) {
            ingest(wrapper.trade);
            wrapper.trade = null;

            if (endOfBatch && log.isTraceEnabled()) {
                log.trace("Ingested trade at sequence {}, end of batch", sequence);
            }
        }
    }

    /**
     * Waits for every published trade to be appended, then stops the handler thread.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (disruptor != null) {
            log.info("Shutting down ingestion Disruptor...");
            disruptor.shutdown();
            disruptor = null;
            log.info("Ingestion Disruptor shutdown complete: ingested={}", ticksIngested.get());
        }
    }

    private WaitStrategy createWaitStrategy() {
        String strategy = properties.getIngestion().getWaitStrategy();

        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Pre-allocated ring buffer slot.
     */
    private static class TradeEventWrapper {
        Trade trade;
    }

    public long getTicksIngested() {
        return ticksIngested.get();
    }

    public long getUnknownSymbolDrops() {
        return unknownSymbolDrops.get();
    }

    public long getAppendFailures() {
        return appendFailures.get();
    }

    public long getRingBufferEventsDropped() {
        return ringBufferEventsDropped.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }
}
