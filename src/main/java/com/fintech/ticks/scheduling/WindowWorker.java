package com.fintech.ticks.scheduling;

import com.fintech.ticks.aggregation.WindowAggregator;
import com.fintech.ticks.domain.SummaryWindow;
import com.fintech.ticks.domain.TickRecord;
import com.fintech.ticks.storage.TickLogException;
import com.fintech.ticks.symbol.SignalChannel;
import com.fintech.ticks.symbol.SymbolHandle;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Recomputation loop for one summary kind of one symbol.
 *
 * <p>Protocol per signal: scan the tick log for the window ending at the received
 * minute boundary (log lock held only for the scan), aggregate with no lock held,
 * then write the summary to its sink (sink lock held only for the write). A failed
 * scan or write loses that minute's summary; the loop carries on with the next signal.
 *
 * @param <S> summary type
 */
public abstract class WindowWorker<S> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WindowWorker.class);

    public static final String MDC_SYMBOL = "symbol";

    protected final SymbolHandle handle;
    protected final WindowAggregator aggregator;
    private final SummaryWindow window;
    private final Timer computeTimer;

    protected WindowWorker(SymbolHandle handle, SummaryWindow window,
                           WindowAggregator aggregator, MeterRegistry meterRegistry) {
        this.handle = handle;
        this.window = window;
        this.aggregator = aggregator;
        this.computeTimer = meterRegistry.timer("ticks.window.compute.time", "window", window.tag());
    }

    /**
     * Blocks on the signal channel until it is closed or the thread is interrupted.
     */
    @Override
    public void run() {
        SignalChannel channel = handle.channel(window);
        MDC.put(MDC_SYMBOL, handle.getSymbol());
        log.info("Window worker started: symbol={}, window={}", handle.getSymbol(), window.tag());
        try {
            while (true) {
                OptionalLong boundary = channel.receive();
                if (boundary.isEmpty()) {
                    break;
                }
                processSignal(boundary.getAsLong());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.info("Window worker stopped: symbol={}, window={}", handle.getSymbol(), window.tag());
            MDC.remove(MDC_SYMBOL);
        }
    }

    /**
     * Recomputes the summary for the window ending at {@code boundary} and writes it.
     *
     * @return the written summary, or empty if the window had no records or the
     *         recomputation failed
     */
    public Optional<S> processSignal(long boundary) {
        Timer.Sample sample = Timer.start();
        try {
            List<TickRecord> records = handle.getTickLog().scanWindowEndingAt(boundary, window);
            Optional<S> summary = aggregate(records);
            if (summary.isPresent()) {
                write(summary.get());
            } else {
                log.debug("Empty window, nothing written: symbol={}, window={}, boundary={}",
                         handle.getSymbol(), window.tag(), boundary);
            }
            return summary;
        } catch (TickLogException e) {
            handle.getStats().recomputationFailed();
            log.error("Recomputation failed: symbol={}, window={}, boundary={}: {}",
                     handle.getSymbol(), window.tag(), boundary, e.getMessage(), e);
            return Optional.empty();
        } finally {
            sample.stop(computeTimer);
        }
    }

    public SummaryWindow getWindow() {
        return window;
    }

    public SymbolHandle getHandle() {
        return handle;
    }

    protected abstract Optional<S> aggregate(List<TickRecord> records);

    protected abstract void write(S summary);
}
