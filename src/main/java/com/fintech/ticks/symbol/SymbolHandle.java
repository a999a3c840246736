package com.fintech.ticks.symbol;

import com.fintech.ticks.domain.CandlestickSummary;
import com.fintech.ticks.domain.MeanSummary;
import com.fintech.ticks.domain.SummaryWindow;
import com.fintech.ticks.domain.TickRecord;
import com.fintech.ticks.domain.Trade;
import com.fintech.ticks.storage.CandlestickCodec;
import com.fintech.ticks.storage.MeanCodec;
import com.fintech.ticks.storage.StartupFailureException;
import com.fintech.ticks.storage.StorageLayout;
import com.fintech.ticks.storage.SummarySink;
import com.fintech.ticks.storage.SymbolLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lifecycle and coordination unit for one tracked symbol.
 *
 * <p>Owns the symbol's tick log, its candlestick and mean sinks, and the two signal
 * channels that trigger recomputation. Each of the three resources has its own lock;
 * no operation here ever holds two of them at once.
 */
public class SymbolHandle implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SymbolHandle.class);

    private final String symbol;
    private final SymbolLog tickLog;
    private final SummarySink<CandlestickSummary> candlestickSink;
    private final SummarySink<MeanSummary> meanSink;
    private final SignalChannel minuteSignals;
    private final SignalChannel fifteenSignals;
    private final Clock clock;
    private final SymbolStats stats = new SymbolStats();

    private final Object initLock = new Object();
    private boolean initialized;

    SymbolHandle(
            String symbol,
            SymbolLog tickLog,
            SummarySink<CandlestickSummary> candlestickSink,
            SummarySink<MeanSummary> meanSink,
            Clock clock) {
        this.symbol = symbol;
        this.tickLog = tickLog;
        this.candlestickSink = candlestickSink;
        this.meanSink = meanSink;
        this.clock = clock;
        this.minuteSignals = new SignalChannel(symbol + "/" + SummaryWindow.CANDLESTICK.tag());
        this.fifteenSignals = new SignalChannel(symbol + "/" + SummaryWindow.MEAN.tag());
    }

    /**
     * Opens or creates the three resources of {@code symbol} under {@code layout}.
     *
     * @throws StartupFailureException if any of them cannot be opened
     */
    public static SymbolHandle open(String symbol, StorageLayout layout, Clock clock) {
        List<Closeable> opened = new ArrayList<>();
        Path current = layout.tickLogPath(symbol);
        try {
            SymbolLog tickLog = SymbolLog.open(symbol, current, clock);
            opened.add(tickLog);

            current = layout.candlestickPath(symbol);
            SummarySink<CandlestickSummary> candlesticks = SummarySink.open(symbol, current, CandlestickCodec.INSTANCE);
            opened.add(candlesticks);

            current = layout.meanPath(symbol);
            SummarySink<MeanSummary> means = SummarySink.open(symbol, current, MeanCodec.INSTANCE);

            return new SymbolHandle(symbol, tickLog, candlesticks, means, clock);

        } catch (AccessDeniedException e) {
            closeQuietly(opened, e);
            throw new StartupFailureException(
                "Permission denied opening " + current.toAbsolutePath() + " for symbol " + symbol, e);
        } catch (IOException e) {
            closeQuietly(opened, e);
            throw new StartupFailureException(
                "Cannot open " + current.toAbsolutePath() + " for symbol " + symbol, e);
        }
    }

    /**
     * One-time initialization: writes the tick log header if the log is empty and
     * unconditionally writes one placeholder row to the candlestick sink. The mean
     * sink gets its header. Later calls, from any thread, are no-ops.
     *
     * @return true if this call performed the initialization
     */
    public boolean initialize() {
        synchronized (initLock) {
            if (initialized) {
                return false;
            }
            tickLog.writeHeaderIfBlank();
            candlestickSink.write(CandlestickSummary.placeholder(Instant.now(clock)));
            meanSink.writeHeaderIfBlank();
            initialized = true;
            log.info("Initialized symbol handle: symbol={}, tickLog={}", symbol, tickLog.getPath());
            return true;
        }
    }

    public boolean isInitialized() {
        synchronized (initLock) {
            return initialized;
        }
    }

    /**
     * Appends one trade to the tick log.
     *
     * @throws com.fintech.ticks.storage.TickLogException if the write fails
     */
    public TickRecord append(Trade trade) {
        TickRecord stored = tickLog.append(trade);
        stats.tickAppended();
        return stored;
    }

    /** Returns the signal channel that triggers recomputation of {@code window}. */
    public SignalChannel channel(SummaryWindow window) {
        return window == SummaryWindow.CANDLESTICK ? minuteSignals : fifteenSignals;
    }

    /** Closes both signal channels; their workers finish once drained. */
    public void closeChannels() {
        minuteSignals.close();
        fifteenSignals.close();
    }

    public String getSymbol() {
        return symbol;
    }

    public SymbolLog getTickLog() {
        return tickLog;
    }

    public SummarySink<CandlestickSummary> getCandlestickSink() {
        return candlestickSink;
    }

    public SummarySink<MeanSummary> getMeanSink() {
        return meanSink;
    }

    public SignalChannel getMinuteSignals() {
        return minuteSignals;
    }

    public SignalChannel getFifteenSignals() {
        return fifteenSignals;
    }

    public SymbolStats getStats() {
        return stats;
    }

    @Override
    public void close() throws IOException {
        closeChannels();
        IOException failure = null;
        for (Closeable resource : List.<Closeable>of(tickLog, candlestickSink, meanSink)) {
            try {
                resource.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static void closeQuietly(List<Closeable> resources, Exception primary) {
        for (Closeable resource : resources) {
            try {
                resource.close();
            } catch (IOException e) {
                primary.addSuppressed(e);
            }
        }
    }
}
