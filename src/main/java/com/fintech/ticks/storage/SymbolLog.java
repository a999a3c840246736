package com.fintech.ticks.storage;

import com.fintech.ticks.domain.SummaryWindow;
import com.fintech.ticks.domain.TickRecord;
import com.fintech.ticks.domain.Trade;
import com.fintech.ticks.util.TimeWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Durable, ordered tick log for one symbol.
 *
 * <p>Backed by an {@link AppendOnlyCsvFile}; all mutating and reading access is
 * serialized by that file's lock. Window scans re-read the whole log, which is
 * acceptable for the per-symbol volumes this service handles.
 */
public class SymbolLog implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SymbolLog.class);

    private final String symbol;
    private final AppendOnlyCsvFile<TickRecord> file;
    private final Clock clock;

    // Guarded by the file lock; also seeded once in open before the log is shared
    private long lastRecordedAt = Long.MIN_VALUE;

    SymbolLog(String symbol, AppendOnlyCsvFile<TickRecord> file, Clock clock) {
        this.symbol = symbol;
        this.file = file;
        this.clock = clock;
    }

    /**
     * Opens or creates the tick log at {@code path}.
     *
     * @throws IOException if the file cannot be opened
     */
    public static SymbolLog open(String symbol, Path path, Clock clock) throws IOException {
        SymbolLog tickLog = new SymbolLog(symbol, AppendOnlyCsvFile.open(path, TickRecordCodec.INSTANCE), clock);
        tickLog.seedLastRecordedAt();
        return tickLog;
    }

    // Stamps after a restart must not fall below what is already on disk
    private void seedLastRecordedAt() {
        try {
            file.readLast().ifPresent(last -> {
                lastRecordedAt = last.recordedAt();
                log.debug("Resuming tick log: symbol={}, lastRecordedAt={}", symbol, lastRecordedAt);
            });
        } catch (MalformedRecordException e) {
            log.warn("Cannot read last tick of {}, recordedAt restarts from the clock: {}",
                     symbol, e.getMessage());
        }
    }

    /**
     * Stamps {@code trade} with the current time and appends it.
     * {@code recordedAt} is taken under the log lock and never goes backwards,
     * so log order and {@code recordedAt} order agree.
     *
     * @return the stored record
     * @throws TickLogException if the write fails
     */
    public TickRecord append(Trade trade) {
        TickRecord stored = file.append(() -> {
            long now = Math.max(clock.millis(), lastRecordedAt);
            lastRecordedAt = now;
            return trade.recordedAt(now);
        });
        if (log.isTraceEnabled()) {
            log.trace("Appended tick: symbol={}, price={}, recordedAt={}",
                     symbol, stored.price(), stored.recordedAt());
        }
        return stored;
    }

    /**
     * Appends an already-stamped record as-is.
     *
     * @throws IllegalArgumentException if {@code record.recordedAt()} is older than the
     *         last stored record; nothing is written
     * @throws TickLogException if the write fails
     */
    public void append(TickRecord record) {
        file.append(() -> {
            if (record.recordedAt() < lastRecordedAt) {
                throw new IllegalArgumentException("recordedAt " + record.recordedAt()
                    + " is older than the last stored tick (" + lastRecordedAt + ") of " + symbol);
            }
            lastRecordedAt = record.recordedAt();
            return record;
        });
    }

    /**
     * Returns, in append order, every record with
     * {@code floorToMinute(referenceTime) <= recordedAt < floorToMinute(referenceTime) + windowMinutes}.
     *
     * @throws MalformedRecordException if any stored row fails to parse
     * @throws TickLogException if the log cannot be read
     */
    public List<TickRecord> scanWindow(long referenceTime, int windowMinutes) {
        long windowStart = TimeWindows.floorToMinute(referenceTime);
        long windowEnd = TimeWindows.windowEnd(windowStart, windowMinutes);
        List<TickRecord> records = file.readAll(
            record -> TimeWindows.isInWindow(record.recordedAt(), windowStart, windowEnd));
        log.debug("Scanned window: symbol={}, start={}, end={}, records={}",
                 symbol, windowStart, windowEnd, records.size());
        return records;
    }

    /**
     * Scans the window of the given kind that ends at the minute boundary {@code boundary}.
     */
    public List<TickRecord> scanWindowEndingAt(long boundary, SummaryWindow window) {
        return scanWindow(window.lookBackFrom(boundary), window.minutes());
    }

    /** Returns every stored record in append order. */
    public List<TickRecord> readAll() {
        return file.readAll();
    }

    /** True iff no data rows exist yet. */
    public boolean isEmpty() {
        return file.hasNoDataRows();
    }

    /**
     * Writes the header row if the underlying file holds zero bytes.
     *
     * @return true if the header was written by this call
     */
    public boolean writeHeaderIfBlank() {
        return file.writeHeaderIfBlank();
    }

    public String getSymbol() {
        return symbol;
    }

    public Path getPath() {
        return file.getPath();
    }

    @Override
    public void close() throws IOException {
        file.close();
    }
}
