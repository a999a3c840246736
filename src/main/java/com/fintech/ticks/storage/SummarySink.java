package com.fintech.ticks.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Append-only output for one kind of summary of one symbol.
 * Guarded by its own lock, independent of the tick log's.
 *
 * @param <T> summary type
 */
public class SummarySink<T> implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SummarySink.class);

    private final String symbol;
    private final AppendOnlyCsvFile<T> file;

    SummarySink(String symbol, AppendOnlyCsvFile<T> file) {
        this.symbol = symbol;
        this.file = file;
    }

    /**
     * Opens or creates the sink at {@code path}.
     *
     * @throws IOException if the file cannot be opened
     */
    public static <T> SummarySink<T> open(String symbol, Path path, RowCodec<T> codec) throws IOException {
        return new SummarySink<>(symbol, AppendOnlyCsvFile.open(path, codec));
    }

    /**
     * Appends one summary row (header first if the sink is blank).
     *
     * @throws TickLogException if the write fails
     */
    public void write(T summary) {
        file.append(summary);
        log.debug("Wrote summary: symbol={}, summary={}", symbol, summary);
    }

    /** Returns every stored summary in write order. */
    public List<T> readAll() {
        return file.readAll();
    }

    public boolean writeHeaderIfBlank() {
        return file.writeHeaderIfBlank();
    }

    public Path getPath() {
        return file.getPath();
    }

    @Override
    public void close() throws IOException {
        file.close();
    }
}
