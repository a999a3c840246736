package com.fintech.ticks.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * On-disk layout: one directory per resource kind under a base directory, one
 * {@code <sanitized symbol>.csv} file per symbol in each.
 *
 * <pre>
 * data/
 * ├── rolling/BINANCE_BTCUSDT.csv
 * ├── candlestick/BINANCE_BTCUSDT.csv
 * └── mean/BINANCE_BTCUSDT.csv
 * </pre>
 */
public class StorageLayout {

    private static final Logger log = LoggerFactory.getLogger(StorageLayout.class);

    public static final String ROLLING_DIR = "rolling";
    public static final String CANDLESTICK_DIR = "candlestick";
    public static final String MEAN_DIR = "mean";

    private static final Pattern NON_WORD = Pattern.compile("\\W");
    private static final String EXTENSION = ".csv";

    private final Path baseDir;
    private final String filler;

    public StorageLayout(Path baseDir, String filler) {
        this.baseDir = baseDir;
        this.filler = filler;
    }

    /**
     * Creates the per-kind directories if they are missing.
     *
     * @throws StartupFailureException if a directory cannot be created
     */
    public void provision() {
        for (String kind : List.of(ROLLING_DIR, CANDLESTICK_DIR, MEAN_DIR)) {
            Path dir = baseDir.resolve(kind);
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new StartupFailureException("Cannot create storage directory " + dir.toAbsolutePath(), e);
            }
        }
        log.info("Storage layout ready: baseDir={}", baseDir.toAbsolutePath());
    }

    public Path tickLogPath(String symbol) {
        return baseDir.resolve(ROLLING_DIR).resolve(fileName(symbol));
    }

    public Path candlestickPath(String symbol) {
        return baseDir.resolve(CANDLESTICK_DIR).resolve(fileName(symbol));
    }

    public Path meanPath(String symbol) {
        return baseDir.resolve(MEAN_DIR).resolve(fileName(symbol));
    }

    /** Returns the file name used for {@code symbol} in every kind directory. */
    public String fileName(String symbol) {
        return sanitize(symbol, filler) + EXTENSION;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9_]} with {@code filler}.
     * {@code "BINANCE:BTCUSDT"} becomes {@code "BINANCE_BTCUSDT"}.
     */
    public static String sanitize(String symbol, String filler) {
        return NON_WORD.matcher(symbol).replaceAll(Matcher.quoteReplacement(filler));
    }
}
