package com.fintech.ticks.symbol;

import com.fintech.ticks.storage.StartupFailureException;
import com.fintech.ticks.storage.StorageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed set of symbol handles, one per tracked symbol, built once at startup.
 *
 * <p>Every handle is opened and initialized synchronously while the registry is built,
 * before any worker or ingestion thread can see it. Passed explicitly to the dispatcher,
 * the worker pool and the ingestion path.
 */
public class SymbolRegistry implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SymbolRegistry.class);

    private final Map<String, SymbolHandle> handles;

    SymbolRegistry(Map<String, SymbolHandle> handles) {
        this.handles = Collections.unmodifiableMap(handles);
    }

    /**
     * Provisions the storage layout, opens and initializes a handle per symbol.
     * Duplicate symbols collapse into one handle.
     *
     * @throws StartupFailureException if storage cannot be provisioned or opened, or if
     *         two distinct symbols map to the same file name
     */
    public static SymbolRegistry open(List<String> symbols, StorageLayout layout, Clock clock) {
        layout.provision();

        Map<String, SymbolHandle> handles = new LinkedHashMap<>();
        Map<String, String> fileNames = new HashMap<>();
        try {
            for (String raw : symbols) {
                String symbol = raw.trim();
                if (symbol.isEmpty()) {
                    continue;
                }
                if (handles.containsKey(symbol)) {
                    log.warn("Duplicate symbol in configuration, ignoring: {}", symbol);
                    continue;
                }
                String fileName = layout.fileName(symbol);
                String clash = fileNames.putIfAbsent(fileName, symbol);
                if (clash != null) {
                    throw new StartupFailureException(
                        "Symbols '" + clash + "' and '" + symbol + "' both map to file " + fileName);
                }

                SymbolHandle handle = SymbolHandle.open(symbol, layout, clock);
                handles.put(symbol, handle);
                handle.initialize();
            }
        } catch (RuntimeException e) {
            handles.values().forEach(handle -> closeQuietly(handle, e));
            throw e;
        }

        if (handles.isEmpty()) {
            throw new StartupFailureException("No symbols configured");
        }

        log.info("Symbol registry ready: symbols={}", handles.keySet());
        return new SymbolRegistry(handles);
    }

    /**
     * Wraps already-opened handles. Intended for tests that build an isolated registry.
     */
    public static SymbolRegistry of(Collection<SymbolHandle> handles) {
        Map<String, SymbolHandle> map = new LinkedHashMap<>();
        handles.forEach(handle -> map.put(handle.getSymbol(), handle));
        return new SymbolRegistry(map);
    }

    public Optional<SymbolHandle> find(String symbol) {
        return Optional.ofNullable(handles.get(symbol));
    }

    /**
     * @throws UnknownSymbolException if {@code symbol} is not tracked
     */
    public SymbolHandle require(String symbol) {
        SymbolHandle handle = handles.get(symbol);
        if (handle == null) {
            throw new UnknownSymbolException(symbol);
        }
        return handle;
    }

    /** Handles in configuration order. */
    public Collection<SymbolHandle> handles() {
        return handles.values();
    }

    public List<String> symbols() {
        return List.copyOf(handles.keySet());
    }

    public int size() {
        return handles.size();
    }

    @Override
    public void close() {
        log.info("Closing symbol registry: symbols={}", handles.size());
        for (SymbolHandle handle : handles.values()) {
            try {
                handle.close();
            } catch (IOException e) {
                log.error("Failed to close storage for symbol {}", handle.getSymbol(), e);
            }
        }
    }

    private static void closeQuietly(SymbolHandle handle, Exception primary) {
        try {
            handle.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
