package com.fintech.ticks.domain;

import java.util.Objects;

/**
 * Immutable tick as stored in a symbol's tick log.
 * Log order follows {@code recordedAt}; {@code observedAt} may be out of order
 * because of feed jitter.
 *
 * @param symbol Tracked symbol
 * @param price Trade price
 * @param observedAt Source-assigned time (Unix epoch millis)
 * @param recordedAt Time the record was appended (Unix epoch millis)
 */
public record TickRecord(
    String symbol,
    double price,
    long observedAt,
    long recordedAt
) {

    public TickRecord {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
    }
}
