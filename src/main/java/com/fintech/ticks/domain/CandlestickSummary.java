package com.fintech.ticks.domain;

import java.time.Instant;

/**
 * One-minute OHLC summary of a symbol's tick log.
 *
 * @param symbol Tracked symbol (empty for the placeholder row)
 * @param windowStart Trigger time truncated to whole seconds
 * @param open Price of the first record in append order
 * @param close Price of the last record in append order
 * @param high Maximum price
 * @param low Minimum price
 * @param count Number of records in the window
 */
public record CandlestickSummary(
    String symbol,
    Instant windowStart,
    double open,
    double close,
    double high,
    double low,
    long count
) {

    /**
     * Zero-valued row written once to every candlestick sink at startup,
     * so the file has a recognizable shape before the first real minute.
     */
    public static CandlestickSummary placeholder(Instant at) {
        return new CandlestickSummary("", at, 0.0, 0.0, 0.0, 0.0, 0L);
    }
}
