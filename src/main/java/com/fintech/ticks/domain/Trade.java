package com.fintech.ticks.domain;

/**
 * A single trade as delivered by the upstream feed, before it is written to a tick log.
 *
 * @param symbol Tracked symbol (e.g., "AAPL", "BINANCE:BTCUSDT")
 * @param price Trade price
 * @param observedAt Source-assigned trade time (Unix epoch millis)
 */
public record Trade(
    String symbol,
    double price,
    long observedAt
) {

    /** Stamps this trade with the time it was written to the log. */
    public TickRecord recordedAt(long recordedAt) {
        return new TickRecord(symbol, price, observedAt, recordedAt);
    }
}
