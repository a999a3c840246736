package com.fintech.ticks.domain;

import java.time.Instant;

/**
 * Mean price of a symbol over the trailing fifteen-minute window.
 *
 * @param symbol Tracked symbol
 * @param startTime Earliest {@code recordedAt} in the window
 * @param endTime Latest {@code recordedAt} in the window
 * @param meanPrice Arithmetic mean of the prices
 * @param count Number of records in the window
 */
public record MeanSummary(
    String symbol,
    Instant startTime,
    Instant endTime,
    double meanPrice,
    long count
) {
}
