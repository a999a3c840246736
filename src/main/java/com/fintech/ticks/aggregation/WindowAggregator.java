package com.fintech.ticks.aggregation;

import com.fintech.ticks.domain.CandlestickSummary;
import com.fintech.ticks.domain.MeanSummary;
import com.fintech.ticks.domain.TickRecord;
import com.fintech.ticks.util.TimeWindows;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reduces the records of one window into a summary. No I/O, no shared state.
 *
 * <p>Callers must pass records in append order: open and close are taken from the
 * first and last element of the list, not from timestamps.
 */
public class WindowAggregator {

    private final Clock clock;

    public WindowAggregator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the OHLC candlestick for {@code records}.
     * The window start is the computation time truncated to whole seconds,
     * not a value derived from the records.
     *
     * @return empty if {@code records} is empty
     */
    public Optional<CandlestickSummary> aggregateCandlestick(List<TickRecord> records) {
        if (records.isEmpty()) {
            return Optional.empty();
        }

        TickRecord first = records.get(0);
        RunningCandle candle = new RunningCandle(first.price());
        for (int i = 1; i < records.size(); i++) {
            candle.update(records.get(i).price());
        }

        Instant windowStart = Instant.ofEpochMilli(TimeWindows.floorToSecond(clock.millis()));
        return Optional.of(candle.toSummary(first.symbol(), windowStart));
    }

    /**
     * Builds the mean-price summary for {@code records}: span of {@code recordedAt}
     * and arithmetic mean of the prices.
     *
     * @return empty if {@code records} is empty
     */
    public Optional<MeanSummary> aggregateMean(List<TickRecord> records) {
        if (records.isEmpty()) {
            return Optional.empty();
        }

        long minRecordedAt = Long.MAX_VALUE;
        long maxRecordedAt = Long.MIN_VALUE;
        double sum = 0.0;
        for (TickRecord record : records) {
            minRecordedAt = Math.min(minRecordedAt, record.recordedAt());
            maxRecordedAt = Math.max(maxRecordedAt, record.recordedAt());
            sum += record.price();
        }

        return Optional.of(new MeanSummary(
            records.get(0).symbol(),
            Instant.ofEpochMilli(minRecordedAt),
            Instant.ofEpochMilli(maxRecordedAt),
            sum / records.size(),
            records.size()
        ));
    }

    /**
     * Mutable OHLC accumulator, local to a single aggregation call.
     */
    private static final class RunningCandle {

        final double open;
        double high;
        double low;
        double close;
        long count;

        RunningCandle(double initialPrice) {
            this.open = initialPrice;
            this.high = initialPrice;
            this.low = initialPrice;
            this.close = initialPrice;
            this.count = 1;
        }

        void update(double price) {
            this.high = Math.max(this.high, price);
            this.low = Math.min(this.low, price);
            this.close = price;
            this.count++;
        }

        CandlestickSummary toSummary(String symbol, Instant windowStart) {
            return new CandlestickSummary(symbol, windowStart, open, close, high, low, count);
        }
    }
}
