package com.fintech.ticks.domain;

import java.time.Duration;

/**
 * The two recomputation windows, each triggered once per minute.
 * Both look back from the minute boundary they are triggered on.
 */
public enum SummaryWindow {

    CANDLESTICK(1),
    MEAN(15);

    private final int minutes;

    SummaryWindow(int minutes) {
        this.minutes = minutes;
    }

    /** Returns window length in whole minutes. */
    public int minutes() {
        return minutes;
    }

    /** Returns window length in milliseconds. */
    public long toMillis() {
        return Duration.ofMinutes(minutes).toMillis();
    }

    /**
     * Returns the reference time whose window ends at {@code boundary}:
     * {@code boundary - length}. The boundary is expected to be minute-aligned.
     */
    public long lookBackFrom(long boundary) {
        return boundary - toMillis();
    }

    /** Lower-case name used for metric tags, thread names and log lines. */
    public String tag() {
        return name().toLowerCase();
    }
}
