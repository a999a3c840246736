package com.fintech.ticks.util;

/**
 * Epoch-millisecond window arithmetic shared by the tick log, the aggregator and the dispatcher.
 * All methods are pure.
 */
public final class TimeWindows {

    public static final long SECOND_MS = 1_000L;
    public static final long MINUTE_MS = 60_000L;

    private TimeWindows() {
    }

    /**
     * Floors a timestamp to the start of its minute. Uses floor division so that
     * pre-epoch timestamps align downwards too.
     */
    public static long floorToMinute(long epochMillis) {
        return Math.floorDiv(epochMillis, MINUTE_MS) * MINUTE_MS;
    }

    /** Floors a timestamp to whole seconds. */
    public static long floorToSecond(long epochMillis) {
        return Math.floorDiv(epochMillis, SECOND_MS) * SECOND_MS;
    }

    /** Returns the exclusive end of a window of {@code minutes} starting at {@code windowStart}. */
    public static long windowEnd(long windowStart, int minutes) {
        return windowStart + minutes * MINUTE_MS;
    }

    /** Half-open membership test: {@code start <= timestamp < end}. */
    public static boolean isInWindow(long timestamp, long windowStart, long windowEnd) {
        return timestamp >= windowStart && timestamp < windowEnd;
    }
}
