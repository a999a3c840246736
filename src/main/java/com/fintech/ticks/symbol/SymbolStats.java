package com.fintech.ticks.symbol;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-symbol counters, updated from the ingestion thread and the two workers.
 */
public class SymbolStats {

    private final AtomicLong ticksAppended = new AtomicLong(0);
    private final AtomicLong candlesticksWritten = new AtomicLong(0);
    private final AtomicLong meansWritten = new AtomicLong(0);
    private final AtomicLong failedRecomputations = new AtomicLong(0);

    public void tickAppended() {
        ticksAppended.incrementAndGet();
    }

    public void candlestickWritten() {
        candlesticksWritten.incrementAndGet();
    }

    public void meanWritten() {
        meansWritten.incrementAndGet();
    }

    public void recomputationFailed() {
        failedRecomputations.incrementAndGet();
    }

    public long getTicksAppended() {
        return ticksAppended.get();
    }

    public long getCandlesticksWritten() {
        return candlesticksWritten.get();
    }

    public long getMeansWritten() {
        return meansWritten.get();
    }

    public long getFailedRecomputations() {
        return failedRecomputations.get();
    }
}
