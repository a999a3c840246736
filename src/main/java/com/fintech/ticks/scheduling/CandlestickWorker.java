package com.fintech.ticks.scheduling;

import com.fintech.ticks.aggregation.WindowAggregator;
import com.fintech.ticks.domain.CandlestickSummary;
import com.fintech.ticks.domain.SummaryWindow;
import com.fintech.ticks.domain.TickRecord;
import com.fintech.ticks.symbol.SymbolHandle;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Optional;

/** One-minute candlestick loop. */
public class CandlestickWorker extends WindowWorker<CandlestickSummary> {

    public CandlestickWorker(SymbolHandle handle, WindowAggregator aggregator, MeterRegistry meterRegistry) {
        super(handle, SummaryWindow.CANDLESTICK, aggregator, meterRegistry);
    }

    @Override
    protected Optional<CandlestickSummary> aggregate(List<TickRecord> records) {
        return aggregator.aggregateCandlestick(records);
    }

    @Override
    protected void write(CandlestickSummary summary) {
        handle.getCandlestickSink().write(summary);
        handle.getStats().candlestickWritten();
    }
}
