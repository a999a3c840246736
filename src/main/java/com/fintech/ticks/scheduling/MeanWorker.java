package com.fintech.ticks.scheduling;

import com.fintech.ticks.aggregation.WindowAggregator;
import com.fintech.ticks.domain.MeanSummary;
import com.fintech.ticks.domain.SummaryWindow;
import com.fintech.ticks.domain.TickRecord;
import com.fintech.ticks.symbol.SymbolHandle;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Optional;

/** Fifteen-minute trailing mean loop. */
public class MeanWorker extends WindowWorker<MeanSummary> {

    public MeanWorker(SymbolHandle handle, WindowAggregator aggregator, MeterRegistry meterRegistry) {
        super(handle, SummaryWindow.MEAN, aggregator, meterRegistry);
    }

    @Override
    protected Optional<MeanSummary> aggregate(List<TickRecord> records) {
        return aggregator.aggregateMean(records);
    }

    @Override
    protected void write(MeanSummary summary) {
        handle.getMeanSink().write(summary);
        handle.getStats().meanWritten();
    }
}
