package com.fintech.ticks.api;

import com.fintech.ticks.symbol.SymbolHandle;
import com.fintech.ticks.symbol.SymbolStats;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * A tracked symbol with its file locations and counters since startup.
 */
@Schema(description = "Tracked symbol with per-symbol counters")
public record SymbolStatusResponse(
    @Schema(example = "BINANCE:BTCUSDT") String symbol,
    @Schema(example = "data/rolling/BINANCE_BTCUSDT.csv") String tickLog,
    long ticksAppended,
    long candlesticksWritten,
    long meansWritten,
    long failedRecomputations
) {

    public static SymbolStatusResponse from(SymbolHandle handle) {
        SymbolStats stats = handle.getStats();
        return new SymbolStatusResponse(
            handle.getSymbol(),
            handle.getTickLog().getPath().toString(),
            stats.getTicksAppended(),
            stats.getCandlesticksWritten(),
            stats.getMeansWritten(),
            stats.getFailedRecomputations()
        );
    }
}
