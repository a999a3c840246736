package com.fintech.ticks.api;

import com.fintech.ticks.domain.CandlestickSummary;
import com.fintech.ticks.domain.MeanSummary;
import com.fintech.ticks.service.WindowQueryService;
import com.fintech.ticks.symbol.SymbolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Read-only REST view over the tracked symbols and their current windows.
 */
@RestController
@RequestMapping("/api/v1/symbols")
@Tag(name = "Symbols", description = "Tracked symbols and on-demand window summaries")
public class SymbolController {

    private static final Logger log = LoggerFactory.getLogger(SymbolController.class);

    private final SymbolRegistry registry;
    private final WindowQueryService queryService;
    private final MeterRegistry meterRegistry;

    public SymbolController(SymbolRegistry registry, WindowQueryService queryService, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.queryService = queryService;
        this.meterRegistry = meterRegistry;
    }

    @Operation(summary = "List tracked symbols",
               description = "Returns every tracked symbol, in configuration order, with counters since startup.")
    @ApiResponse(responseCode = "200", description = "Tracked symbols")
    @GetMapping
    public List<SymbolStatusResponse> listSymbols() {
        return registry.handles().stream()
            .map(SymbolStatusResponse::from)
            .toList();
    }

    /**
     * GET /api/v1/symbols/{symbol}/candlestick
     *
     * OHLC over the minute that ended at the current minute boundary. Not written to the sink.
     */
    @Operation(
        summary = "Candlestick for the last closed minute",
        description = """
            Computes the OHLC candlestick over the minute that ended at the current minute
            boundary, on demand. The result is not written to the candlestick file.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Candlestick computed",
            content = @Content(schema = @Schema(implementation = CandlestickSummary.class))),
        @ApiResponse(responseCode = "204", description = "No ticks in the window"),
        @ApiResponse(responseCode = "404", description = "Symbol is not tracked",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "500", description = "Tick log could not be read",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{symbol}/candlestick")
    public ResponseEntity<CandlestickSummary> candlestick(
            @Parameter(description = "Tracked symbol", example = "AAPL", required = true)
            @PathVariable String symbol) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return toResponse(queryService.currentCandlestick(symbol));
        } finally {
            sample.stop(meterRegistry.timer("ticks.api.request.time", "endpoint", "candlestick"));
        }
    }

    /**
     * GET /api/v1/symbols/{symbol}/mean
     *
     * Mean price over the fifteen minutes before the current minute boundary.
     */
    @Operation(
        summary = "Trailing fifteen-minute mean",
        description = """
            Computes the mean price over the fifteen minutes that ended at the current
            minute boundary, on demand. The result is not written to the mean file.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Mean computed",
            content = @Content(schema = @Schema(implementation = MeanSummary.class))),
        @ApiResponse(responseCode = "204", description = "No ticks in the window"),
        @ApiResponse(responseCode = "404", description = "Symbol is not tracked",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "500", description = "Tick log could not be read",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{symbol}/mean")
    public ResponseEntity<MeanSummary> mean(
            @Parameter(description = "Tracked symbol", example = "AAPL", required = true)
            @PathVariable String symbol) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return toResponse(queryService.currentMean(symbol));
        } finally {
            sample.stop(meterRegistry.timer("ticks.api.request.time", "endpoint", "mean"));
        }
    }

    private <T> ResponseEntity<T> toResponse(Optional<T> summary) {
        if (summary.isEmpty()) {
            log.debug("Empty window, returning 204");
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(summary.get());
    }
}
