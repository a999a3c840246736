package com.fintech.ticks.service;

import com.fintech.ticks.aggregation.WindowAggregator;
import com.fintech.ticks.domain.CandlestickSummary;
import com.fintech.ticks.domain.MeanSummary;
import com.fintech.ticks.domain.SummaryWindow;
import com.fintech.ticks.domain.TickRecord;
import com.fintech.ticks.storage.TickLogException;
import com.fintech.ticks.symbol.SymbolHandle;
import com.fintech.ticks.symbol.SymbolRegistry;
import com.fintech.ticks.util.TimeWindows;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * On-demand, read-only summaries over the tick logs.
 *
 * <p>Uses the same look-back rule as the window workers: the candlestick covers the
 * minute that ended at the current minute boundary, the mean the fifteen minutes before
 * it. Nothing is written to the summary sinks. Log scans run inside the {@code tick-log}
 * circuit breaker so a failing disk does not pile up request threads.
 */
@Service
public class WindowQueryService {

    private static final Logger log = LoggerFactory.getLogger(WindowQueryService.class);

    private final SymbolRegistry registry;
    private final WindowAggregator aggregator;
    private final Clock clock;
    private final CircuitBreaker circuitBreaker;

    private final AtomicLong serviceErrors = new AtomicLong(0);

    public WindowQueryService(
            SymbolRegistry registry,
            WindowAggregator aggregator,
            Clock clock,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.clock = clock;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("tick-log");

        meterRegistry.gauge("ticks.query.errors", serviceErrors);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Tick log circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * @throws com.fintech.ticks.symbol.UnknownSymbolException if the symbol is not tracked
     * @throws ServiceException if the tick log cannot be read
     */
    public Optional<CandlestickSummary> currentCandlestick(String symbol) {
        List<TickRecord> records = scan(symbol, SummaryWindow.CANDLESTICK);
        return aggregator.aggregateCandlestick(records);
    }

    /**
     * @throws com.fintech.ticks.symbol.UnknownSymbolException if the symbol is not tracked
     * @throws ServiceException if the tick log cannot be read
     */
    public Optional<MeanSummary> currentMean(String symbol) {
        List<TickRecord> records = scan(symbol, SummaryWindow.MEAN);
        return aggregator.aggregateMean(records);
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    private List<TickRecord> scan(String symbol, SummaryWindow window) {
        SymbolHandle handle = registry.require(symbol);
        long boundary = TimeWindows.floorToMinute(clock.millis());

        try {
            return circuitBreaker.executeSupplier(
                () -> handle.getTickLog().scanWindowEndingAt(boundary, window));
        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker OPEN - rejecting {} query for symbol={}", window.tag(), symbol);
            throw new ServiceException("Tick log circuit breaker is open", e);
        } catch (TickLogException e) {
            serviceErrors.incrementAndGet();
            log.error("Tick log read failed: symbol={}, window={}", symbol, window.tag(), e);
            throw new ServiceException("Failed to read tick log for " + symbol, e);
        }
    }

    /**
     * Service layer exception (wraps storage failures).
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
