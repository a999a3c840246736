package com.fintech.ticks.scheduling;

import com.fintech.ticks.symbol.SignalChannelClosedException;
import com.fintech.ticks.symbol.SymbolHandle;
import com.fintech.ticks.symbol.SymbolRegistry;
import com.fintech.ticks.util.TimeWindows;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single heartbeat. Once per period it floors the current time to the minute and
 * sends that boundary into both signal channels of every symbol.
 *
 * <p>Both channels receive every boundary: the mean worker looks back fifteen minutes
 * from each one, so the mean is a sliding window recomputed every minute.
 */
@Component
@ConditionalOnProperty(name = "ticks.dispatcher.enabled", havingValue = "true", matchIfMissing = true)
public class MinuteDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MinuteDispatcher.class);

    public enum State {
        IDLE,
        RUNNING
    }

    private final SymbolRegistry registry;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicLong broadcasts = new AtomicLong(0);
    private final AtomicLong failedSends = new AtomicLong(0);

    public MinuteDispatcher(SymbolRegistry registry, Clock clock, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.clock = clock;

        meterRegistry.gauge("ticks.dispatcher.broadcasts", broadcasts);
        meterRegistry.gauge("ticks.dispatcher.failed.sends", failedSends);
    }

    @Scheduled(
        fixedRateString = "${ticks.dispatcher.period-ms:60000}",
        initialDelayString = "${ticks.dispatcher.initial-delay-ms:60000}")
    public void onTick() {
        dispatch(clock.millis());
    }

    /**
     * Broadcasts {@code floorToMinute(now)} to every handle's two channels.
     * A closed channel only affects its own symbol; the loop carries on with the rest.
     *
     * @return number of symbols that received both signals
     */
    public int dispatch(long now) {
        if (state.compareAndSet(State.IDLE, State.RUNNING)) {
            log.info("Minute dispatcher running: symbols={}", registry.size());
        }

        long boundary = TimeWindows.floorToMinute(now);
        int delivered = 0;
        for (SymbolHandle handle : registry.handles()) {
            try {
                handle.getMinuteSignals().send(boundary);
                handle.getFifteenSignals().send(boundary);
                delivered++;
            } catch (SignalChannelClosedException e) {
                failedSends.incrementAndGet();
                log.error("Cannot signal symbol {}: {}", handle.getSymbol(), e.getMessage());
            }
        }
        broadcasts.incrementAndGet();

        log.debug("Dispatched minute boundary {} to {}/{} symbols",
                 Instant.ofEpochMilli(boundary), delivered, registry.size());
        return delivered;
    }

    public State getState() {
        return state.get();
    }

    public long getBroadcasts() {
        return broadcasts.get();
    }

    public long getFailedSends() {
        return failedSends.get();
    }
}
