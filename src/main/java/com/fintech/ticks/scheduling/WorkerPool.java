package com.fintech.ticks.scheduling;

import com.fintech.ticks.aggregation.WindowAggregator;
import com.fintech.ticks.storage.StorageLayout;
import com.fintech.ticks.symbol.SymbolHandle;
import com.fintech.ticks.symbol.SymbolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs two window workers per tracked symbol, each on its own named daemon thread.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final long JOIN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(5);

    private final SymbolRegistry registry;
    private final WindowAggregator aggregator;
    private final MeterRegistry meterRegistry;

    private final List<WindowWorker<?>> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();

    public WorkerPool(SymbolRegistry registry, WindowAggregator aggregator, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public synchronized void start() {
        if (!threads.isEmpty()) {
            return;
        }
        for (SymbolHandle handle : registry.handles()) {
            startWorker(new CandlestickWorker(handle, aggregator, meterRegistry));
            startWorker(new MeanWorker(handle, aggregator, meterRegistry));
        }
        log.info("Worker pool started: symbols={}, threads={}", registry.size(), threads.size());
    }

    /**
     * Closes every signal channel so workers drain and exit, then interrupts any
     * worker still running after the join timeout.
     */
    @PreDestroy
    public synchronized void shutdown() {
        log.info("Shutting down worker pool...");
        registry.handles().forEach(SymbolHandle::closeChannels);

        for (Thread thread : threads) {
            try {
                thread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        for (Thread thread : threads) {
            if (thread.isAlive()) {
                log.warn("Worker did not stop in time, interrupting: {}", thread.getName());
                thread.interrupt();
            }
        }
        log.info("Worker pool shutdown complete");
    }

    public synchronized List<WindowWorker<?>> getWorkers() {
        return Collections.unmodifiableList(new ArrayList<>(workers));
    }

    public synchronized long getAliveThreads() {
        return threads.stream().filter(Thread::isAlive).count();
    }

    private void startWorker(WindowWorker<?> worker) {
        String name = "window-worker-" + worker.getWindow().tag() + "-"
            + StorageLayout.sanitize(worker.getHandle().getSymbol(), "_");
        Thread thread = new Thread(worker, name);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
            log.error("Window worker {} died: {}", t.getName(), e.getMessage(), e));
        thread.start();
        workers.add(worker);
        threads.add(thread);
    }
}
