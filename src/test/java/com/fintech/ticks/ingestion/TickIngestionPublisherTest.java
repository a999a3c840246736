package com.fintech.ticks.ingestion;

import com.fintech.ticks.config.TickProperties;
import com.fintech.ticks.domain.TickRecord;
import com.fintech.ticks.domain.Trade;
import com.fintech.ticks.storage.StorageLayout;
import com.fintech.ticks.symbol.SymbolRegistry;
import com.fintech.ticks.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TickIngestionPublisher} against a real registry on a temp directory.
 * {@code shutdown()} drains the ring buffer, so assertions after it see every append.
 */
@DisplayName("TickIngestionPublisher Tests")
class TickIngestionPublisherTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SymbolRegistry registry;
    private TickProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private TickIngestionPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = SymbolRegistry.open(List.of("AAPL", "BINANCE:BTCUSDT"), new StorageLayout(tempDir, "_"), clock);
        properties = new TickProperties();
        properties.getIngestion().setBufferSize(1024);
        meterRegistry = new SimpleMeterRegistry();
        publisher = new TickIngestionPublisher(registry, properties, meterRegistry);
        publisher.start();
    }

    @AfterEach
    void tearDown() {
        publisher.shutdown();
        registry.close();
    }

    @Test
    @DisplayName("Published trades land in their symbol's tick log")
    void testPublish() {
        publisher.publish(new Trade("AAPL", 172.5, T0.toEpochMilli()));
        publisher.publish(new Trade("BINANCE:BTCUSDT", 43125.0, T0.toEpochMilli()));
        publisher.publish(new Trade("AAPL", 173.5, T0.toEpochMilli() + 1));

        publisher.shutdown();

        assertThat(registry.require("AAPL").getTickLog().readAll())
            .extracting(TickRecord::price)
            .containsExactly(172.5, 173.5);
        assertThat(registry.require("BINANCE:BTCUSDT").getTickLog().readAll())
            .extracting(TickRecord::price)
            .containsExactly(43125.0);
        assertThat(publisher.getTicksIngested()).isEqualTo(3);
        assertThat(meterRegistry.timer("ticks.ingestion.append.time").count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Non-blocking publish accepts while there is capacity")
    void testTryPublish() {
        assertThat(publisher.tryPublish(new Trade("AAPL", 172.5, 0L))).isTrue();

        publisher.shutdown();

        assertThat(publisher.getRingBufferEventsDropped()).isZero();
        assertThat(registry.require("AAPL").getTickLog().readAll()).hasSize(1);
    }

    @Test
    @DisplayName("Trades for untracked symbols are dropped and counted")
    void testUnknownSymbol() {
        assertThat(publisher.ingest(new Trade("TSLA", 250.0, 0L))).isFalse();

        assertThat(publisher.getUnknownSymbolDrops()).isEqualTo(1);
        assertThat(meterRegistry.get("ticks.ingestion.unknown.symbol").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("An append failure is counted and does not stop ingestion")
    void testAppendFailure() throws IOException {
        registry.require("BINANCE:BTCUSDT").getTickLog().close();

        assertThat(publisher.ingest(new Trade("BINANCE:BTCUSDT", 43125.0, 0L))).isFalse();
        assertThat(publisher.ingest(new Trade("AAPL", 172.5, 0L))).isTrue();

        assertThat(publisher.getAppendFailures()).isEqualTo(1);
        assertThat(publisher.getTicksIngested()).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent producers never lose or interleave trades")
    void testConcurrentProducers() throws Exception {
        int producers = 4;
        int perProducer = 500;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int producer = p;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        publisher.publish(new Trade("AAPL", producer * 1_000 + i, i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        publisher.shutdown();

        assertThat(registry.require("AAPL").getTickLog().readAll()).hasSize(producers * perProducer);
        assertThat(registry.require("AAPL").getStats().getTicksAppended()).isEqualTo(producers * perProducer);
    }

    @ParameterizedTest
    @ValueSource(strings = {"BLOCKING", "SLEEPING", "YIELDING", "BUSY_SPIN", "unknown"})
    @DisplayName("Every wait strategy delivers")
    void testWaitStrategies(String strategy) {
        publisher.shutdown();
        properties.getIngestion().setWaitStrategy(strategy);
        publisher = new TickIngestionPublisher(registry, properties, new SimpleMeterRegistry());
        publisher.start();

        publisher.publish(new Trade("AAPL", 172.5, 0L));
        publisher.shutdown();

        assertThat(registry.require("AAPL").getTickLog().readAll()).hasSize(1);
    }
}
