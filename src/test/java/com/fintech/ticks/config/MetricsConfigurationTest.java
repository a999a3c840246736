package com.fintech.ticks.config;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.CountAtBucket;
import io.micrometer.core.instrument.distribution.HistogramSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MetricsConfiguration Tests")
class MetricsConfigurationTest {

    @Test
    @DisplayName("Timer SLO buckets span 100 microseconds to 1 second")
    void testTimerSloBuckets() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new MetricsConfiguration().metricsCommonTags().customize(registry);

        Timer timer = registry.timer("ticks.ingestion.append.time");
        timer.record(Duration.ofMillis(3));
        HistogramSnapshot snapshot = timer.takeSnapshot();

        assertThat(Arrays.stream(snapshot.histogramCounts()).map(bucket -> bucket.bucket(TimeUnit.MILLISECONDS)))
            .contains(0.1, 0.5, 1.0, 5.0, 10.0, 50.0, 100.0, 500.0, 1000.0);
        CountAtBucket fiveMillis = Arrays.stream(snapshot.histogramCounts())
            .filter(bucket -> bucket.bucket(TimeUnit.MILLISECONDS) == 5.0)
            .findFirst()
            .orElseThrow();
        assertThat(fiveMillis.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Meters carry the application tag")
    void testCommonTags() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new MetricsConfiguration().metricsCommonTags().customize(registry);

        Timer timer = registry.timer("ticks.window.compute.time");

        assertThat(timer.getId().getTag("application")).isEqualTo("tick-window-service");
    }
}
