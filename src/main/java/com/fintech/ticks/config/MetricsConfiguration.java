package com.fintech.ticks.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Metrics configuration: common tags and client-side percentiles for timers.
 *
 * <p>Append and window-compute timers are dominated by file I/O, so the SLO buckets
 * run from 100 µs to 1 s.
 */
@Configuration
public class MetricsConfiguration {

    // Timer SLO boundaries are expressed in nanoseconds
    static final double[] SLO_BUCKETS_NANOS = {
        Duration.of(100, ChronoUnit.MICROS).toNanos(),
        Duration.of(500, ChronoUnit.MICROS).toNanos(),
        Duration.ofMillis(1).toNanos(),
        Duration.ofMillis(5).toNanos(),
        Duration.ofMillis(10).toNanos(),
        Duration.ofMillis(50).toNanos(),
        Duration.ofMillis(100).toNanos(),
        Duration.ofMillis(500).toNanos(),
        Duration.ofSeconds(1).toNanos()
    };

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "tick-window-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() == Meter.Type.TIMER) {
                        return DistributionStatisticConfig.builder()
                            .percentiles(0.5, 0.95, 0.99)
                            .percentilePrecision(2)
                            .serviceLevelObjectives(SLO_BUCKETS_NANOS)
                            .percentilesHistogram(true)
                            .expiry(Duration.ofMinutes(2))
                            .bufferLength(3)
                            .build()
                            .merge(config);
                    }
                    return config;
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
