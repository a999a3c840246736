package com.fintech.ticks.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Externalized configuration for the tick window service.
 * Maps to 'ticks.*' properties in application.yml. Fixed for the process lifetime.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ticks")
@Validated
public class TickProperties {

    @NotEmpty
    private List<String> symbols = List.of("AAPL", "AMZN", "MSFT", "BINANCE:BTCUSDT");
    @Valid
    private Storage storage = new Storage();
    @Valid
    private Dispatcher dispatcher = new Dispatcher();
    @Valid
    private Ingestion ingestion = new Ingestion();
    @Valid
    private Feed feed = new Feed();

    @Data
    public static class Storage {
        @NotBlank
        private String baseDir = "data";
        @NotBlank
        private String filler = "_";
    }

    @Data
    public static class Dispatcher {
        private boolean enabled = true;
        @Min(1)
        private long periodMs = 60_000L;
        private long initialDelayMs = 60_000L;
    }

    @Data
    public static class Ingestion {
        // Must be a power of two
        @Min(1)
        private int bufferSize = 8192;
        private String waitStrategy = "BLOCKING";
    }

    @Data
    public static class Feed {
        private boolean enabled = false;
        @NotBlank
        private String url = "wss://ws.finnhub.io";
        private String token;
    }
}
