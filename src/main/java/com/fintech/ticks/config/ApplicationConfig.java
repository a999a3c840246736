package com.fintech.ticks.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.ticks.aggregation.WindowAggregator;
import com.fintech.ticks.feed.FeedMessageDecoder;
import com.fintech.ticks.storage.StorageLayout;
import com.fintech.ticks.symbol.SymbolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StorageLayout storageLayout(TickProperties properties) {
        TickProperties.Storage storage = properties.getStorage();
        return new StorageLayout(Path.of(storage.getBaseDir()), storage.getFiller());
    }

    /**
     * Opens and initializes every symbol's storage. A failure here is fatal to startup.
     */
    @Bean(destroyMethod = "close")
    public SymbolRegistry symbolRegistry(TickProperties properties, StorageLayout storageLayout, Clock clock) {
        return SymbolRegistry.open(properties.getSymbols(), storageLayout, clock);
    }

    @Bean
    public WindowAggregator windowAggregator(Clock clock) {
        return new WindowAggregator(clock);
    }

    @Bean
    public FeedMessageDecoder feedMessageDecoder(ObjectMapper objectMapper) {
        return new FeedMessageDecoder(objectMapper);
    }
}
