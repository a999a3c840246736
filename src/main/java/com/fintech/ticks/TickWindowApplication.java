package com.fintech.ticks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Per-symbol tick logging with one-minute candlesticks and a fifteen-minute trailing mean.
 *
 * <p>Startup order: the symbol registry opens and initializes every file, the worker pool
 * starts two window workers per symbol, then the minute dispatcher begins its heartbeat.
 * Trades arrive through the feed client (when enabled) and the ingestion ring buffer.
 */
@SpringBootApplication
@EnableScheduling
public class TickWindowApplication {

    public static void main(String[] args) {
        SpringApplication.run(TickWindowApplication.class, args);
    }
}
