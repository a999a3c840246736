package com.fintech.ticks.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Swagger UI: http://localhost:8080/swagger-ui/index.html
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tickWindowOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tick Window Service API")
                        .description("""
                                Read-only view over the per-symbol tick logs.

                                **Summaries:**
                                - One-minute OHLC candlestick over the minute that just closed
                                - Fifteen-minute trailing mean price, recomputed every minute
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
