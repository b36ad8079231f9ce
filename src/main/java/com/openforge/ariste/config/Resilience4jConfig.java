package com.openforge.ariste.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named instance, "chatTransport", guards the connection phase of every
 * chat call. It never wraps body consumption: once the stream has started,
 * observers have already seen fragments and a replay would duplicate them.
 */
@Configuration
public class Resilience4jConfig {

    public static final String CHAT_TRANSPORT = "chatTransport";

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                // connection refused / reset before any byte of the body
                .retryExceptions(IOException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(CHAT_TRANSPORT);
        return registry;
    }

    @Bean
    public Retry chatTransportRetry(RetryRegistry registry) {
        return registry.retry(CHAT_TRANSPORT);
    }
}
