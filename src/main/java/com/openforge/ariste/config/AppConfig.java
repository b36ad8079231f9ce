package com.openforge.ariste.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - Subagent executor  → bounded pool that runs fanned-out subagent tasks
 *  - Java HttpClient    → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, tolerant deserialization
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AppConfig {

    /**
     * Each subagent task owns one pool thread for its whole loop, including
     * blocking tool executions, so siblings keep progressing independently.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService subagentExecutor(AgentProperties properties) {
        return Executors.newFixedThreadPool(
                Math.max(1, properties.subagentPoolSize()),
                namedDaemonThreads("subagent-"));
    }

    /**
     * Single, shared HttpClient instance.
     * HTTP/1.1 keeps the newline-delimited stream on one plain connection;
     * per-request timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for the chat wire format:
     *  - snake_case property names (tool_calls, tool_call_id, done_reason …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (the endpoint adds fields freely)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
