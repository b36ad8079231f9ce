package com.openforge.ariste.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.ariste.config.AgentProperties;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;

/**
 * Builds {@link OllamaChatClient}s that share the process-wide HttpClient,
 * ObjectMapper, configuration and transport Retry.
 */
@Component
@RequiredArgsConstructor
public class OllamaChatClientFactory implements ChatClientFactory {

    private final HttpClient      httpClient;
    private final ObjectMapper    objectMapper;
    private final AgentProperties properties;
    private final Retry           chatTransportRetry;

    @Override
    public ChatClient create(ChatOptions options) {
        return new OllamaChatClient(httpClient, objectMapper, properties, options, chatTransportRetry);
    }
}
