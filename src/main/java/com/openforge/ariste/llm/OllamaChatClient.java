package com.openforge.ariste.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.ariste.config.AgentProperties;
import com.openforge.ariste.llm.model.ChatRequest;
import com.openforge.ariste.llm.model.DecodedResponse;
import com.openforge.ariste.llm.model.Message;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Stateless HTTP client for an Ollama-style /api/chat endpoint.
 *
 * One call = one POST. The body is read as a raw byte stream and handed to the
 * {@link StreamDecoder}, which fires the listener callbacks while it reads and
 * returns the aggregated response when the stream ends (or signals done).
 *
 * Both streaming and non-streaming modes go through the same decoder: a
 * non-streaming body is simply a single JSON object with done=true.
 *
 * The call is intentionally synchronous; the owning agent loop waits for the
 * full response before deciding what to do next.
 */
@Slf4j
public class OllamaChatClient implements ChatClient {

    private static final int ERROR_SNIPPET_LIMIT = 2048;

    private final HttpClient      httpClient;
    private final ObjectMapper    objectMapper;
    private final AgentProperties properties;
    private final ChatOptions     options;
    private final Retry           retry;
    private final StreamDecoder   decoder;

    public OllamaChatClient(HttpClient httpClient,
                            ObjectMapper objectMapper,
                            AgentProperties properties,
                            ChatOptions options,
                            Retry retry) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.properties   = properties;
        this.options      = options;
        this.retry        = retry;
        this.decoder      = new StreamDecoder(objectMapper, properties.decodingMode(), properties.provider());
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public DecodedResponse send(String model, List<Message> messages, StreamListener listener) {
        String effectiveModel = model == null || model.isBlank() ? options.model() : model;

        ChatRequest request = ChatRequest.builder()
                .model(effectiveModel)
                .messages(messages)
                .stream(options.stream())
                .think(options.think())
                .tools(options.hasTools() ? options.tools() : null)
                .build();

        String requestBody = serialize(request);
        log.debug("[ChatClient:{}] → POST {} model={} messages={} tools={} body-length={}",
                properties.provider(), properties.chatUrl(), effectiveModel,
                messages.size(), options.tools().size(), requestBody.length());

        HttpResponse<InputStream> response = open(buildHttpRequest(requestBody));

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ChatException("Provider [%s] returned HTTP %d: %s"
                    .formatted(properties.provider(), status, readSnippet(response.body())));
        }

        StreamListener effectiveListener = options.verbose() && listener != null
                ? listener : StreamListener.NOOP;
        try (InputStream body = response.body()) {
            DecodedResponse decoded = decoder.decode(body, effectiveListener);
            log.debug("[ChatClient:{}] ← content-length={} tool-calls={}", properties.provider(),
                    decoded.content().length(),
                    decoded.hasToolCalls() ? decoded.toolCalls().size() : 0);
            return decoded;
        } catch (IOException e) {
            throw new ChatException("Stream from provider [%s] failed mid-response"
                    .formatted(properties.provider()), e);
        }
    }

    @Override
    public ChatOptions options() {
        return options;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(properties.chatUrl()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/x-ndjson, application/json")
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
    }

    /** Connection phase only; retried on IOException by the "chatTransport" Retry. */
    private HttpResponse<InputStream> open(HttpRequest request) {
        try {
            return retry.executeCallable(
                    () -> httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatException("Interrupted while calling provider [%s]"
                    .formatted(properties.provider()), e);
        } catch (Exception e) {
            throw new ChatException("Network error calling provider [%s] at %s: %s"
                    .formatted(properties.provider(), properties.chatUrl(), e.getMessage()), e);
        }
    }

    private String serialize(ChatRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ChatException("Failed to serialize chat request", e);
        }
    }

    private static String readSnippet(InputStream body) {
        if (body == null) return "";
        try (InputStream in = body) {
            byte[] bytes = in.readNBytes(ERROR_SNIPPET_LIMIT);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "(unreadable body: " + e.getMessage() + ")";
        }
    }
}
