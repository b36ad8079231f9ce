package com.openforge.ariste.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.AgentTool;
import com.openforge.ariste.tool.ToolArguments;
import com.openforge.ariste.tool.ToolExecutionException;
import com.openforge.ariste.tool.ToolSchemas;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fetches a URL and returns "Status: N\nURL: U\n\nbody".
 * Uses the process-wide HttpClient; the timeout is per request.
 */
public class WebFetchTool implements AgentTool {

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD");
    private static final long DEFAULT_TIMEOUT_SECONDS = 30;

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "web_fetch",
            "Fetch content from a URL. Supports various HTTP methods, custom headers, and timeouts. "
                    + "Returns the response body as text. Useful for retrieving web pages, API responses, or online resources.",
            """
            {
              "type": "object",
              "properties": {
                "url": {
                  "type": "string",
                  "description": "The URL to fetch content from (e.g., 'https://example.com')"
                },
                "timeout": {
                  "type": "integer",
                  "description": "Request timeout in seconds. Default is 30 seconds."
                },
                "method": {
                  "type": "string",
                  "description": "HTTP method to use. Default is GET."
                },
                "headers": {
                  "type": "object",
                  "description": "Optional HTTP headers to include in the request."
                },
                "body": {
                  "type": "string",
                  "description": "Optional request body for POST/PUT requests."
                }
              },
              "required": ["url"]
            }
            """);

    private final HttpClient httpClient;

    public WebFetchTool(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        String url     = ToolArguments.requireString(arguments, "url");
        long   timeout = ToolArguments.optionalLong(arguments, "timeout", DEFAULT_TIMEOUT_SECONDS);
        String method  = ToolArguments.optionalString(arguments, "method", "GET").toUpperCase(Locale.ROOT);
        String body    = ToolArguments.optionalString(arguments, "body", null);

        if (!METHODS.contains(method)) {
            throw new ToolExecutionException("Unsupported HTTP method: " + method);
        }

        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(Math.max(1, timeout)))
                    .method(method, body == null
                            ? HttpRequest.BodyPublishers.noBody()
                            : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new ToolExecutionException("Invalid URL '%s': %s".formatted(url, e.getMessage()), e);
        }

        JsonNode headers = arguments.get("headers");
        if (headers != null && headers.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = headers.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> header = fields.next();
                if (header.getValue().isTextual()) {
                    try {
                        builder.header(header.getKey(), header.getValue().asText());
                    } catch (IllegalArgumentException e) {
                        throw new ToolExecutionException("Invalid header '%s': %s"
                                .formatted(header.getKey(), e.getMessage()), e);
                    }
                }
            }
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ToolExecutionException("Request failed: " + ReadTool.describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Request interrupted", e);
        }

        return "Status: %d\nURL: %s\n\n%s".formatted(response.statusCode(), response.uri(), response.body());
    }
}
