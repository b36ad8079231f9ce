package com.openforge.ariste.config;

import com.openforge.ariste.llm.ChatOptions;
import com.openforge.ariste.llm.DecodingMode;
import com.openforge.ariste.llm.model.ToolDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Externalised runtime configuration, bound once at startup and injected
 * wherever a chat client is built.
 *
 * Reads from application.yml under the "agent" prefix:
 *
 * agent:
 *   provider: ollama
 *   base-url: http://127.0.0.1:11434
 *   chat-path: /api/chat
 *   model: qwen3
 *   stream: true
 *   think: false
 *   verbose: true
 *   timeout-seconds: 300
 *   decoding-mode: LENIENT
 *   subagent-pool-size: 8
 *   working-directory: .
 */
@ConfigurationProperties(prefix = "agent")
public record AgentProperties(
        @DefaultValue("ollama") String provider,
        @DefaultValue("http://127.0.0.1:11434") String baseUrl,
        @DefaultValue("/api/chat") String chatPath,
        @DefaultValue("qwen3") String model,
        @DefaultValue("true") boolean stream,
        @DefaultValue("false") boolean think,
        @DefaultValue("true") boolean verbose,
        @DefaultValue("300") int timeoutSeconds,
        @DefaultValue("LENIENT") DecodingMode decodingMode,
        @DefaultValue("8") int subagentPoolSize,
        @DefaultValue(".") String workingDirectory
) {

    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:11434";
    public static final String DEFAULT_MODEL    = "qwen3";

    /** Full endpoint URL, e.g. http://127.0.0.1:11434/api/chat. */
    public String chatUrl() {
        String base = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + (chatPath == null ? "/api/chat" : chatPath);
    }

    public String modelOrDefault() {
        return model == null || model.isBlank() ? DEFAULT_MODEL : model;
    }

    /** Chat options for the top-level agent, carrying the given tool definitions. */
    public ChatOptions chatOptions(List<ToolDefinition> tools) {
        return ChatOptions.builder()
                .model(modelOrDefault())
                .stream(stream)
                .think(think)
                .verbose(verbose)
                .tools(tools)
                .build();
    }
}
