package com.openforge.ariste.agent.subagent;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * What a finished subagent hands back to its parent.
 *
 * Rendered as:
 * <pre>
 * === Subagent Task Complete ===
 * {
 *   "task" : "...",
 *   "agent_type" : "...",
 *   "model" : "...",
 *   "duration_ms" : 1234,
 *   "used_tools" : false,
 *   "result" : "..."
 * }
 * </pre>
 */
@JsonPropertyOrder({"task", "agentType", "model", "durationMs", "usedTools", "result"})
public record SubAgentReport(
        String  task,
        String  agentType,
        String  model,
        long    durationMs,
        boolean usedTools,
        String  result
) {

    public static final String BANNER = "=== Subagent Task Complete ===";

    public String render(ObjectMapper objectMapper) {
        try {
            return BANNER + "\n" + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render subagent report", e);
        }
    }
}
