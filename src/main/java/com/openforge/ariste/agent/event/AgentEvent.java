package com.openforge.ariste.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The single event envelope emitted by agents and broadcast over WebSocket.
 *
 * Fields:
 *   conversationId — the conversation this event belongs to
 *   type           — discriminator; tells the client how to render the event
 *   content        — free-form text (fragment for CONTENT, line for REASONING,
 *                    answer for FINAL_ANSWER, message for ERROR/TOOL_ERROR)
 *   payload        — structured object for rich events, null otherwise
 *   iteration      — which model-call iteration produced this event
 *   timestamp      — epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        String    conversationId,
        EventType type,
        String    content,
        Object    payload,
        int       iteration,
        long      timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static AgentEvent turnStart(String conversationId, String prompt) {
        return new AgentEvent(conversationId, EventType.TURN_START, prompt, null, 0, now());
    }

    public static AgentEvent iterationStart(String conversationId, int iteration) {
        return new AgentEvent(conversationId, EventType.ITERATION_START, null, null, iteration, now());
    }

    public static AgentEvent reasoning(String conversationId, String line, int iteration) {
        return new AgentEvent(conversationId, EventType.REASONING, line, null, iteration, now());
    }

    public static AgentEvent content(String conversationId, String fragment, int iteration) {
        return new AgentEvent(conversationId, EventType.CONTENT, fragment, null, iteration, now());
    }

    public static AgentEvent toolCall(String conversationId, String callId, String toolName,
                                      JsonNode arguments, int iteration) {
        return new AgentEvent(conversationId, EventType.TOOL_CALL, null,
                new ToolCallPayload(callId, toolName, arguments), iteration, now());
    }

    public static AgentEvent toolResult(String conversationId, String toolName, String result, int iteration) {
        return new AgentEvent(conversationId, EventType.TOOL_RESULT, result,
                new ToolResultPayload(toolName, result), iteration, now());
    }

    public static AgentEvent toolError(String conversationId, String toolName, String error, int iteration) {
        return new AgentEvent(conversationId, EventType.TOOL_ERROR, error,
                new ToolResultPayload(toolName, error), iteration, now());
    }

    public static AgentEvent subAgentStart(String conversationId, SubAgentPayload payload) {
        return new AgentEvent(conversationId, EventType.SUBAGENT_START, payload.description(), payload, 0, now());
    }

    public static AgentEvent subAgentComplete(String conversationId, SubAgentPayload payload, String summary) {
        return new AgentEvent(conversationId, EventType.SUBAGENT_COMPLETE, summary, payload, 0, now());
    }

    public static AgentEvent finalAnswer(String conversationId, String answer, int iteration) {
        return new AgentEvent(conversationId, EventType.FINAL_ANSWER, answer, null, iteration, now());
    }

    public static AgentEvent error(String conversationId, String message, int iteration) {
        return new AgentEvent(conversationId, EventType.ERROR, message, null, iteration, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    // ── Nested payload types ─────────────────────────────────────────────────

    public record ToolCallPayload(String callId, String toolName, JsonNode arguments) {}

    public record ToolResultPayload(String toolName, String output) {}

    /** status is the SubAgentStatus name; durationMs is null until the subagent ends. */
    public record SubAgentPayload(long subagentId, String role, String description,
                                  String status, Long durationMs) {}
}
