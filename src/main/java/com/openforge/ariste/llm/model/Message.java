package com.openforge.ariste.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A single entry in the conversation history.
 *
 * role variants:
 *   SYSTEM    — role-specific instructions, always first when present
 *   USER      — human turn, or the task statement given to a subagent
 *   ASSISTANT — model reply; carries tool_calls while the loop is still resolving them
 *   TOOL      — result of one tool call, linked back through tool_call_id
 *
 * Reasoning text never becomes part of a Message.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        Role role,

        /** Text content. Empty (never null) for assistant messages that only request tools. */
        String content,

        /** Present only on assistant messages that requested tools, in request order. */
        List<ToolCall> toolCalls,

        /** Present only on tool messages; equals the id of the originating ToolCall. */
        String toolCallId
) {

    public Message {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls);
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message system(String content) {
        return Message.builder().role(Role.SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.USER).content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role(Role.ASSISTANT).content(content).build();
    }

    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder().role(Role.ASSISTANT).content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role(Role.TOOL).toolCallId(toolCallId).content(result).build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean is(Role candidate) {
        return role == candidate;
    }
}
