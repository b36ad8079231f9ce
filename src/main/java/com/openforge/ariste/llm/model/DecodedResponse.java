package com.openforge.ariste.llm.model;

import java.util.List;

/**
 * The aggregate of one chat call: the concatenated assistant text plus any
 * tool calls in request order. toolCalls is null when none were requested.
 */
public record DecodedResponse(
        String content,
        List<ToolCall> toolCalls
) {

    public DecodedResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls);
    }

    public static DecodedResponse text(String content) {
        return new DecodedResponse(content, null);
    }

    public static DecodedResponse toolCalls(List<ToolCall> toolCalls) {
        return new DecodedResponse("", toolCalls);
    }

    public boolean hasToolCalls() {
        return toolCalls != null;
    }
}
