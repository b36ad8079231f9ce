package com.openforge.ariste.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One newline-delimited JSON object from a chat response body.
 *
 * Wire format:
 *   {"model":"qwen3","created_at":"...","message":{"role":"assistant","content":"Hel"},"done":false}
 *   {"model":"qwen3","message":{"role":"assistant","thinking":"Let me see"},"done":false}
 *   {"model":"qwen3","message":{"role":"assistant","content":"","tool_calls":[...]},"done":false}
 *   {"model":"qwen3","message":{"role":"assistant","content":""},"done":true,"done_reason":"stop"}
 *
 * A non-streaming response is a single object of the same shape with done=true.
 */
public record StreamingChunk(
        String model,
        String createdAt,
        ChunkMessage message,
        Boolean done,
        String doneReason
) {

    public boolean isDone() {
        return Boolean.TRUE.equals(done);
    }

    /**
     * Sparse message fragment. Tool calls are kept raw so that ids and
     * string-encoded arguments can be normalized by the decoder.
     */
    public record ChunkMessage(
            String role,
            String content,
            String thinking,
            List<JsonNode> toolCalls
    ) {}
}
