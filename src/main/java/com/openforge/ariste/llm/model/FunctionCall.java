package com.openforge.ariste.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The "function" sub-object inside a {@link ToolCall}.
 *
 * Unlike OpenAI-style endpoints, the chat endpoint sends "arguments" as a JSON
 * object rather than an encoded string; the decoder normalizes both shapes to
 * a JsonNode.
 */
public record FunctionCall(
        String name,
        JsonNode arguments
) {}
