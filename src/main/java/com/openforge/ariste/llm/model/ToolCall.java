package com.openforge.ariste.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single tool invocation request produced by the model.
 *
 * Wire format (inside message.tool_calls):
 *   {"id":"call_0","type":"function","function":{"name":"read","arguments":{"file_path":"/tmp/a"}}}
 *
 * The id is unique within one decoded response and is echoed verbatim into the
 * tool message that carries the result.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCall function
) {

    public static ToolCall of(String id, String name, JsonNode arguments) {
        return new ToolCall(id, "function", new FunctionCall(name, arguments));
    }

    /** Convenience: the requested tool name, never null. */
    public String name() {
        return function == null || function.name() == null ? "" : function.name();
    }

    /** Convenience: the parsed arguments object, possibly null. */
    public JsonNode arguments() {
        return function == null ? null : function.arguments();
    }
}
