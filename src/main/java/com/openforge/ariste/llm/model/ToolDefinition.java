package com.openforge.ariste.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry in the "tools" array sent to the model.
 *
 * Wire format:
 * {
 *   "type": "function",
 *   "function": { "name": "...", "description": "...", "parameters": { ... } }
 * }
 *
 * Immutable and shared read-only by every agent in the process.
 */
public record ToolDefinition(
        String type,
        ToolFunction function
) {

    public static ToolDefinition of(String name, String description, JsonNode parameters) {
        return new ToolDefinition("function", new ToolFunction(name, description, parameters));
    }

    public String name() {
        return function.name();
    }
}
