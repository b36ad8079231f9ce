package com.openforge.ariste.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.ariste.llm.model.ToolDefinition;

import java.util.Collection;

/**
 * Builds {@link ToolDefinition}s from JSON Schema text blocks.
 *
 * Schemas are written as literal JSON so they read exactly as the model will
 * receive them. A malformed literal is a programming error and fails fast.
 */
public final class ToolSchemas {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ToolSchemas() {}

    public static ToolDefinition define(String name, String description, String parametersJson) {
        return ToolDefinition.of(name, description, parse(name, parametersJson));
    }

    /**
     * Same as {@link #define(String, String, String)}, then closes {@code property}
     * to the given values with a JSON Schema "enum".
     */
    public static ToolDefinition defineWithEnum(String name, String description, String parametersJson,
                                                String property, Collection<String> values) {
        JsonNode parameters = parse(name, parametersJson);
        JsonNode target = parameters.path("properties").path(property);
        if (!(target instanceof ObjectNode node)) {
            throw new IllegalStateException("Tool %s has no property '%s' to restrict".formatted(name, property));
        }
        node.set("enum", stringArray(values));
        return ToolDefinition.of(name, description, parameters);
    }

    public static ArrayNode stringArray(Collection<String> values) {
        ArrayNode array = MAPPER.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    private static JsonNode parse(String name, String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid parameter schema for tool " + name, e);
        }
    }
}
