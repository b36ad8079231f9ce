package com.openforge.ariste.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Small accessors over a tool-call arguments object.
 */
public final class ToolArguments {

    private ToolArguments() {}

    public static String requireString(JsonNode args, String field) throws ToolExecutionException {
        JsonNode node = args == null ? null : args.get(field);
        if (node == null || !node.isTextual()) {
            throw new ToolExecutionException("Missing '%s' argument".formatted(field));
        }
        return node.asText();
    }

    public static String optionalString(JsonNode args, String field, String fallback) {
        JsonNode node = args == null ? null : args.get(field);
        return node != null && node.isTextual() ? node.asText() : fallback;
    }

    public static boolean optionalBoolean(JsonNode args, String field, boolean fallback) {
        JsonNode node = args == null ? null : args.get(field);
        return node != null && node.isBoolean() ? node.asBoolean() : fallback;
    }

    public static long optionalLong(JsonNode args, String field, long fallback) {
        JsonNode node = args == null ? null : args.get(field);
        return node != null && node.canConvertToLong() && node.isIntegralNumber() ? node.asLong() : fallback;
    }
}
