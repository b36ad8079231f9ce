package com.openforge.ariste.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The "function" sub-object inside a {@link ToolDefinition}.
 *
 * "parameters" is a JSON-Schema object ({"type":"object","properties":{..},"required":[..]})
 * kept as a JsonNode so it is serialized verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFunction(
        String name,
        String description,
        JsonNode parameters
) {}
