package com.openforge.ariste.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body POSTed to the chat endpoint.
 *
 *   {"model":"qwen3","messages":[...],"stream":true,"think":false,"tools":[...]}
 *
 * "tools" is omitted entirely when the client was built without tool definitions.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        boolean stream,
        boolean think,
        List<ToolDefinition> tools
) {}
