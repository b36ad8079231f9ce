package com.openforge.ariste.llm;

import com.openforge.ariste.llm.model.ToolDefinition;
import lombok.Builder;

import java.util.List;

/**
 * Fixed configuration of one {@link ChatClient}. A client never changes its
 * options; callers that need different flags (a tool-less subagent client, for
 * instance) build a new client from adjusted options.
 */
@Builder(toBuilder = true)
public record ChatOptions(
        String model,
        boolean stream,
        boolean think,
        boolean verbose,
        List<ToolDefinition> tools
) {

    public ChatOptions {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}
