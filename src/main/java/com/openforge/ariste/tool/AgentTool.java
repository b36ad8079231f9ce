package com.openforge.ariste.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.llm.model.ToolDefinition;

/**
 * One named capability the model may invoke.
 *
 * The definition is built once and shared read-only by every agent in the
 * process; execute() must therefore not keep per-call state on the instance.
 */
public interface AgentTool {

    /** The schema sent to the model in the "tools" array. */
    ToolDefinition definition();

    /**
     * Runs the tool.
     *
     * @param arguments the parsed arguments object from the tool call, never null
     * @return text shown to the model as the tool message content
     * @throws ToolExecutionException when the tool cannot produce a result
     */
    String execute(JsonNode arguments) throws ToolExecutionException;

    default String name() {
        return definition().name();
    }
}
