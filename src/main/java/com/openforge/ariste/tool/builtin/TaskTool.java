package com.openforge.ariste.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.agent.subagent.SubAgentRole;
import com.openforge.ariste.agent.subagent.SubAgentTask;
import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.ToolArguments;
import com.openforge.ariste.tool.ToolExecutionException;
import com.openforge.ariste.tool.ToolSchemas;

/**
 * The delegation tool.
 *
 * Not an {@code AgentTool}: it has no generic execute(). The dispatcher routes
 * it to the subagent orchestrator, which needs state ordinary tools never see.
 * This class only owns the schema and the argument parsing.
 */
public final class TaskTool {

    public static final String NAME = "task";

    public static final ToolDefinition DEFINITION = ToolSchemas.defineWithEnum(
            NAME,
            "Launch a specialized subagent to handle complex, multi-step tasks autonomously",
            """
            {
              "type": "object",
              "properties": {
                "subagent_type": {
                  "type": "string",
                  "description": "The type of subagent to launch"
                },
                "description": {
                  "type": "string",
                  "description": "A short description (3-5 words) of what the agent will do"
                },
                "prompt": {
                  "type": "string",
                  "description": "The detailed task for the agent to perform"
                },
                "include_tools": {
                  "type": "boolean",
                  "description": "Whether the subagent may use tools. Default is false."
                },
                "model": {
                  "type": "string",
                  "description": "Optional model to use (defaults to the configured model)"
                }
              },
              "required": ["subagent_type", "description", "prompt"]
            }
            """,
            "subagent_type",
            SubAgentRole.wireNames());

    private TaskTool() {}

    /**
     * Reads a delegation request from tool-call arguments.
     * A missing subagent_type means general-purpose; an unknown one is an error.
     */
    public static SubAgentTask parse(JsonNode arguments) throws ToolExecutionException {
        String typeName = ToolArguments.optionalString(arguments, "subagent_type", SubAgentRole.DEFAULT.wireName());
        SubAgentRole role = SubAgentRole.find(typeName).orElseThrow(() -> new ToolExecutionException(
                "Invalid subagent type: " + typeName));

        return SubAgentTask.builder()
                .role(role)
                .description(ToolArguments.requireString(arguments, "description"))
                .prompt(ToolArguments.requireString(arguments, "prompt"))
                .includeTools(ToolArguments.optionalBoolean(arguments, "include_tools", false))
                .model(ToolArguments.optionalString(arguments, "model", null))
                .build();
    }
}
