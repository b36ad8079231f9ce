package com.openforge.ariste.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.AgentTool;
import com.openforge.ariste.tool.ToolArguments;
import com.openforge.ariste.tool.ToolExecutionException;
import com.openforge.ariste.tool.ToolSchemas;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates or overwrites a file with the given content.
 */
public class WriteTool implements AgentTool {

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "write",
            "Write content to a file. Creates the file if it doesn't exist, overwrites if it does.",
            """
            {
              "type": "object",
              "properties": {
                "file_path": {
                  "type": "string",
                  "description": "The absolute path to the file to write (e.g., '/home/user/document.txt')"
                },
                "content": {
                  "type": "string",
                  "description": "The content to write to the file"
                }
              },
              "required": ["file_path", "content"]
            }
            """);

    private final Path workingDirectory;

    public WriteTool(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        String filePath = ToolArguments.requireString(arguments, "file_path");
        String content  = ToolArguments.requireString(arguments, "content");
        try {
            Files.writeString(workingDirectory.resolve(filePath), content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolExecutionException(
                    "Failed to write to file '%s': %s".formatted(filePath, ReadTool.describe(e)), e);
        }
        return "Successfully wrote to file: " + filePath;
    }
}
