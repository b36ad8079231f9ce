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
 * Returns a file's text. Invalid UTF-8 sequences are replaced, not rejected.
 */
public class ReadTool implements AgentTool {

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "read",
            "Read the contents of a file from the file system",
            """
            {
              "type": "object",
              "properties": {
                "file_path": {
                  "type": "string",
                  "description": "The absolute path to the file to read (e.g., '/home/user/document.txt')"
                }
              },
              "required": ["file_path"]
            }
            """);

    private final Path workingDirectory;

    public ReadTool(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        String filePath = ToolArguments.requireString(arguments, "file_path");
        try {
            byte[] bytes = Files.readAllBytes(workingDirectory.resolve(filePath));
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolExecutionException(
                    "Failed to read file '%s': %s".formatted(filePath, describe(e)), e);
        }
    }

    static String describe(IOException e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : " " + e.getMessage());
    }
}
