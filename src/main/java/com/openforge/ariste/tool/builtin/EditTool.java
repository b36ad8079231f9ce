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
 * Replaces the first (or every) literal occurrence of old_string in a file.
 * Line endings are untouched because the replacement is purely textual.
 */
public class EditTool implements AgentTool {

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "edit",
            "Edit a file by replacing text. Reads the file, replaces occurrences of old_string with "
                    + "new_string, and writes it back. Preserves the original file encoding and line endings.",
            """
            {
              "type": "object",
              "properties": {
                "file_path": {
                  "type": "string",
                  "description": "The absolute path to the file to edit (e.g., '/home/user/document.txt')"
                },
                "old_string": {
                  "type": "string",
                  "description": "The exact string to search for and replace. Must be an exact match."
                },
                "new_string": {
                  "type": "string",
                  "description": "The new string to replace the old_string with."
                },
                "replace_all": {
                  "type": "boolean",
                  "description": "If true, replace all occurrences of old_string. If false (default), only replace the first occurrence."
                }
              },
              "required": ["file_path", "old_string", "new_string"]
            }
            """);

    private final Path workingDirectory;

    public EditTool(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        String  filePath   = ToolArguments.requireString(arguments, "file_path");
        String  oldString  = ToolArguments.requireString(arguments, "old_string");
        String  newString  = ToolArguments.requireString(arguments, "new_string");
        boolean replaceAll = ToolArguments.optionalBoolean(arguments, "replace_all", false);

        Path path = workingDirectory.resolve(filePath);
        String original;
        try {
            original = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolExecutionException(
                    "Failed to read file '%s': %s".formatted(filePath, ReadTool.describe(e)), e);
        }

        int first = oldString.isEmpty() ? -1 : original.indexOf(oldString);
        if (first < 0) {
            throw new ToolExecutionException(
                    "Old string '%s' not found in file '%s'".formatted(oldString, filePath));
        }

        String updated = replaceAll
                ? original.replace(oldString, newString)
                : original.substring(0, first) + newString + original.substring(first + oldString.length());

        try {
            Files.writeString(path, updated, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolExecutionException(
                    "Failed to write file '%s': %s".formatted(filePath, ReadTool.describe(e)), e);
        }

        return "Successfully replaced %s of '%s' with '%s' in file '%s'".formatted(
                replaceAll ? "all occurrences" : "first occurrence", oldString, newString, filePath);
    }
}
