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
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Regex search over one file or a directory tree.
 *
 * output_mode:
 *   content            → path:line:text for every matching line (default)
 *   files_with_matches → each matching path once
 *   count              → path:n for files with at least one match
 */
public class GrepTool implements AgentTool {

    enum OutputMode {
        CONTENT, FILES_WITH_MATCHES, COUNT;

        static OutputMode parse(String value) {
            return switch (value) {
                case "files_with_matches" -> FILES_WITH_MATCHES;
                case "count"              -> COUNT;
                default                   -> CONTENT;
            };
        }
    }

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "grep",
            "Search for text patterns in files using regular expressions. "
                    + "Supports recursive directory searching and multiple output modes.",
            """
            {
              "type": "object",
              "properties": {
                "pattern": {
                  "type": "string",
                  "description": "The regular expression pattern to search for in file contents."
                },
                "path": {
                  "type": "string",
                  "description": "The file or directory path to search in. If a directory, searches all files recursively."
                },
                "glob": {
                  "type": "string",
                  "description": "Optional glob pattern to filter files when searching a directory (e.g., '*.java', '**/*.json')."
                },
                "case_insensitive": {
                  "type": "boolean",
                  "description": "Whether to perform case-insensitive search. Default is false."
                },
                "output_mode": {
                  "type": "string",
                  "description": "Output format: 'content' shows matching lines, 'files_with_matches' shows only file paths, 'count' shows match counts per file. Default is 'content'."
                }
              },
              "required": ["pattern"]
            }
            """);

    private final Path workingDirectory;

    public GrepTool(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        String     patternText = ToolArguments.requireString(arguments, "pattern");
        String     pathArg     = ToolArguments.optionalString(arguments, "path", ".");
        String     globArg     = ToolArguments.optionalString(arguments, "glob", null);
        boolean    ignoreCase  = ToolArguments.optionalBoolean(arguments, "case_insensitive", false);
        OutputMode mode        = OutputMode.parse(ToolArguments.optionalString(arguments, "output_mode", "content"));

        Pattern regex;
        try {
            regex = Pattern.compile(patternText, ignoreCase ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0);
        } catch (PatternSyntaxException e) {
            throw new ToolExecutionException(
                    "Invalid regex pattern '%s': %s".formatted(patternText, e.getDescription()), e);
        }

        Path searchPath = workingDirectory.resolve(pathArg).normalize();
        List<Path> files;
        if (Files.isRegularFile(searchPath)) {
            files = List.of(searchPath);
        } else if (Files.isDirectory(searchPath)) {
            files = globArg == null ? allFiles(searchPath) : GlobTool.find(searchPath, globArg).stream()
                    .map(Path::of)
                    .filter(Files::isRegularFile)
                    .toList();
        } else {
            throw new ToolExecutionException("Path '%s' is not a valid file or directory".formatted(pathArg));
        }

        List<String> results = new ArrayList<>();
        for (Path file : files) {
            search(file, regex, mode, results);
        }
        return results.isEmpty()
                ? "No matches found for pattern: " + patternText
                : String.join("\n", results);
    }

    private static void search(Path file, Pattern regex, OutputMode mode, List<String> results)
            throws ToolExecutionException {
        List<String> lines;
        try {
            lines = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).lines().toList();
        } catch (IOException e) {
            throw new ToolExecutionException(
                    "Failed to read file '%s': %s".formatted(file, ReadTool.describe(e)), e);
        }

        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!regex.matcher(line).find()) continue;
            switch (mode) {
                case CONTENT -> results.add("%s:%d:%s".formatted(file, i + 1, line));
                case COUNT -> count++;
                case FILES_WITH_MATCHES -> {
                    results.add(file.toString());
                    return;
                }
            }
        }
        if (mode == OutputMode.COUNT && count > 0) {
            results.add("%s:%d".formatted(file, count));
        }
    }

    private static List<Path> allFiles(Path dir) throws ToolExecutionException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new ToolExecutionException(
                    "Failed to read directory '%s': %s".formatted(dir, ReadTool.describe(e)), e);
        }
    }
}
