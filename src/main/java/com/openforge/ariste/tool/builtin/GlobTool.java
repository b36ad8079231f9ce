package com.openforge.ariste.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.AgentTool;
import com.openforge.ariste.tool.ToolArguments;
import com.openforge.ariste.tool.ToolExecutionException;
import com.openforge.ariste.tool.ToolSchemas;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists paths under a base directory that match a glob pattern, sorted.
 *
 * A leading "**&#47;" also matches entries directly in the base directory, so
 * "**&#47;*.txt" finds "a.txt" as well as "x/y/b.txt".
 */
public class GlobTool implements AgentTool {

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "glob",
            "Search for files matching a glob pattern. Returns a list of matching file paths sorted by name. "
                    + "This is useful for finding files by name pattern or extension.",
            """
            {
              "type": "object",
              "properties": {
                "pattern": {
                  "type": "string",
                  "description": "The glob pattern to match files (e.g., '**/*.java', 'src/**/*.json'). * matches within a path segment, ** matches any number of segments, ? matches a single character."
                },
                "path": {
                  "type": "string",
                  "description": "The base directory to search in. If not provided, uses the working directory."
                }
              },
              "required": ["pattern"]
            }
            """);

    private final Path workingDirectory;

    public GlobTool(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        String pattern = ToolArguments.requireString(arguments, "pattern");
        Path   base    = workingDirectory.resolve(ToolArguments.optionalString(arguments, "path", ".")).normalize();

        String relativePattern = pattern;
        if (Path.of(pattern).isAbsolute()) {
            base = literalPrefix(pattern);
            relativePattern = base.relativize(Path.of(pattern)).toString();
        }

        List<String> matches = find(base, relativePattern);
        if (matches.isEmpty()) {
            return "No files found matching pattern: " + base.resolve(relativePattern);
        }
        return String.join("\n", matches);
    }

    static List<String> find(Path base, String pattern) throws ToolExecutionException {
        PathMatcher primary;
        PathMatcher shallow;
        try {
            primary = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            shallow = pattern.startsWith("**/")
                    ? FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3))
                    : primary;
        } catch (IllegalArgumentException e) {
            throw new ToolExecutionException("Invalid glob pattern '%s': %s".formatted(pattern, e.getMessage()), e);
        }
        if (!Files.isDirectory(base)) {
            return List.of();
        }

        try (Stream<Path> walk = Files.walk(base)) {
            return walk.filter(p -> !p.equals(base))
                    .filter(p -> {
                        Path rel = base.relativize(p);
                        return primary.matches(rel) || shallow.matches(rel);
                    })
                    .map(Path::toString)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to search '%s': %s".formatted(base, ReadTool.describe(e)), e);
        }
    }

    /** The longest leading run of path segments that contain no glob metacharacters. */
    private static Path literalPrefix(String absolutePattern) {
        Path pattern = Path.of(absolutePattern);
        Path prefix  = pattern.getRoot();
        for (Path segment : pattern) {
            String s = segment.toString();
            if (s.indexOf('*') >= 0 || s.indexOf('?') >= 0 || s.indexOf('[') >= 0 || s.indexOf('{') >= 0) {
                break;
            }
            prefix = prefix.resolve(s);
        }
        return prefix.equals(pattern) && prefix.getParent() != null ? prefix.getParent() : prefix;
    }
}
