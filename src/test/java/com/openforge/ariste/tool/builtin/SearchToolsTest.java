package com.openforge.ariste.tool.builtin;

import com.openforge.ariste.tool.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.openforge.ariste.testsupport.ScriptedChatClientFactory.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchToolsTest {

    @TempDir
    Path workDir;

    private GlobTool globTool;
    private GrepTool grepTool;

    @BeforeEach
    void setUp() throws IOException {
        globTool = new GlobTool(workDir);
        grepTool = new GrepTool(workDir);

        Files.createDirectories(workDir.resolve("src/main"));
        Files.writeString(workDir.resolve("README.txt"), "Hello world\nsecond line\n");
        Files.writeString(workDir.resolve("src/notes.txt"), "TODO: write tests\nhello again\n");
        Files.writeString(workDir.resolve("src/main/App.java"), "class App {\n  // hello\n}\n");
    }

    @Test
    void glob_doubleStarMatchesTopLevelAndNestedFiles() throws ToolExecutionException {
        String result = globTool.execute(json("{\"pattern\":\"**/*.txt\"}"));

        assertEquals(workDir.resolve("README.txt") + "\n" + workDir.resolve("src/notes.txt"), result);
    }

    @Test
    void glob_honoursBaseDirectoryArgument() throws ToolExecutionException {
        String result = globTool.execute(json("{\"pattern\":\"**/*.java\",\"path\":\"%s\"}"
                .formatted(workDir.resolve("src"))));

        assertEquals(workDir.resolve("src/main/App.java").toString(), result);
    }

    @Test
    void glob_acceptsAbsolutePattern() throws ToolExecutionException {
        String result = globTool.execute(json("{\"pattern\":\"%s/src/*.txt\"}".formatted(workDir)));

        assertEquals(workDir.resolve("src/notes.txt").toString(), result);
    }

    @Test
    void glob_reportsNoMatches() throws ToolExecutionException {
        String result = globTool.execute(json("{\"pattern\":\"*.rs\"}"));

        assertTrue(result.startsWith("No files found matching pattern: "));
    }

    @Test
    void glob_rejectsMalformedPattern() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> globTool.execute(json("{\"pattern\":\"*.[txt\"}")));

        assertTrue(e.getMessage().startsWith("Invalid glob pattern '*.[txt'"));
    }

    @Test
    void grep_contentModeListsPathLineAndText() throws ToolExecutionException {
        String result = grepTool.execute(json("{\"pattern\":\"hello\",\"case_insensitive\":true}"));

        assertEquals(String.join("\n",
                workDir.resolve("README.txt") + ":1:Hello world",
                workDir.resolve("src/main/App.java") + ":2:  // hello",
                workDir.resolve("src/notes.txt") + ":2:hello again"), result);
    }

    @Test
    void grep_isCaseSensitiveByDefault() throws ToolExecutionException {
        String result = grepTool.execute(json("{\"pattern\":\"Hello\",\"output_mode\":\"files_with_matches\"}"));

        assertEquals(workDir.resolve("README.txt").toString(), result);
    }

    @Test
    void grep_countModeCountsPerFile() throws ToolExecutionException {
        String result = grepTool.execute(json("{\"pattern\":\"line\",\"path\":\"README.txt\",\"output_mode\":\"count\"}"));

        assertEquals(workDir.resolve("README.txt") + ":1", result);
    }

    @Test
    void grep_filtersFilesByGlob() throws ToolExecutionException {
        String result = grepTool.execute(json("{\"pattern\":\"hello\",\"glob\":\"**/*.java\",\"output_mode\":\"files_with_matches\"}"));

        assertEquals(workDir.resolve("src/main/App.java").toString(), result);
    }

    @Test
    void grep_reportsNoMatches() throws ToolExecutionException {
        assertEquals("No matches found for pattern: zzz", grepTool.execute(json("{\"pattern\":\"zzz\"}")));
    }

    @Test
    void grep_rejectsMissingPath() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> grepTool.execute(json("{\"pattern\":\"x\",\"path\":\"nope\"}")));
        assertEquals("Path 'nope' is not a valid file or directory", e.getMessage());
    }

    @Test
    void grep_rejectsInvalidRegex() {
        assertThrows(ToolExecutionException.class, () -> grepTool.execute(json("{\"pattern\":\"(unclosed\"}")));
    }
}
