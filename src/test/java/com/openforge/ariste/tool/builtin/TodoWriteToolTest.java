package com.openforge.ariste.tool.builtin;

import com.openforge.ariste.tool.ToolExecutionException;
import org.junit.jupiter.api.Test;

import static com.openforge.ariste.testsupport.ScriptedChatClientFactory.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TodoWriteToolTest {

    private final TodoWriteTool tool = new TodoWriteTool();

    @Test
    void execute_rendersItemsWithStatusIconsAndSummary() throws ToolExecutionException {
        String result = tool.execute(json("""
                {"todos": [
                  {"content": "Run tests", "status": "completed", "activeForm": "Running tests"},
                  {"content": "Fix bug", "status": "in_progress", "activeForm": "Fixing bug"},
                  {"content": "Write docs", "status": "pending", "activeForm": "Writing docs"}
                ]}
                """));

        assertEquals("""
                Todo list updated:
                  ● Running tests
                  ◐ Fixing bug
                  ○ Writing docs

                Total: 3 tasks (1 pending, 1 in progress, 1 completed)""", result);
    }

    @Test
    void execute_acceptsEmptyList() throws ToolExecutionException {
        String result = tool.execute(json("{\"todos\":[]}"));

        assertTrue(result.endsWith("Total: 0 tasks (0 pending, 0 in progress, 0 completed)"));
    }

    @Test
    void execute_rejectsUnknownStatus() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class, () -> tool.execute(json(
                "{\"todos\":[{\"content\":\"a\",\"status\":\"done\",\"activeForm\":\"A\"}]}")));
        assertTrue(e.getMessage().startsWith("Invalid status 'done'"));
    }

    @Test
    void execute_rejectsMissingTodos() {
        assertThrows(ToolExecutionException.class, () -> tool.execute(json("{\"todos\":\"nope\"}")));
    }
}
