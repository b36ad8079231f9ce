package com.openforge.ariste.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.agent.subagent.SubAgentRole;
import com.openforge.ariste.agent.subagent.SubAgentTask;
import com.openforge.ariste.tool.ToolExecutionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.openforge.ariste.testsupport.ScriptedChatClientFactory.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskToolTest {

    @Test
    void definition_listsEveryRoleAndRequiredFields() {
        JsonNode parameters = TaskTool.DEFINITION.function().parameters();

        List<String> roles = new ArrayList<>();
        parameters.path("properties").path("subagent_type").path("enum").forEach(n -> roles.add(n.asText()));
        List<String> required = new ArrayList<>();
        parameters.path("required").forEach(n -> required.add(n.asText()));

        assertEquals("task", TaskTool.DEFINITION.name());
        assertEquals(SubAgentRole.wireNames(), roles);
        assertEquals(List.of("subagent_type", "description", "prompt"), required);
    }

    @Test
    void parse_readsAllFields() throws ToolExecutionException {
        SubAgentTask task = TaskTool.parse(json("""
                {"subagent_type": "code-review", "description": "Review parser",
                 "prompt": "Look at Parser.java", "include_tools": true, "model": "llama3.2"}
                """));

        assertEquals(SubAgentRole.CODE_REVIEW, task.role());
        assertEquals("Review parser", task.description());
        assertEquals("Look at Parser.java", task.prompt());
        assertTrue(task.includeTools());
        assertEquals("llama3.2", task.model());
    }

    @Test
    void parse_defaultsToGeneralPurposeWithoutTools() throws ToolExecutionException {
        SubAgentTask task = TaskTool.parse(json("{\"description\":\"d\",\"prompt\":\"p\"}"));

        assertEquals(SubAgentRole.GENERAL_PURPOSE, task.role());
        assertFalse(task.includeTools());
        assertFalse(task.includeContext());
        assertNull(task.model());
    }

    @Test
    void parse_rejectsUnknownRole() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class, () -> TaskTool.parse(json(
                "{\"subagent_type\":\"wizard\",\"description\":\"d\",\"prompt\":\"p\"}")));
        assertEquals("Invalid subagent type: wizard", e.getMessage());
    }

    @Test
    void parse_requiresPrompt() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> TaskTool.parse(json("{\"subagent_type\":\"plan\",\"description\":\"d\"}")));
        assertEquals("Missing 'prompt' argument", e.getMessage());
    }
}
