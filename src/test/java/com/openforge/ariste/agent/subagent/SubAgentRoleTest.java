package com.openforge.ariste.agent.subagent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubAgentRoleTest {

    @Test
    void wireNames_coverEveryRoleInDeclarationOrder() {
        assertEquals(List.of("general-purpose", "explore", "plan", "code-review", "test-runner"),
                SubAgentRole.wireNames());
    }

    @Test
    void find_isCaseInsensitive() {
        assertEquals(SubAgentRole.CODE_REVIEW, SubAgentRole.find("Code-Review").orElseThrow());
        assertTrue(SubAgentRole.find("reviewer").isEmpty());
        assertTrue(SubAgentRole.find(null).isEmpty());
    }

    @Test
    void fromName_listsValidTypesOnFailure() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SubAgentRole.fromName("wizard"));
        assertTrue(e.getMessage().contains("general-purpose, explore, plan, code-review, test-runner"));
    }

    @Test
    void onlyPlanRoleIsToolless() {
        for (SubAgentRole role : SubAgentRole.values()) {
            assertEquals(role != SubAgentRole.PLAN, role.usesTools(), role.name());
        }
    }

    @Test
    void onlyGeneralPurposeLacksSystemPrompt() {
        assertTrue(SubAgentRole.GENERAL_PURPOSE.systemPrompt().isEmpty());
        assertTrue(SubAgentRole.EXPLORE.systemPrompt().orElseThrow().startsWith("You are a codebase exploration agent."));
        assertTrue(SubAgentRole.PLAN.systemPrompt().isPresent());
    }

    @Test
    void serializesAsWireName() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"test-runner\"", mapper.writeValueAsString(SubAgentRole.TEST_RUNNER));
        assertEquals(SubAgentRole.EXPLORE, mapper.readValue("\"explore\"", SubAgentRole.class));
    }

    @Test
    void task_toolsRequireCallerAndRoleConsent() {
        assertFalse(SubAgentTask.of(SubAgentRole.EXPLORE, "d", "p").toolsEnabled());
        assertTrue(SubAgentTask.of(SubAgentRole.EXPLORE, "d", "p").withTools(true).toolsEnabled());
        assertFalse(SubAgentTask.of(SubAgentRole.PLAN, "d", "p").withTools(true).toolsEnabled());
    }

    @Test
    void task_defaultsNullFields() {
        SubAgentTask task = new SubAgentTask(null, null, null, false, false, null);

        assertEquals(SubAgentRole.GENERAL_PURPOSE, task.role());
        assertEquals("Task: \n\nDetails:\n", task.taskStatement());
    }
}
