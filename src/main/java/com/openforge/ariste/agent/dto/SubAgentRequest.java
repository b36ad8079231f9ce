package com.openforge.ariste.agent.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /api/agent/subagents.
 *
 * @param allOrNothing   fail the whole request on the first failed task (request order)
 * @param conversationId optional; source of context for tasks with include_context
 */
public record SubAgentRequest(

        @NotEmpty(message = "tasks must not be empty")
        @Size(max = 16, message = "at most 16 tasks per request")
        List<@Valid SubAgentTaskRequest> tasks,

        boolean allOrNothing,

        String conversationId
) {}
