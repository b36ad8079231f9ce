package com.openforge.ariste.agent.dto;

import com.openforge.ariste.agent.subagent.SubAgentRole;
import com.openforge.ariste.agent.subagent.SubAgentTask;
import jakarta.validation.constraints.NotBlank;

/**
 * One task inside POST /api/agent/subagents.
 *
 * @param subagentType role wire name; general-purpose when absent
 */
public record SubAgentTaskRequest(
        String subagentType,

        @NotBlank(message = "description must not be blank")
        String description,

        @NotBlank(message = "prompt must not be blank")
        String prompt,

        Boolean includeTools,
        Boolean includeContext,
        String  model
) {

    /** @throws IllegalArgumentException for an unknown role name */
    public SubAgentTask toTask() {
        SubAgentRole role = subagentType == null || subagentType.isBlank()
                ? SubAgentRole.DEFAULT
                : SubAgentRole.fromName(subagentType);
        return SubAgentTask.builder()
                .role(role)
                .description(description)
                .prompt(prompt)
                .includeTools(Boolean.TRUE.equals(includeTools))
                .includeContext(Boolean.TRUE.equals(includeContext))
                .model(model)
                .build();
    }
}
