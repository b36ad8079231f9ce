package com.openforge.ariste.agent.subagent;

import lombok.Builder;

/**
 * One delegation request. A value object: it lives only as long as the call
 * that consumes it.
 *
 * @param model optional model override; null means the configured model
 */
@Builder(toBuilder = true)
public record SubAgentTask(
        SubAgentRole role,
        String       description,
        String       prompt,
        boolean      includeContext,
        boolean      includeTools,
        String       model
) {

    public SubAgentTask {
        role        = role == null ? SubAgentRole.DEFAULT : role;
        description = description == null ? "" : description;
        prompt      = prompt == null ? "" : prompt;
    }

    public static SubAgentTask of(SubAgentRole role, String description, String prompt) {
        return new SubAgentTask(role, description, prompt, false, false, null);
    }

    public SubAgentTask withContext(boolean include) {
        return toBuilder().includeContext(include).build();
    }

    public SubAgentTask withTools(boolean include) {
        return toBuilder().includeTools(include).build();
    }

    /** Tools are attached only when both the caller and the role allow them. */
    public boolean toolsEnabled() {
        return includeTools && role.usesTools();
    }

    /** The single user message handed to the subagent. */
    public String taskStatement() {
        return "Task: %s\n\nDetails:\n%s".formatted(description, prompt);
    }
}
