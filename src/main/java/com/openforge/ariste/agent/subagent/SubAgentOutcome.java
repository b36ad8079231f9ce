package com.openforge.ariste.agent.subagent;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Per-task result of a fan-out, in request order.
 *
 * @param result   the subagent's final text; null on failure
 * @param envelope the rendered report handed to a parent; null on failure
 * @param error    failure message; null on success
 * @param cause    the failure itself, kept for all-or-nothing callers
 */
public record SubAgentOutcome(
        int          index,
        SubAgentRole role,
        String       description,
        String       result,
        String       envelope,
        String       error,
        @JsonIgnore RuntimeException cause
) {

    public static SubAgentOutcome success(int index, SubAgentTask task, String result, String envelope) {
        return new SubAgentOutcome(index, task.role(), task.description(), result, envelope, null, null);
    }

    public static SubAgentOutcome failure(int index, SubAgentTask task, RuntimeException cause) {
        return new SubAgentOutcome(index, task.role(), task.description(), null, null,
                cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
    }

    public boolean succeeded() {
        return cause == null;
    }
}
