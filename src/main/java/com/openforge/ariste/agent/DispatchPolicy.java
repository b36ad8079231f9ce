package com.openforge.ariste.agent;

/**
 * What the dispatcher does with an unknown tool or a failed tool execution.
 *
 * The top-level loop and subagents deliberately differ: a user-facing turn
 * aborts so the human sees the failure, while a delegated task keeps going and
 * lets the model react to the error text.
 */
public enum DispatchPolicy {

    /** Abort the turn with an {@link AgentLoopException}. Used by the top-level loop. */
    FAIL_FAST,

    /** Turn the failure into a "Tool execution error: ..." tool message. Used by subagents. */
    DEGRADE
}
