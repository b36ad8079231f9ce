package com.openforge.ariste.agent;

/**
 * A failure that ends a turn or a subagent task. The message is stable and
 * meant to be shown to the human caller.
 */
public class AgentLoopException extends RuntimeException {

    public enum Reason {
        ITERATION_LIMIT,
        SUBAGENT_ITERATION_LIMIT,
        TOOL_NOT_FOUND,
        TOOL_FAILED,
        NO_RESPONSE,
        INVALID_DELEGATION
    }

    public static final String ITERATION_LIMIT_MESSAGE = "Too many tool call iterations";
    public static final String SUBAGENT_ITERATION_LIMIT_MESSAGE = "Subagent: Too many iterations in one turn";
    public static final String NO_RESPONSE_MESSAGE     = "Subagent: No response generated";

    private final Reason reason;

    public AgentLoopException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AgentLoopException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public static AgentLoopException iterationLimit() {
        return new AgentLoopException(Reason.ITERATION_LIMIT, ITERATION_LIMIT_MESSAGE);
    }

    public static AgentLoopException subAgentIterationLimit() {
        return new AgentLoopException(Reason.SUBAGENT_ITERATION_LIMIT, SUBAGENT_ITERATION_LIMIT_MESSAGE);
    }

    public static AgentLoopException noResponse() {
        return new AgentLoopException(Reason.NO_RESPONSE, NO_RESPONSE_MESSAGE);
    }
}
