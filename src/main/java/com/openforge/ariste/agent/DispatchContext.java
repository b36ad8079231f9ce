package com.openforge.ariste.agent;

import com.openforge.ariste.agent.event.AgentEventListener;

/**
 * Who is dispatching: the conversation the results go into, how deep in the
 * delegation chain it sits, and which failure policy applies.
 *
 * @param delegationDepth 0 for the top-level agent, 1 for a subagent; delegation
 *                        is rejected at depth 1 or more
 */
public record DispatchContext(
        Conversation       conversation,
        int                delegationDepth,
        DispatchPolicy     policy,
        AgentEventListener listener
) {

    public static final int MAX_DELEGATION_DEPTH = 1;

    public DispatchContext {
        listener = AgentEventListener.safe(listener);
    }

    public static DispatchContext topLevel(Conversation conversation, AgentEventListener listener) {
        return new DispatchContext(conversation, 0, DispatchPolicy.FAIL_FAST, listener);
    }

    public static DispatchContext subAgent(Conversation conversation, int parentDepth, AgentEventListener listener) {
        return new DispatchContext(conversation, parentDepth + 1, DispatchPolicy.DEGRADE, listener);
    }

    public boolean mayDelegate() {
        return delegationDepth < MAX_DELEGATION_DEPTH;
    }

    public String conversationId() {
        return conversation.id();
    }
}
