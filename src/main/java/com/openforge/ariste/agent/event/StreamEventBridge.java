package com.openforge.ariste.agent.event;

import com.openforge.ariste.llm.StreamListener;

/**
 * Forwards decoder callbacks of one model call as REASONING and CONTENT events.
 */
public class StreamEventBridge implements StreamListener {

    private final String             conversationId;
    private final int                iteration;
    private final AgentEventListener listener;

    public StreamEventBridge(String conversationId, int iteration, AgentEventListener listener) {
        this.conversationId = conversationId;
        this.iteration      = iteration;
        this.listener       = listener;
    }

    @Override
    public void onReasoningLine(String line) {
        listener.onEvent(AgentEvent.reasoning(conversationId, line, iteration));
    }

    @Override
    public void onContent(String fragment) {
        listener.onEvent(AgentEvent.content(conversationId, fragment, iteration));
    }
}
