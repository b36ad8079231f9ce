package com.openforge.ariste.agent.dto;

import com.openforge.ariste.agent.TurnResult;
import com.openforge.ariste.websocket.AgentEventPublisher;

/**
 * Response body for a completed turn.
 */
public record TurnResponse(
        String conversationId,
        String answer,
        int    iterations,
        String state,
        String wsSubscribePath
) {

    public static TurnResponse from(String conversationId, TurnResult result) {
        return new TurnResponse(conversationId, result.answer(), result.iterations(),
                result.state().name(), AgentEventPublisher.topicFor(conversationId));
    }
}
