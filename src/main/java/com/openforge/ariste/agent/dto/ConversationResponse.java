package com.openforge.ariste.agent.dto;

import com.openforge.ariste.llm.model.Message;
import com.openforge.ariste.websocket.AgentEventPublisher;

import java.util.List;

public record ConversationResponse(
        String        conversationId,
        int           messageCount,
        List<Message> messages,
        String        wsSubscribePath
) {

    public static ConversationResponse of(String conversationId, List<Message> messages) {
        return new ConversationResponse(conversationId, messages.size(), messages,
                AgentEventPublisher.topicFor(conversationId));
    }
}
