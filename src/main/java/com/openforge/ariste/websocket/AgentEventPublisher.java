package com.openforge.ariste.websocket;

import com.openforge.ariste.agent.event.AgentEvent;
import com.openforge.ariste.agent.event.AgentEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes AgentEvents to the STOMP topic of their conversation.
 *
 * Topic layout:
 *   /topic/agent/{conversationId}             → top-level events of one conversation
 *   /topic/agent/{conversationId}:subagent-{n} → tool events of one running subagent
 *
 * SimpMessagingTemplate is thread-safe, so concurrently running subagents
 * publish without extra synchronization.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentEventPublisher implements AgentEventListener {

    public static final String TOPIC_PREFIX = WebSocketConfig.AGENT_TOPIC_PREFIX;

    private final SimpMessagingTemplate messagingTemplate;

    public static String topicFor(String conversationId) {
        return TOPIC_PREFIX + conversationId;
    }

    /** Fire-and-forget; delivery failures never reach the agent loop. */
    @Override
    public void onEvent(AgentEvent event) {
        String destination = topicFor(event.conversationId());
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
