package com.openforge.ariste.websocket;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP over WebSocket for live agent events.
 *
 * Client flow:
 *   1. Connect to ws://host/ws (SockJS fallback at http://host/ws)
 *   2. SUBSCRIBE /topic/agent/{conversationId}
 *   3. POST a turn; AgentEvent frames arrive while the loop runs
 *
 * Subagent tool events arrive on /topic/agent/{conversationId}:subagent-{n};
 * their start/complete events stay on the parent's topic.
 *
 * TOOL_RESULT frames carry whole tool output (a file read, a bash listing), and
 * a fan-out publishes from several subagent threads at once, so the per-session
 * send buffer is sized well above Spring's 512 KB default.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String ENDPOINT           = "/ws";
    public static final String BROKER_PREFIX      = "/topic";
    public static final String AGENT_TOPIC_PREFIX = BROKER_PREFIX + "/agent/";

    static final int SEND_BUFFER_LIMIT_BYTES = 4 * 1024 * 1024;
    static final int SEND_TIME_LIMIT_MILLIS  = 20_000;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        // events flow server → client only; no @MessageMapping destinations
        registry.enableSimpleBroker(BROKER_PREFIX);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(ENDPOINT)
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.setSendBufferSizeLimit(SEND_BUFFER_LIMIT_BYTES)
                .setSendTimeLimit(SEND_TIME_LIMIT_MILLIS);
    }
}
