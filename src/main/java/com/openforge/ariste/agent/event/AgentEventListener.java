package com.openforge.ariste.agent.event;

import lombok.extern.slf4j.Slf4j;

/**
 * Receives agent events. Notifications are advisory: a listener can never
 * change what the loop does next.
 */
@FunctionalInterface
public interface AgentEventListener {

    AgentEventListener NOOP = event -> {};

    void onEvent(AgentEvent event);

    /** Wraps a listener so that its failures are logged and swallowed. */
    static AgentEventListener safe(AgentEventListener delegate) {
        if (delegate == null) return NOOP;
        if (delegate instanceof SafeListener) return delegate;
        return new SafeListener(delegate);
    }

    @Slf4j
    final class SafeListener implements AgentEventListener {

        private final AgentEventListener delegate;

        private SafeListener(AgentEventListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onEvent(AgentEvent event) {
            try {
                delegate.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[Listener] Failed to handle {} event for {}: {}",
                        event.type(), event.conversationId(), e.getMessage());
            }
        }
    }
}
