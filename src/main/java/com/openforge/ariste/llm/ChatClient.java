package com.openforge.ariste.llm;

import com.openforge.ariste.llm.model.DecodedResponse;
import com.openforge.ariste.llm.model.Message;

import java.util.List;

/**
 * One chat-completion call per invocation: the full history goes out, one
 * aggregated response comes back.
 *
 * Implementations hold no per-call state, so a client may be reused by one
 * agent for every iteration, or built fresh per call site.
 */
public interface ChatClient {

    /**
     * Sends the conversation and blocks until the response is fully decoded.
     *
     * @param model    model identifier for this call
     * @param messages the complete history, oldest first
     * @param listener live display callbacks (reasoning vs final text)
     * @throws ChatException on transport failure or a non-2xx status
     */
    DecodedResponse send(String model, List<Message> messages, StreamListener listener);

    /** The fixed configuration this client was built with. */
    ChatOptions options();

    default DecodedResponse send(List<Message> messages, StreamListener listener) {
        return send(options().model(), messages, listener);
    }

    default DecodedResponse send(List<Message> messages) {
        return send(options().model(), messages, StreamListener.NOOP);
    }

    // ── Exception types ──────────────────────────────────────────────────────

    class ChatException extends RuntimeException {
        public ChatException(String message) { super(message); }
        public ChatException(String message, Throwable cause) { super(message, cause); }
    }

    /** Raised only in {@link DecodingMode#STRICT} for a malformed stream line. */
    class ChatProtocolException extends ChatException {
        public ChatProtocolException(String message) { super(message); }
        public ChatProtocolException(String message, Throwable cause) { super(message, cause); }
    }
}
