package com.openforge.ariste.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openforge.ariste.llm.model.DecodedResponse;
import com.openforge.ariste.llm.model.FunctionCall;
import com.openforge.ariste.llm.model.StreamingChunk;
import com.openforge.ariste.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a newline-delimited JSON response body into one {@link DecodedResponse}.
 *
 * Per chunk, in this order:
 *   1. message.tool_calls → appended to the tool-call buffer (ids normalized)
 *   2. message.thinking   → buffered, emitted line by line to the listener, never returned
 *   3. message.content    → appended to the result and forwarded to the listener
 *   4. done == true       → stop reading, even if bytes remain
 *
 * The phase cursor (IDLE → REASONING → RESPONDING) only decides which listener
 * callbacks fire; it does not change what is accumulated.
 *
 * Stateless and thread-safe: all per-response state lives in a
 * {@link Accumulator} created for each {@link #decode} call.
 */
@Slf4j
public class StreamDecoder {

    private static final int PREVIEW_LENGTH = 120;

    private final ObjectMapper objectMapper;
    private final DecodingMode mode;
    private final String       source;

    public StreamDecoder(ObjectMapper objectMapper, DecodingMode mode, String source) {
        this.objectMapper = objectMapper;
        this.mode         = mode == null ? DecodingMode.LENIENT : mode;
        this.source       = source;
    }

    /**
     * Reads {@code body} to the end (or to the first done chunk).
     *
     * @throws IOException if the underlying stream fails; callers treat this as a transport error
     * @throws ChatClient.ChatProtocolException in STRICT mode, for a malformed line
     */
    public DecodedResponse decode(InputStream body, StreamListener listener) throws IOException {
        Accumulator acc = new Accumulator(listener == null ? StreamListener.NOOP : listener);
        ByteArrayOutputStream line = new ByteArrayOutputStream(256);
        InputStream in = body instanceof BufferedInputStream ? body : new BufferedInputStream(body);

        int b;
        boolean done = false;
        while (!done && (b = in.read()) != -1) {
            if (b == '\n') {
                done = acceptLine(line.toByteArray(), acc);
                line.reset();
            } else {
                line.write(b);
            }
        }
        if (!done && line.size() > 0) {
            acceptLine(line.toByteArray(), acc);
        }

        return acc.finish();
    }

    // ── Line handling ────────────────────────────────────────────────────────

    /** Returns true when the chunk signalled the end of the response. */
    private boolean acceptLine(byte[] bytes, Accumulator acc) {
        String text;
        try {
            text = strictUtf8().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            malformed("invalid UTF-8 (" + bytes.length + " bytes)", e);
            return false;
        }
        if (text.isBlank()) return false;

        StreamingChunk chunk;
        try {
            chunk = objectMapper.readValue(text, StreamingChunk.class);
        } catch (JsonProcessingException e) {
            malformed(preview(text), e);
            return false;
        }
        if (chunk == null) return false;

        acc.accept(chunk);
        return chunk.isDone();
    }

    private void malformed(String detail, Exception cause) {
        if (mode == DecodingMode.STRICT) {
            throw new ChatClient.ChatProtocolException(
                    "Malformed chunk from [%s]: %s".formatted(source, detail), cause);
        }
        log.warn("[StreamDecoder:{}] Skipping malformed chunk: {}", source, detail);
    }

    private static CharsetDecoder strictUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "…";
    }

    // ── Per-response state ───────────────────────────────────────────────────

    enum Phase { IDLE, REASONING, RESPONDING }

    private final class Accumulator {

        private final StreamListener  listener;
        private final StringBuilder   content   = new StringBuilder();
        private final StringBuilder   reasoning = new StringBuilder();
        private final List<ToolCall>  toolCalls = new ArrayList<>();
        private Phase phase = Phase.IDLE;

        Accumulator(StreamListener listener) {
            this.listener = listener;
        }

        void accept(StreamingChunk chunk) {
            StreamingChunk.ChunkMessage message = chunk.message();
            if (message == null) return;

            if (message.toolCalls() != null) {
                for (JsonNode raw : message.toolCalls()) {
                    toolCalls.add(normalize(raw, toolCalls.size()));
                }
            }

            String thinking = message.thinking();
            if (thinking != null && !thinking.isEmpty()) {
                if (phase == Phase.IDLE) {
                    listener.onReasoningStart();
                    phase = Phase.REASONING;
                }
                reasoning.append(thinking);
                emitCompleteReasoningLines();
            }

            String fragment = message.content();
            if (fragment != null && !fragment.isEmpty()) {
                if (phase == Phase.IDLE) {
                    listener.onResponseStart();
                } else if (phase == Phase.REASONING) {
                    flushReasoning();
                    listener.onReasoningEnd();
                    listener.onResponseStart();
                }
                phase = Phase.RESPONDING;
                content.append(fragment);
                listener.onContent(fragment);
            }
        }

        DecodedResponse finish() {
            flushReasoning();
            if (phase == Phase.REASONING) {
                listener.onReasoningEnd();
            }
            listener.onStreamEnd();
            return new DecodedResponse(content.toString(), toolCalls);
        }

        private void emitCompleteReasoningLines() {
            int newline;
            while ((newline = reasoning.indexOf("\n")) >= 0) {
                listener.onReasoningLine(reasoning.substring(0, newline));
                reasoning.delete(0, newline + 1);
            }
        }

        private void flushReasoning() {
            if (reasoning.length() > 0) {
                listener.onReasoningLine(reasoning.toString());
                reasoning.setLength(0);
            }
        }

        /**
         * Gives every call an id unique within this response and parses
         * string-encoded arguments. A missing or repeated id becomes "call_<n>",
         * counting up from the call's position until the id is free.
         */
        private ToolCall normalize(JsonNode raw, int position) {
            JsonNode function = raw.path("function");
            String id   = raw.path("id").asText("");
            String type = raw.path("type").asText("function");
            String name = function.path("name").asText("");
            if (id.isBlank() || containsId(id)) {
                int n = position;
                do {
                    id = "call_" + n++;
                } while (containsId(id));
            }
            return new ToolCall(id, type, new FunctionCall(name, arguments(function.get("arguments"))));
        }

        private boolean containsId(String id) {
            for (ToolCall call : toolCalls) {
                if (id.equals(call.id())) return true;
            }
            return false;
        }

        private JsonNode arguments(JsonNode node) {
            if (node == null || node.isNull() || node.isMissingNode()) {
                return JsonNodeFactory.instance.objectNode();
            }
            if (node.isTextual()) {
                String text = node.asText();
                if (text.isBlank()) return JsonNodeFactory.instance.objectNode();
                try {
                    return objectMapper.readTree(text);
                } catch (JsonProcessingException e) {
                    log.debug("[StreamDecoder:{}] Keeping unparsable arguments as text: {}", source, preview(text));
                    return node;
                }
            }
            return node;
        }
    }
}
