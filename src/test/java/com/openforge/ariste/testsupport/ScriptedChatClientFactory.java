package com.openforge.ariste.testsupport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.ariste.llm.ChatClient;
import com.openforge.ariste.llm.ChatClientFactory;
import com.openforge.ariste.llm.ChatOptions;
import com.openforge.ariste.llm.StreamListener;
import com.openforge.ariste.llm.model.DecodedResponse;
import com.openforge.ariste.llm.model.Message;
import com.openforge.ariste.llm.model.ToolCall;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A ChatClientFactory whose clients answer from a script instead of HTTP.
 * Records every options object it was asked for and every request sent.
 */
public class ScriptedChatClientFactory implements ChatClientFactory {

    @FunctionalInterface
    public interface Responder {
        DecodedResponse respond(ChatOptions options, List<Message> messages);
    }

    public record Call(ChatOptions options, String model, List<Message> messages) {}

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Responder         responder;
    private final List<ChatOptions> created = new CopyOnWriteArrayList<>();
    private final List<Call>        calls   = new CopyOnWriteArrayList<>();

    public ScriptedChatClientFactory(Responder responder) {
        this.responder = responder;
    }

    @Override
    public ChatClient create(ChatOptions options) {
        created.add(options);
        return new ChatClient() {
            @Override
            public DecodedResponse send(String model, List<Message> messages, StreamListener listener) {
                calls.add(new Call(options, model, List.copyOf(messages)));
                return responder.respond(options, messages);
            }

            @Override
            public ChatOptions options() {
                return options;
            }
        };
    }

    public List<ChatOptions> created() {
        return Collections.unmodifiableList(created);
    }

    public List<Call> calls() {
        return Collections.unmodifiableList(calls);
    }

    /** Calls made by clients whose options did (or did not) carry tool definitions. */
    public List<Call> callsWithToolsFlag(boolean hasTools) {
        return calls.stream().filter(c -> c.options().hasTools() == hasTools).toList();
    }

    // ── Response helpers ─────────────────────────────────────────────────────

    public static DecodedResponse text(String content) {
        return DecodedResponse.text(content);
    }

    public static DecodedResponse toolCall(String id, String name, String argumentsJson) {
        return DecodedResponse.toolCalls(List.of(ToolCall.of(id, name, json(argumentsJson))));
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }
}
