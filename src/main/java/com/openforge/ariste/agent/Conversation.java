package com.openforge.ariste.agent;

import com.openforge.ariste.llm.model.Message;
import com.openforge.ariste.llm.model.Role;
import com.openforge.ariste.llm.model.ToolCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, insertion-ordered message log: the context sent to the model.
 *
 * Appends are validated so the history stays well formed:
 *   - a tool message must answer a tool call of the most recent assistant
 *     message that requested tools, with nothing but tool messages in between
 *   - each tool call is answered at most once
 *
 * Messages are immutable records; only the list grows. Readers get snapshots.
 */
public class Conversation {

    private final String        id;
    private final List<Message> messages = new ArrayList<>();

    public Conversation(String id) {
        this.id = id;
    }

    public Conversation(String id, List<Message> seed) {
        this(id);
        seed.forEach(this::append);
    }

    public String id() {
        return id;
    }

    public synchronized void append(Message message) {
        if (message.is(Role.TOOL)) {
            validateToolMessage(message);
        }
        messages.add(message);
    }

    public synchronized List<Message> snapshot() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized void clear() {
        messages.clear();
    }

    /**
     * The last {@code limit} non-system messages, with any leading tool
     * messages dropped (their assistant message fell outside the window).
     */
    public synchronized List<Message> recentNonSystem(int limit) {
        return recentNonSystem(messages, limit);
    }

    public static List<Message> recentNonSystem(List<Message> history, int limit) {
        List<Message> nonSystem = history.stream().filter(m -> !m.is(Role.SYSTEM)).toList();
        int from = Math.max(0, nonSystem.size() - limit);
        while (from < nonSystem.size() && nonSystem.get(from).is(Role.TOOL)) {
            from++;
        }
        return List.copyOf(nonSystem.subList(from, nonSystem.size()));
    }

    /** Content of the newest assistant message with non-blank text. */
    public synchronized Optional<String> lastAssistantContent() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message m = messages.get(i);
            if (m.is(Role.ASSISTANT) && !m.content().isBlank()) {
                return Optional.of(m.content());
            }
        }
        return Optional.empty();
    }

    private void validateToolMessage(Message message) {
        String callId = message.toolCallId();
        if (callId == null) {
            throw new IllegalStateException("Tool message without tool_call_id in conversation " + id);
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message previous = messages.get(i);
            if (previous.is(Role.TOOL)) {
                if (callId.equals(previous.toolCallId())) {
                    throw new IllegalStateException("Tool call %s already answered in conversation %s"
                            .formatted(callId, id));
                }
                continue;
            }
            if (previous.is(Role.ASSISTANT) && previous.hasToolCalls()) {
                for (ToolCall call : previous.toolCalls()) {
                    if (callId.equals(call.id())) return;
                }
            }
            break;
        }
        throw new IllegalStateException("Tool message %s does not answer the preceding assistant message in conversation %s"
                .formatted(callId, id));
    }
}
