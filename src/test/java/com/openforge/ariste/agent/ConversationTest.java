package com.openforge.ariste.agent;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openforge.ariste.llm.model.Message;
import com.openforge.ariste.llm.model.Role;
import com.openforge.ariste.llm.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationTest {

    @Test
    void append_acceptsToolMessagesAnsweringPrecedingCalls() {
        Conversation conversation = new Conversation("c");
        conversation.append(Message.user("hi"));
        conversation.append(Message.assistantToolCalls("", List.of(call("a"), call("b"))));
        conversation.append(Message.toolResult("b", "second"));
        conversation.append(Message.toolResult("a", "first"));

        assertEquals(4, conversation.size());
    }

    @Test
    void append_rejectsToolMessageWithoutMatchingCall() {
        Conversation conversation = new Conversation("c");
        conversation.append(Message.assistantToolCalls("", List.of(call("a"))));

        assertThrows(IllegalStateException.class, () -> conversation.append(Message.toolResult("zzz", "x")));
    }

    @Test
    void append_rejectsSecondAnswerToSameCall() {
        Conversation conversation = new Conversation("c");
        conversation.append(Message.assistantToolCalls("", List.of(call("a"))));
        conversation.append(Message.toolResult("a", "x"));

        assertThrows(IllegalStateException.class, () -> conversation.append(Message.toolResult("a", "y")));
    }

    @Test
    void append_rejectsToolMessageAfterInterveningUserMessage() {
        Conversation conversation = new Conversation("c");
        conversation.append(Message.assistantToolCalls("", List.of(call("a"))));
        conversation.append(Message.user("interrupt"));

        assertThrows(IllegalStateException.class, () -> conversation.append(Message.toolResult("a", "x")));
    }

    @Test
    void append_rejectsToolMessageWithoutCallId() {
        Conversation conversation = new Conversation("c");

        assertThrows(IllegalStateException.class, () -> conversation.append(
                Message.builder().role(Role.TOOL).content("orphan").build()));
    }

    @Test
    void snapshot_isDetachedFromLaterAppends() {
        Conversation conversation = new Conversation("c");
        conversation.append(Message.user("one"));
        List<Message> snapshot = conversation.snapshot();

        conversation.append(Message.assistantText("two"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Message.user("x")));
    }

    @Test
    void lastAssistantContent_skipsToolCallOnlyMessages() {
        Conversation conversation = new Conversation("c");
        conversation.append(Message.assistantText("earlier answer"));
        conversation.append(Message.assistantToolCalls("", List.of(call("a"))));
        conversation.append(Message.toolResult("a", "tool output"));

        assertEquals("earlier answer", conversation.lastAssistantContent().orElseThrow());
        assertTrue(new Conversation("empty").lastAssistantContent().isEmpty());
    }

    @Test
    void recentNonSystem_keepsLastMessagesWithoutSystem() {
        List<Message> history = new ArrayList<>();
        history.add(Message.system("rules"));
        for (int i = 1; i <= 14; i++) {
            history.add(i % 2 == 1 ? Message.user("u" + i) : Message.assistantText("a" + i));
        }

        List<Message> recent = Conversation.recentNonSystem(history, 10);

        assertEquals(10, recent.size());
        assertEquals("u5", recent.get(0).content());
        assertEquals("a14", recent.get(9).content());
        assertTrue(recent.stream().noneMatch(m -> m.is(Role.SYSTEM)));
    }

    @Test
    void recentNonSystem_dropsLeadingToolMessages() {
        List<Message> history = List.of(
                Message.user("u1"),
                Message.assistantToolCalls("", List.of(call("a"), call("b"))),
                Message.toolResult("a", "ra"),
                Message.toolResult("b", "rb"),
                Message.assistantText("done"));

        List<Message> recent = Conversation.recentNonSystem(history, 3);

        assertEquals(1, recent.size());
        assertEquals("done", recent.get(0).content());
    }

    @Test
    void seedConstructor_validatesLikeAppend() {
        assertThrows(IllegalStateException.class,
                () -> new Conversation("c", List.of(Message.toolResult("a", "x"))));
    }

    private static ToolCall call(String id) {
        return ToolCall.of(id, "read", JsonNodeFactory.instance.objectNode());
    }
}
