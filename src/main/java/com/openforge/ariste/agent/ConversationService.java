package com.openforge.ariste.agent;

import com.openforge.ariste.agent.event.AgentEventListener;
import com.openforge.ariste.agent.subagent.SubAgentOrchestrator;
import com.openforge.ariste.agent.subagent.SubAgentOutcome;
import com.openforge.ariste.agent.subagent.SubAgentTask;
import com.openforge.ariste.llm.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-memory conversations keyed by id. Nothing is persisted.
 *
 * Turns on the same conversation run one at a time; different conversations
 * run independently. Reads take snapshots and never wait for a running turn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final AgentLoop            agentLoop;
    private final SubAgentOrchestrator orchestrator;
    private final AgentEventListener   agentEventPublisher;

    private final Map<String, Conversation>  conversations = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> turnLocks     = new ConcurrentHashMap<>();

    // ── Turns ────────────────────────────────────────────────────────────────

    /**
     * Runs one turn, creating the conversation on first use. A failed turn
     * leaves everything appended so far in place.
     */
    public TurnResult runTurn(String conversationId, String prompt) {
        Conversation conversation = conversations.computeIfAbsent(conversationId, Conversation::new);
        ReentrantLock lock = turnLocks.computeIfAbsent(conversationId, id -> new ReentrantLock());
        lock.lock();
        try {
            return agentLoop.runTurn(conversation, prompt, agentEventPublisher);
        } finally {
            lock.unlock();
        }
    }

    // ── History ──────────────────────────────────────────────────────────────

    public Optional<List<Message>> history(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId)).map(Conversation::snapshot);
    }

    /** Clears the history; waits for a running turn on the same conversation. */
    public boolean clear(String conversationId) {
        Conversation conversation = conversations.get(conversationId);
        if (conversation == null) return false;
        ReentrantLock lock = turnLocks.computeIfAbsent(conversationId, id -> new ReentrantLock());
        lock.lock();
        try {
            conversation.clear();
        } finally {
            lock.unlock();
        }
        log.info("[Conversation:{}] History cleared", conversationId);
        return true;
    }

    // ── Subagents ────────────────────────────────────────────────────────────

    /**
     * Fans tasks out to subagents. Tasks that ask for context receive the
     * recent history of {@code conversationId}, when that conversation exists.
     */
    public List<SubAgentOutcome> spawnSubAgents(List<SubAgentTask> tasks, String conversationId) {
        return orchestrator.spawnAll(tasks, contextOf(conversationId), parentId(conversationId), agentEventPublisher);
    }

    public List<String> spawnSubAgentsAllOrNothing(List<SubAgentTask> tasks, String conversationId) {
        return orchestrator.spawnAllOrNothing(tasks, contextOf(conversationId), parentId(conversationId), agentEventPublisher);
    }

    private List<Message> contextOf(String conversationId) {
        if (conversationId == null) return null;
        Conversation conversation = conversations.get(conversationId);
        return conversation == null ? null : conversation.snapshot();
    }

    private static String parentId(String conversationId) {
        return conversationId == null ? "direct" : conversationId;
    }
}
