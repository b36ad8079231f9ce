package com.openforge.ariste.agent;

import com.openforge.ariste.agent.dto.ConversationResponse;
import com.openforge.ariste.agent.dto.SubAgentRequest;
import com.openforge.ariste.agent.dto.SubAgentResponse;
import com.openforge.ariste.agent.dto.SubAgentTaskRequest;
import com.openforge.ariste.agent.dto.TurnRequest;
import com.openforge.ariste.agent.dto.TurnResponse;
import com.openforge.ariste.agent.subagent.SubAgentTask;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for conversations and direct subagent fan-out.
 *
 * Endpoints:
 *   POST   /api/agent/conversations/{id}/turns — run one turn (blocks until the answer)
 *   GET    /api/agent/conversations/{id}       — message history
 *   DELETE /api/agent/conversations/{id}       — clear history
 *   POST   /api/agent/subagents                — run subagent tasks concurrently
 *
 * Live events: subscribe to /topic/agent/{id} over the /ws STOMP endpoint
 * before posting a turn.
 */
@Slf4j
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
public class AgentController {

    private final ConversationService conversationService;

    // ── Turns ────────────────────────────────────────────────────────────────

    @PostMapping("/conversations/{conversationId}/turns")
    public ResponseEntity<TurnResponse> runTurn(@PathVariable String conversationId,
                                                @Valid @RequestBody TurnRequest request) {
        log.info("[Controller] Turn on {} — prompt: {}", conversationId,
                request.prompt().substring(0, Math.min(80, request.prompt().length())));
        TurnResult result = conversationService.runTurn(conversationId, request.prompt());
        return ResponseEntity.ok(TurnResponse.from(conversationId, result));
    }

    // ── History ──────────────────────────────────────────────────────────────

    @GetMapping("/conversations/{conversationId}")
    public ResponseEntity<ConversationResponse> getConversation(@PathVariable String conversationId) {
        return conversationService.history(conversationId)
                .map(messages -> ResponseEntity.ok(ConversationResponse.of(conversationId, messages)))
                .orElseThrow(() -> notFound(conversationId));
    }

    @DeleteMapping("/conversations/{conversationId}")
    public ResponseEntity<Void> clearConversation(@PathVariable String conversationId) {
        if (!conversationService.clear(conversationId)) {
            throw notFound(conversationId);
        }
        return ResponseEntity.noContent().build();
    }

    // ── Subagents ────────────────────────────────────────────────────────────

    @PostMapping("/subagents")
    public ResponseEntity<SubAgentResponse> spawnSubAgents(@Valid @RequestBody SubAgentRequest request) {
        List<SubAgentTask> tasks = request.tasks().stream().map(SubAgentTaskRequest::toTask).toList();
        log.info("[Controller] Fan-out of {} subagent task(s), allOrNothing={}", tasks.size(), request.allOrNothing());

        SubAgentResponse response = request.allOrNothing()
                ? SubAgentResponse.ofResults(
                        conversationService.spawnSubAgentsAllOrNothing(tasks, request.conversationId()))
                : SubAgentResponse.ofOutcomes(
                        conversationService.spawnSubAgents(tasks, request.conversationId()));
        return ResponseEntity.ok(response);
    }

    private static ResponseStatusException notFound(String conversationId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found: " + conversationId);
    }
}
