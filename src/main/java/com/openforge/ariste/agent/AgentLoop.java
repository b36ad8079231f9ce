package com.openforge.ariste.agent;

import com.openforge.ariste.agent.event.AgentEvent;
import com.openforge.ariste.agent.event.AgentEventListener;
import com.openforge.ariste.agent.event.StreamEventBridge;
import com.openforge.ariste.agent.subagent.SubAgentOrchestrator;
import com.openforge.ariste.config.AgentProperties;
import com.openforge.ariste.llm.ChatClient;
import com.openforge.ariste.llm.ChatClientFactory;
import com.openforge.ariste.llm.model.DecodedResponse;
import com.openforge.ariste.llm.model.Message;
import com.openforge.ariste.llm.model.ToolCall;
import com.openforge.ariste.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The top-level tool-calling loop: one user prompt in, one final answer out.
 *
 * Loop shape:
 *   append user prompt
 *   for iteration in 1..MAX_ITERATIONS:
 *     AWAITING_MODEL     — send the full history, wait for the decoded response
 *     no tool calls?     — append the answer → DONE
 *     DISPATCHING_TOOLS  — append the assistant tool-call message, then one tool
 *                          message per call, in request order
 *   ceiling passed → FAILED ("Too many tool call iterations")
 *
 * Any failure (transport, unknown tool, tool error, ceiling) ends the turn with
 * an exception. Messages appended before the failure stay in the conversation.
 *
 * One model call is in flight per turn; callers serialize turns per conversation.
 */
@Slf4j
@Service
public class AgentLoop {

    public static final int MAX_ITERATIONS = 5;

    private final ChatClient     client;
    private final ToolDispatcher dispatcher;

    public AgentLoop(ChatClientFactory clientFactory,
                     AgentProperties properties,
                     ToolRegistry registry,
                     SubAgentOrchestrator orchestrator) {
        this.client     = clientFactory.create(properties.chatOptions(registry.definitions()));
        this.dispatcher = new ToolDispatcher(registry, orchestrator);
    }

    public TurnResult runTurn(Conversation conversation, String prompt, AgentEventListener listener) {
        AgentEventListener events = AgentEventListener.safe(listener);
        String id = conversation.id();

        conversation.append(Message.user(prompt));
        events.onEvent(AgentEvent.turnStart(id, prompt));
        log.info("[Agent:{}] Turn started. history={} prompt-length={}", id, conversation.size(), prompt.length());

        DispatchContext context = DispatchContext.topLevel(conversation, events);
        TurnState state = TurnState.AWAITING_MODEL;
        int iteration = 0;
        try {
            while (true) {
                iteration++;
                if (iteration > MAX_ITERATIONS) {
                    log.warn("[Agent:{}] Max iterations ({}) reached.", id, MAX_ITERATIONS);
                    throw AgentLoopException.iterationLimit();
                }

                events.onEvent(AgentEvent.iterationStart(id, iteration));
                DecodedResponse response = client.send(conversation.snapshot(),
                        new StreamEventBridge(id, iteration, events));

                if (!response.hasToolCalls()) {
                    conversation.append(Message.assistantText(response.content()));
                    events.onEvent(AgentEvent.finalAnswer(id, response.content(), iteration));
                    log.info("[Agent:{}] Completed in {} iteration(s).", id, iteration);
                    return TurnResult.done(response.content(), iteration);
                }

                state = TurnState.DISPATCHING_TOOLS;
                conversation.append(Message.assistantToolCalls(response.content(), response.toolCalls()));
                for (ToolCall call : response.toolCalls()) {
                    String result = dispatcher.dispatch(call, iteration, context);
                    conversation.append(Message.toolResult(call.id(), result));
                }
                state = TurnState.AWAITING_MODEL;
            }
        } catch (RuntimeException e) {
            log.error("[Agent:{}] Turn failed in state {} at iteration {}: {}", id, state, iteration, e.getMessage());
            events.onEvent(AgentEvent.error(id, e.getMessage(), iteration));
            throw e;
        }
    }

    public ChatClient client() {
        return client;
    }
}
