package com.openforge.ariste.agent.subagent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.ariste.agent.AgentLoopException;
import com.openforge.ariste.agent.Conversation;
import com.openforge.ariste.agent.Delegator;
import com.openforge.ariste.agent.DispatchContext;
import com.openforge.ariste.agent.ToolDispatcher;
import com.openforge.ariste.agent.event.AgentEvent;
import com.openforge.ariste.agent.event.AgentEventListener;
import com.openforge.ariste.config.AgentProperties;
import com.openforge.ariste.llm.ChatClient;
import com.openforge.ariste.llm.ChatClientFactory;
import com.openforge.ariste.llm.ChatOptions;
import com.openforge.ariste.llm.StreamListener;
import com.openforge.ariste.llm.model.DecodedResponse;
import com.openforge.ariste.llm.model.Message;
import com.openforge.ariste.llm.model.ToolCall;
import com.openforge.ariste.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds and runs isolated subagents.
 *
 * Every subagent gets a fresh {@link Conversation} and its own {@link ChatClient};
 * only the final text crosses back to the caller. Recursion is blocked three ways:
 *   1. a subagent client never carries the delegation tool's definition
 *   2. the subagent's dispatcher runs at delegation depth 1 and rejects "task"
 *   3. spawning from depth 1 or deeper is refused outright
 *
 * Loop shape (per subagent); every model call counts against both ceilings:
 *   for turn in 1..maxTurns:
 *     ++iterations > maxIterationsPerTurn → SUBAGENT_ITERATION_LIMIT
 *     call model → no tool calls? return its content
 *                → tool calls?   dispatch each (errors degrade to tool messages)
 *   turns exhausted → last non-blank assistant text, else NO_RESPONSE
 *
 * With the default limits the iteration ceiling always trips first.
 *
 * Fan-out runs each task on the subagentExecutor pool and joins in request order.
 */
@Slf4j
@Service
public class SubAgentOrchestrator implements Delegator {

    public static final int MAX_TURNS               = 10;
    public static final int MAX_ITERATIONS_PER_TURN = 5;
    public static final int MAX_CONTEXT_MESSAGES    = 10;

    private final ChatClientFactory clientFactory;
    private final AgentProperties   properties;
    private final ToolRegistry      registry;
    private final ObjectMapper      objectMapper;
    private final ExecutorService   subagentExecutor;
    private final ToolDispatcher    dispatcher;
    private final int               maxTurns;
    private final int               maxIterationsPerTurn;
    private final AtomicLong        ids = new AtomicLong();

    @Autowired
    public SubAgentOrchestrator(ChatClientFactory clientFactory,
                                AgentProperties properties,
                                ToolRegistry registry,
                                ObjectMapper objectMapper,
                                @Qualifier("subagentExecutor") ExecutorService subagentExecutor) {
        this(clientFactory, properties, registry, objectMapper, subagentExecutor, MAX_TURNS, MAX_ITERATIONS_PER_TURN);
    }

    SubAgentOrchestrator(ChatClientFactory clientFactory,
                         AgentProperties properties,
                         ToolRegistry registry,
                         ObjectMapper objectMapper,
                         ExecutorService subagentExecutor,
                         int maxTurns,
                         int maxIterationsPerTurn) {
        this.clientFactory    = clientFactory;
        this.properties       = properties;
        this.registry         = registry;
        this.objectMapper     = objectMapper;
        this.subagentExecutor = subagentExecutor;
        this.dispatcher       = new ToolDispatcher(registry, this);
        this.maxTurns             = maxTurns;
        this.maxIterationsPerTurn = maxIterationsPerTurn;
    }

    // ── Single spawn ─────────────────────────────────────────────────────────

    /** Spawns from the top level; returns the rendered report. */
    public String spawn(SubAgentTask task, List<Message> context) {
        return spawn(task, context, 0, "direct", AgentEventListener.NOOP);
    }

    /**
     * Spawns a subagent on behalf of a caller at {@code parentDepth}.
     *
     * @param context the caller's history; used only when the task asks for context
     * @throws AgentLoopException  INVALID_DELEGATION when the caller is itself a subagent,
     *                             SUBAGENT_ITERATION_LIMIT when the model keeps calling tools,
     *                             NO_RESPONSE when the turn ceiling passes without any text
     * @throws ChatClient.ChatException on transport failure
     */
    public String spawn(SubAgentTask task, List<Message> context, int parentDepth,
                        String parentConversationId, AgentEventListener listener) {
        return run(task, context, parentDepth, parentConversationId, listener).render(objectMapper);
    }

    @Override
    public String delegate(SubAgentTask task, DispatchContext parent) {
        List<Message> context = task.includeContext() ? parent.conversation().snapshot() : null;
        return spawn(task, context, parent.delegationDepth(), parent.conversationId(), parent.listener());
    }

    // ── Fan-out ──────────────────────────────────────────────────────────────

    /**
     * Runs every task concurrently and waits for all of them.
     * A failed task yields a failed outcome; siblings are unaffected.
     */
    public List<SubAgentOutcome> spawnAll(List<SubAgentTask> tasks, List<Message> context,
                                          String parentConversationId, AgentEventListener listener) {
        AgentEventListener safe = AgentEventListener.safe(listener);
        log.info("[SubAgents:{}] Spawning {} subagent task(s) concurrently", parentConversationId, tasks.size());
        long started = System.currentTimeMillis();

        List<CompletableFuture<SubAgentOutcome>> futures = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            final int          index = i;
            final SubAgentTask task  = tasks.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    SubAgentReport report = run(task, context, 0, parentConversationId, safe);
                    return SubAgentOutcome.success(index, task, report.result(), report.render(objectMapper));
                } catch (RuntimeException e) {
                    return SubAgentOutcome.failure(index, task, e);
                }
            }, subagentExecutor));
        }

        List<SubAgentOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<SubAgentOutcome> future : futures) {
            outcomes.add(future.join());
        }
        log.info("[SubAgents:{}] All {} subagent task(s) finished in {} ms",
                parentConversationId, tasks.size(), System.currentTimeMillis() - started);
        return outcomes;
    }

    /**
     * Like {@link #spawnAll} but every task must succeed: waits for all, then
     * rethrows the failure of the earliest failed task in request order.
     */
    public List<String> spawnAllOrNothing(List<SubAgentTask> tasks, List<Message> context,
                                          String parentConversationId, AgentEventListener listener) {
        List<SubAgentOutcome> outcomes = spawnAll(tasks, context, parentConversationId, listener);
        List<String> envelopes = new ArrayList<>(outcomes.size());
        for (SubAgentOutcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                throw unwrap(outcome.cause());
            }
            envelopes.add(outcome.envelope());
        }
        return envelopes;
    }

    // ── Core ─────────────────────────────────────────────────────────────────

    SubAgentReport run(SubAgentTask task, List<Message> context, int parentDepth,
                       String parentConversationId, AgentEventListener listener) {
        if (parentDepth >= DispatchContext.MAX_DELEGATION_DEPTH) {
            throw new AgentLoopException(AgentLoopException.Reason.INVALID_DELEGATION,
                    ToolDispatcher.RECURSION_ERROR);
        }

        AgentEventListener safe      = AgentEventListener.safe(listener);
        SubAgentExecution  execution = new SubAgentExecution(ids.incrementAndGet(), task);
        String             tag       = "%d:%s".formatted(execution.id(), task.role().wireName());
        Conversation       conversation = seed(parentConversationId + ":subagent-" + execution.id(), task, context);
        ChatClient         client    = clientFactory.create(optionsFor(task));

        execution.start();
        log.info("[SubAgent#{}] Spawning {} subagent: {} (tools={}, model={})",
                tag, task.role().description(), task.description(), task.toolsEnabled(), client.options().model());
        safe.onEvent(AgentEvent.subAgentStart(parentConversationId, payload(execution)));

        try {
            DispatchContext dispatch = DispatchContext.subAgent(conversation, parentDepth, safe);
            String result = loop(client, conversation, dispatch, tag);
            execution.complete(result);
            log.info("[SubAgent#{}] Completed in {} ms", tag, execution.durationMillis());
            safe.onEvent(AgentEvent.subAgentComplete(parentConversationId, payload(execution), result));
            return new SubAgentReport(task.description(), task.role().description(),
                    client.options().model(), execution.durationMillis(), task.toolsEnabled(), result);
        } catch (RuntimeException e) {
            execution.fail(e.getMessage());
            log.warn("[SubAgent#{}] Failed after {} ms: {}", tag, execution.durationMillis(), e.getMessage());
            safe.onEvent(AgentEvent.subAgentComplete(parentConversationId, payload(execution), e.getMessage()));
            throw e;
        }
    }

    private String loop(ChatClient client, Conversation conversation, DispatchContext dispatch, String tag) {
        int iterations = 0;
        for (int turn = 1; turn <= maxTurns; turn++) {
            if (++iterations > maxIterationsPerTurn) {
                log.warn("[SubAgent#{}] Exceeded {} tool-call iterations", tag, maxIterationsPerTurn);
                throw AgentLoopException.subAgentIterationLimit();
            }

            DecodedResponse response = client.send(conversation.snapshot(), StreamListener.NOOP);

            if (!response.hasToolCalls()) {
                conversation.append(Message.assistantText(response.content()));
                return response.content();
            }

            conversation.append(Message.assistantToolCalls(response.content(), response.toolCalls()));
            for (ToolCall call : response.toolCalls()) {
                conversation.append(Message.toolResult(call.id(), dispatcher.dispatch(call, iterations, dispatch)));
            }
        }

        log.info("[SubAgent#{}] Reached {} turns; returning last assistant text", tag, maxTurns);
        return conversation.lastAssistantContent().orElseThrow(AgentLoopException::noResponse);
    }

    /** System prompt, then trimmed context (when the task asks for it), then the task statement. */
    private Conversation seed(String id, SubAgentTask task, List<Message> context) {
        Conversation conversation = new Conversation(id);
        task.role().systemPrompt().ifPresent(prompt -> conversation.append(Message.system(prompt)));
        if (task.includeContext() && context != null) {
            Conversation.recentNonSystem(context, MAX_CONTEXT_MESSAGES).forEach(conversation::append);
        }
        conversation.append(Message.user(task.taskStatement()));
        return conversation;
    }

    /**
     * Tool-less subagents get no definitions and a non-streaming client;
     * tool-enabled ones get every local tool but never the delegation tool.
     */
    ChatOptions optionsFor(SubAgentTask task) {
        String model = task.model() == null || task.model().isBlank()
                ? properties.modelOrDefault()
                : task.model();
        boolean tools = task.toolsEnabled();
        return ChatOptions.builder()
                .model(model)
                .stream(tools && properties.stream())
                .think(false)
                .verbose(false)
                .tools(tools ? registry.localDefinitions() : List.of())
                .build();
    }

    private static AgentEvent.SubAgentPayload payload(SubAgentExecution execution) {
        return new AgentEvent.SubAgentPayload(
                execution.id(),
                execution.task().role().wireName(),
                execution.task().description(),
                execution.status().name(),
                execution.duration().map(d -> d.toMillis()).orElse(null));
    }

    private static RuntimeException unwrap(RuntimeException e) {
        if (e instanceof CompletionException && e.getCause() instanceof RuntimeException cause) {
            return cause;
        }
        return e;
    }
}
