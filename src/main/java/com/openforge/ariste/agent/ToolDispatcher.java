package com.openforge.ariste.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.ariste.agent.event.AgentEvent;
import com.openforge.ariste.agent.subagent.SubAgentTask;
import com.openforge.ariste.llm.model.ToolCall;
import com.openforge.ariste.tool.AgentTool;
import com.openforge.ariste.tool.ToolExecutionException;
import com.openforge.ariste.tool.ToolRegistry;
import com.openforge.ariste.tool.ToolRoute;
import com.openforge.ariste.tool.builtin.TaskTool;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves one tool call to its result text.
 *
 * Routing is a single switch over {@link ToolRoute}. Failure handling follows
 * the caller's {@link DispatchPolicy}; delegation is additionally gated by the
 * caller's delegation depth, regardless of policy.
 */
@Slf4j
public class ToolDispatcher {

    public static final String RECURSION_ERROR      = "Subagents cannot spawn additional subagents";
    public static final String RECURSION_SUGGESTION = "Complete the task yourself using available tools";
    public static final String EXECUTION_ERROR_PREFIX = "Tool execution error: ";

    private final ToolRegistry registry;
    private final Delegator    delegator;

    public ToolDispatcher(ToolRegistry registry, Delegator delegator) {
        this.registry  = registry;
        this.delegator = delegator;
    }

    /**
     * @return the content of the tool message answering {@code call}
     * @throws AgentLoopException under {@link DispatchPolicy#FAIL_FAST} when the
     *                            tool is unknown or fails
     */
    public String dispatch(ToolCall call, int iteration, DispatchContext context) {
        String   name = call.name();
        JsonNode args = call.arguments() == null || !call.arguments().isObject()
                ? JsonNodeFactory.instance.objectNode()
                : call.arguments();

        log.info("[Agent:{}] Executing tool: {} args={}", context.conversationId(), name, args);
        context.listener().onEvent(AgentEvent.toolCall(context.conversationId(), call.id(), name, args, iteration));

        return switch (registry.route(name)) {
            case DELEGATE -> delegate(name, args, iteration, context);
            case LOCAL    -> executeLocal(registry.find(name).orElseThrow(), args, iteration, context);
            case UNKNOWN  -> fail(AgentLoopException.Reason.TOOL_NOT_FOUND,
                    "Tool not found: " + name, name, iteration, context, null);
        };
    }

    // ── Routes ───────────────────────────────────────────────────────────────

    private String executeLocal(AgentTool tool, JsonNode args, int iteration, DispatchContext context) {
        try {
            String result = tool.execute(args);
            context.listener().onEvent(AgentEvent.toolResult(context.conversationId(), tool.name(), result, iteration));
            return result;
        } catch (ToolExecutionException e) {
            return fail(AgentLoopException.Reason.TOOL_FAILED,
                    e.getMessage(), tool.name(), iteration, context, e);
        }
    }

    private String delegate(String name, JsonNode args, int iteration, DispatchContext context) {
        if (!context.mayDelegate()) {
            log.info("[Agent:{}] Rejected delegation at depth {}", context.conversationId(), context.delegationDepth());
            String rejection = recursionRejection();
            context.listener().onEvent(AgentEvent.toolError(context.conversationId(), name, rejection, iteration));
            return rejection;
        }

        SubAgentTask task;
        try {
            task = TaskTool.parse(args);
        } catch (ToolExecutionException e) {
            return fail(AgentLoopException.Reason.TOOL_FAILED,
                    e.getMessage(), name, iteration, context, e);
        }

        String result = delegator.delegate(task, context);
        context.listener().onEvent(AgentEvent.toolResult(context.conversationId(), name, result, iteration));
        return result;
    }

    /**
     * FAIL_FAST throws; DEGRADE returns "Tool execution error: <detail>" as the tool message.
     * An unknown tool aborts with the bare "Tool not found: x" detail.
     */
    private String fail(AgentLoopException.Reason reason, String detail, String toolName,
                        int iteration, DispatchContext context, Throwable cause) {
        String text = EXECUTION_ERROR_PREFIX + detail;
        context.listener().onEvent(AgentEvent.toolError(context.conversationId(), toolName, text, iteration));
        if (context.policy() == DispatchPolicy.FAIL_FAST) {
            String message = reason == AgentLoopException.Reason.TOOL_NOT_FOUND ? detail : text;
            log.warn("[Agent:{}] {} — aborting turn", context.conversationId(), message);
            throw new AgentLoopException(reason, message, cause);
        }
        log.info("[Agent:{}] {} — returned to model", context.conversationId(), text);
        return text;
    }

    /** {"error":"Subagents cannot spawn additional subagents","suggestion":"..."} */
    static String recursionRejection() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", RECURSION_ERROR);
        node.put("suggestion", RECURSION_SUGGESTION);
        return node.toString();
    }
}
