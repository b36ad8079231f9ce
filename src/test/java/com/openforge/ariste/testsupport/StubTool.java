package com.openforge.ariste.testsupport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.AgentTool;
import com.openforge.ariste.tool.ToolExecutionException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** A named tool that returns a fixed result, or fails with a fixed message. */
public class StubTool implements AgentTool {

    private final ToolDefinition definition;
    private final String         result;
    private final String         failure;
    private final List<JsonNode> invocations = new CopyOnWriteArrayList<>();

    private StubTool(String name, String result, String failure) {
        this.definition = ToolDefinition.of(name, "stub " + name, JsonNodeFactory.instance.objectNode().put("type", "object"));
        this.result     = result;
        this.failure    = failure;
    }

    public static StubTool returning(String name, String result) {
        return new StubTool(name, result, null);
    }

    public static StubTool failing(String name, String failure) {
        return new StubTool(name, null, failure);
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        invocations.add(arguments);
        if (failure != null) {
            throw new ToolExecutionException(failure);
        }
        return result;
    }

    public List<JsonNode> invocations() {
        return invocations;
    }
}
