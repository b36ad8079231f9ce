package com.openforge.ariste.tool;

import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.builtin.TaskTool;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed, ordered tool set of the process.
 *
 * Local tools are looked up by exact name. The delegation tool is not a local
 * tool: it only contributes a definition and resolves to {@link ToolRoute#DELEGATE}.
 * The registry is immutable after construction and shared by every agent.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> localTools;
    private final List<ToolDefinition>   localDefinitions;
    private final List<ToolDefinition>   allDefinitions;

    public ToolRegistry(List<AgentTool> tools) {
        Map<String, AgentTool> byName = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            String name = tool.name();
            if (TaskTool.NAME.equals(name)) {
                throw new IllegalArgumentException("'" + name + "' is reserved for delegation");
            }
            if (byName.putIfAbsent(name, tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + name);
            }
        }
        this.localTools = Collections.unmodifiableMap(byName);
        this.localDefinitions = byName.values().stream().map(AgentTool::definition).toList();

        List<ToolDefinition> all = new ArrayList<>(localDefinitions);
        all.add(TaskTool.DEFINITION);
        this.allDefinitions = List.copyOf(all);

        log.debug("[ToolRegistry] Registered tools: {}", names());
    }

    public ToolRoute route(String name) {
        if (TaskTool.NAME.equals(name)) return ToolRoute.DELEGATE;
        return localTools.containsKey(name) ? ToolRoute.LOCAL : ToolRoute.UNKNOWN;
    }

    public Optional<AgentTool> find(String name) {
        return Optional.ofNullable(localTools.get(name));
    }

    /** Every definition, delegation tool last. Given to the top-level agent. */
    public List<ToolDefinition> definitions() {
        return allDefinitions;
    }

    /** Definitions without the delegation tool. Given to tool-enabled subagents. */
    public List<ToolDefinition> localDefinitions() {
        return localDefinitions;
    }

    public List<String> names() {
        return allDefinitions.stream().map(ToolDefinition::name).toList();
    }
}
