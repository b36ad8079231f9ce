package com.openforge.ariste.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.AgentTool;
import com.openforge.ariste.tool.ToolArguments;
import com.openforge.ariste.tool.ToolExecutionException;
import com.openforge.ariste.tool.ToolSchemas;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates and renders the model's todo list. Holds no state between calls:
 * the model always sends the complete list.
 */
public class TodoWriteTool implements AgentTool {

    enum Status {
        PENDING("pending", "○"),
        IN_PROGRESS("in_progress", "◐"),
        COMPLETED("completed", "●");

        final String wireName;
        final String icon;

        Status(String wireName, String icon) {
            this.wireName = wireName;
            this.icon     = icon;
        }

        static Status parse(String value) throws ToolExecutionException {
            for (Status status : values()) {
                if (status.wireName.equals(value)) return status;
            }
            throw new ToolExecutionException(
                    "Invalid status '%s': must be one of 'pending', 'in_progress', or 'completed'".formatted(value));
        }
    }

    record TodoItem(String content, Status status, String activeForm) {}

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "todo_write",
            "Update the todo list to track progress and organize tasks",
            """
            {
              "type": "object",
              "properties": {
                "todos": {
                  "type": "array",
                  "description": "The updated todo list with all current tasks",
                  "items": {
                    "type": "object",
                    "properties": {
                      "content": {
                        "type": "string",
                        "description": "The task description in imperative form (e.g., 'Run tests')"
                      },
                      "status": {
                        "type": "string",
                        "enum": ["pending", "in_progress", "completed"],
                        "description": "The current status of the task"
                      },
                      "activeForm": {
                        "type": "string",
                        "description": "The task description in present continuous form (e.g., 'Running tests')"
                      }
                    },
                    "required": ["content", "status", "activeForm"]
                  }
                }
              },
              "required": ["todos"]
            }
            """);

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        JsonNode todos = arguments.get("todos");
        if (todos == null || !todos.isArray()) {
            throw new ToolExecutionException("Missing 'todos' argument or it's not an array");
        }

        List<TodoItem> items = new ArrayList<>();
        for (JsonNode node : todos) {
            items.add(new TodoItem(
                    field(node, "content"),
                    Status.parse(field(node, "status")),
                    field(node, "activeForm")));
        }

        StringBuilder out = new StringBuilder("Todo list updated:\n");
        int pending = 0, inProgress = 0, completed = 0;
        for (TodoItem item : items) {
            out.append("  ").append(item.status().icon).append(' ').append(item.activeForm()).append('\n');
            switch (item.status()) {
                case PENDING     -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED   -> completed++;
            }
        }
        out.append("\nTotal: %d tasks (%d pending, %d in progress, %d completed)"
                .formatted(items.size(), pending, inProgress, completed));
        return out.toString();
    }

    private static String field(JsonNode item, String name) throws ToolExecutionException {
        JsonNode value = item.get(name);
        if (value == null || !value.isTextual()) {
            throw new ToolExecutionException("Missing '%s' field in todo item".formatted(name));
        }
        return value.asText();
    }
}
