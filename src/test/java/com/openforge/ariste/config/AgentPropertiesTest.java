package com.openforge.ariste.config;

import com.openforge.ariste.llm.ChatOptions;
import com.openforge.ariste.llm.DecodingMode;
import com.openforge.ariste.tool.builtin.TaskTool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentPropertiesTest {

    @Test
    void chatUrl_joinsBaseAndPathWithoutDoubleSlash() {
        assertEquals("http://localhost:11434/api/chat", properties("http://localhost:11434/", "qwen3").chatUrl());
        assertEquals("http://127.0.0.1:11434/api/chat", properties("", "qwen3").chatUrl());
    }

    @Test
    void modelOrDefault_fallsBackWhenBlank() {
        assertEquals("qwen3", properties("http://x", " ").modelOrDefault());
        assertEquals("llama3.2", properties("http://x", "llama3.2").modelOrDefault());
    }

    @Test
    void chatOptions_carriesFlagsAndTools() {
        ChatOptions options = properties("http://x", "qwen3").chatOptions(List.of(TaskTool.DEFINITION));

        assertEquals("qwen3", options.model());
        assertTrue(options.stream());
        assertTrue(options.verbose());
        assertEquals(1, options.tools().size());
    }

    private static AgentProperties properties(String baseUrl, String model) {
        return new AgentProperties("ollama", baseUrl, "/api/chat", model,
                true, false, true, 300, DecodingMode.LENIENT, 8, ".");
    }
}
