package com.openforge.ariste.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.ariste.agent.subagent.SubAgentOutcome;
import com.openforge.ariste.agent.subagent.SubAgentRole;
import com.openforge.ariste.agent.subagent.SubAgentTask;
import com.openforge.ariste.config.AppConfig;
import com.openforge.ariste.llm.ChatClient;
import com.openforge.ariste.llm.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AgentControllerTest {

    private ConversationService conversationService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new AppConfig().objectMapper();
        conversationService = mock(ConversationService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new AgentController(conversationService))
                .setControllerAdvice(new AgentExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @Test
    void runTurn_returnsAnswerAndTopic() throws Exception {
        when(conversationService.runTurn("c1", "What is 2+2?")).thenReturn(TurnResult.done("4", 2));

        mockMvc.perform(post("/api/agent/conversations/c1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"What is 2+2?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversation_id").value("c1"))
                .andExpect(jsonPath("$.answer").value("4"))
                .andExpect(jsonPath("$.iterations").value(2))
                .andExpect(jsonPath("$.state").value("DONE"))
                .andExpect(jsonPath("$.ws_subscribe_path").value("/topic/agent/c1"));
    }

    @Test
    void runTurn_rejectsBlankPrompt() throws Exception {
        mockMvc.perform(post("/api/agent/conversations/c1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));

        verifyNoInteractions(conversationService);
    }

    @Test
    void runTurn_mapsLoopFailureTo422() throws Exception {
        when(conversationService.runTurn(anyString(), anyString())).thenThrow(AgentLoopException.iterationLimit());

        mockMvc.perform(post("/api/agent/conversations/c1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"loop\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("agent_loop_failure"))
                .andExpect(jsonPath("$.reason").value("ITERATION_LIMIT"))
                .andExpect(jsonPath("$.message").value("Too many tool call iterations"));
    }

    @Test
    void runTurn_mapsTransportFailureTo502() throws Exception {
        when(conversationService.runTurn(anyString(), anyString()))
                .thenThrow(new ChatClient.ChatException("Provider [ollama] returned HTTP 500: boom"));

        mockMvc.perform(post("/api/agent/conversations/c1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"hi\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("chat_endpoint_failure"));
    }

    @Test
    void getConversation_returnsHistory() throws Exception {
        when(conversationService.history("c1")).thenReturn(Optional.of(List.of(
                Message.user("hi"), Message.assistantText("hello"))));

        mockMvc.perform(get("/api/agent/conversations/c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message_count").value(2))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[1].content").value("hello"));
    }

    @Test
    void getConversation_unknownIs404() throws Exception {
        when(conversationService.history("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/agent/conversations/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void clearConversation_returns204Or404() throws Exception {
        when(conversationService.clear("c1")).thenReturn(true);
        when(conversationService.clear("nope")).thenReturn(false);

        mockMvc.perform(delete("/api/agent/conversations/c1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/agent/conversations/nope")).andExpect(status().isNotFound());
    }

    @Test
    void spawnSubAgents_returnsOutcomesInOrder() throws Exception {
        SubAgentTask plan = SubAgentTask.of(SubAgentRole.PLAN, "Plan", "p");
        SubAgentTask explore = SubAgentTask.of(SubAgentRole.EXPLORE, "Explore", "e");
        when(conversationService.spawnSubAgents(anyList(), isNull())).thenReturn(List.of(
                SubAgentOutcome.success(0, plan, "the plan", "=== envelope ==="),
                SubAgentOutcome.failure(1, explore, new ChatClient.ChatException("endpoint down"))));

        mockMvc.perform(post("/api/agent/subagents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tasks": [
                                  {"subagent_type": "plan", "description": "Plan", "prompt": "p"},
                                  {"subagent_type": "explore", "description": "Explore", "prompt": "e", "include_tools": true}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.all_succeeded").value(false))
                .andExpect(jsonPath("$.outcomes[0].role").value("plan"))
                .andExpect(jsonPath("$.outcomes[0].result").value("the plan"))
                .andExpect(jsonPath("$.outcomes[1].error").value("endpoint down"))
                .andExpect(jsonPath("$.outcomes[1].cause").doesNotExist());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<SubAgentTask>> tasks = ArgumentCaptor.forClass(List.class);
        verify(conversationService).spawnSubAgents(tasks.capture(), isNull());
        assertEquals(SubAgentRole.PLAN, tasks.getValue().get(0).role());
        assertTrue(tasks.getValue().get(1).includeTools());
    }

    @Test
    void spawnSubAgents_allOrNothingReturnsResults() throws Exception {
        when(conversationService.spawnSubAgentsAllOrNothing(anyList(), eq("c1")))
                .thenReturn(List.of("=== Subagent Task Complete ===\n{}"));

        mockMvc.perform(post("/api/agent/subagents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tasks\":[{\"description\":\"d\",\"prompt\":\"p\"}],"
                                + "\"all_or_nothing\":true,\"conversation_id\":\"c1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.all_succeeded").value(true))
                .andExpect(jsonPath("$.results[0]").value("=== Subagent Task Complete ===\n{}"));
    }

    @Test
    void spawnSubAgents_unknownTypeIs400() throws Exception {
        mockMvc.perform(post("/api/agent/subagents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tasks\":[{\"subagent_type\":\"wizard\",\"description\":\"d\",\"prompt\":\"p\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void spawnSubAgents_emptyTaskListIs400() throws Exception {
        mockMvc.perform(post("/api/agent/subagents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tasks\":[]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(conversationService);
    }

    @Test
    void spawnSubAgents_allOrNothingFailureMapsLikeTurnFailure() throws Exception {
        when(conversationService.spawnSubAgentsAllOrNothing(anyList(), any()))
                .thenThrow(AgentLoopException.noResponse());

        mockMvc.perform(post("/api/agent/subagents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tasks\":[{\"description\":\"d\",\"prompt\":\"p\"}],\"all_or_nothing\":true}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("NO_RESPONSE"));
    }
}
