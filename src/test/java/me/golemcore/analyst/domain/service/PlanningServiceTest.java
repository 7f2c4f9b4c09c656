package me.golemcore.analyst.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.analyst.domain.model.LlmRequest;
import me.golemcore.analyst.domain.model.LlmResponse;
import me.golemcore.analyst.domain.model.Message;
import me.golemcore.analyst.domain.model.PlanDecision;
import me.golemcore.analyst.domain.model.StepResult.PlannerSource;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import me.golemcore.analyst.port.outbound.LlmPort;
import me.golemcore.analyst.port.outbound.SearchPort;
import me.golemcore.analyst.tools.SearchTool;
import me.golemcore.analyst.tools.SleepTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PlanningServiceTest {

    private static final String SESSION_ID = "s1";

    private LlmPort llmPort;
    private AnalystProperties properties;
    private ToolRegistry registry;
    private PlanningService service;
    private List<Message> history;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        properties = new AnalystProperties();
        properties.getPlanner().setTimeout(Duration.ofMillis(200));
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        registry = new ToolRegistry(List.of(
                new SearchTool(mock(SearchPort.class), objectMapper, properties),
                new SleepTool(properties)), new ToolArgumentValidator());
        service = new PlanningService(llmPort, new PlanDecisionParser(objectMapper, registry),
                new HeuristicPlanner(), objectMapper, properties);
        history = new ArrayList<>(List.of(Message.user("Investigate ssh brute force in last 24h", null)));
    }

    @Test
    void shouldReturnLlmDecision() {
        respond("{\"thought\":\"search\",\"action\":\"es_search\",\"input\":{\"query\":{\"match_all\":{}}}}");

        PlanningService.PlanningOutcome outcome = service.plan(SESSION_ID, history, registry.list());

        assertEquals(PlannerSource.LLM, outcome.source());
        assertFalse(outcome.isFallback());
        assertNull(outcome.fallbackReason());
        assertEquals("es_search", ((PlanDecision.ToolInvocation) outcome.decision()).toolName());
    }

    @Test
    void shouldFallBackWhenBackendUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        PlanningService.PlanningOutcome outcome = service.plan(SESSION_ID, history, registry.list());

        assertTrue(outcome.isFallback());
        assertInstanceOf(PlanDecision.FinalAnswer.class, outcome.decision());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldFallBackOnTimeout() {
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any())).thenReturn(pending);

        PlanningService.PlanningOutcome outcome = service.plan(SESSION_ID, history, registry.list());

        assertTrue(outcome.isFallback());
        assertTrue(outcome.fallbackReason().contains("timed out"));
        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldFallBackOnBackendError() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("HTTP 500")));

        PlanningService.PlanningOutcome outcome = service.plan(SESSION_ID, history, registry.list());

        assertTrue(outcome.isFallback());
        assertTrue(outcome.fallbackReason().contains("HTTP 500"));
    }

    @Test
    void shouldFallBackWhenAdapterThrows() {
        when(llmPort.chat(any())).thenThrow(new IllegalArgumentException("bad request"));

        assertTrue(service.plan(SESSION_ID, history, registry.list()).isFallback());
    }

    @Test
    void shouldFallBackOnInvalidJson() {
        respond("I would search the alerts index first.");

        PlanningService.PlanningOutcome outcome = service.plan(SESSION_ID, history, registry.list());

        assertTrue(outcome.isFallback());
        assertTrue(outcome.fallbackReason().startsWith("planning protocol violation"));
    }

    @Test
    void shouldFallBackOnUnknownTool() {
        respond("{\"thought\":\"x\",\"action\":\"shell\",\"input\":{\"command\":\"id\"}}");

        PlanningService.PlanningOutcome outcome = service.plan(SESSION_ID, history, registry.list());

        assertTrue(outcome.isFallback());
        assertTrue(outcome.fallbackReason().contains("Unknown tool"));
    }

    @Test
    void shouldFallBackOnEmptyResponse() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(service.plan(SESSION_ID, history, registry.list()).isFallback());
    }

    @Test
    void shouldSendOnlyRecentContextWithTruncation() {
        properties.getPlanner().setContextMessages(2);
        properties.getPlanner().setMaxMessageChars(10);
        history.add(Message.agent("Running search", Message.KIND_DECISION, null));
        history.add(Message.builder().role(Message.ROLE_TOOL).toolName("es_search")
                .content("{\"total\":12345678901234}").build());
        respond("{\"action\":\"final\",\"input\":{\"answer\":\"done\"}}");

        service.plan(SESSION_ID, history, registry.list());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        String dialogue = request.getMessages().get(0).getContent();
        assertFalse(dialogue.contains("Investigate ssh"));
        assertTrue(dialogue.contains("\"name\":\"es_search\""));
        assertTrue(dialogue.contains("...[truncated]"));
        assertEquals(SESSION_ID, request.getSessionId());
        assertEquals(properties.getPlanner().getMaxTokens(), request.getMaxTokens());
    }

    @Test
    void shouldDescribeToolsInSystemPrompt() {
        List<ToolDefinition> catalog = registry.list();

        String prompt = service.buildSystemPrompt(catalog);

        assertTrue(prompt.contains("- es_search: "));
        assertTrue(prompt.contains("- sleep: "));
        assertTrue(prompt.contains("\"action\":\"final\""));
    }

    private void respond(String content) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).build()));
    }
}
