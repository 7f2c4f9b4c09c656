package me.golemcore.analyst.adapter.inbound.web.controller;

import me.golemcore.analyst.adapter.inbound.web.dto.CreateSessionRequest;
import me.golemcore.analyst.adapter.inbound.web.dto.PostMessageRequest;
import me.golemcore.analyst.adapter.inbound.web.dto.RunRequest;
import me.golemcore.analyst.adapter.inbound.web.dto.StopResponse;
import me.golemcore.analyst.domain.model.AgentErrorKind;
import me.golemcore.analyst.domain.model.AgentException;
import me.golemcore.analyst.domain.model.AgentSession;
import me.golemcore.analyst.domain.model.ApprovalMode;
import me.golemcore.analyst.domain.model.RunResult;
import me.golemcore.analyst.domain.model.StepResult;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.service.AgentOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class AgentControllerTest {

    private static final String SESSION_ID = "s1";

    private AgentOrchestrator orchestrator;
    private AgentController controller;
    private AgentSession session;

    @BeforeEach
    void setUp() {
        orchestrator = mock(AgentOrchestrator.class);
        controller = new AgentController(orchestrator);
        session = AgentSession.builder().id(SESSION_ID).approvalMode(ApprovalMode.MANUAL).build();
    }

    @Test
    void shouldCreateSessionWithRequestedMode() {
        when(orchestrator.createSession("manual")).thenReturn(session);

        StepVerifier.create(controller.createSession(new CreateSessionRequest("manual")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertSame(session, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldCreateSessionWithoutBody() {
        when(orchestrator.createSession(null)).thenReturn(session);

        StepVerifier.create(controller.createSession(null))
                .assertNext(response -> assertEquals(HttpStatus.CREATED, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldGetSession() {
        when(orchestrator.getSession(SESSION_ID)).thenReturn(session);

        StepVerifier.create(controller.getSession(SESSION_ID))
                .assertNext(response -> assertSame(session, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldPropagateNotFound() {
        when(orchestrator.getSession("missing")).thenThrow(AgentException.notFound("missing"));

        StepVerifier.create(controller.getSession("missing"))
                .expectErrorMatches(error -> error instanceof AgentException agentError
                        && agentError.getKind() == AgentErrorKind.NOT_FOUND)
                .verify();
    }

    @Test
    void shouldDeleteSession() {
        StepVerifier.create(controller.deleteSession(SESSION_ID))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();

        verify(orchestrator).deleteSession(SESSION_ID);
    }

    @Test
    void shouldPostMessage() {
        when(orchestrator.postMessage(SESSION_ID, "Investigate ssh brute force in last 24h")).thenReturn(session);

        StepVerifier.create(controller.postMessage(SESSION_ID,
                new PostMessageRequest("Investigate ssh brute force in last 24h")))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldStep() {
        StepResult result = StepResult.builder().status(StepResult.Status.AWAITING_APPROVAL).build();
        when(orchestrator.step(SESSION_ID)).thenReturn(result);

        StepVerifier.create(controller.step(SESSION_ID))
                .assertNext(response -> assertSame(result, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldRunWithRequestedLimit() {
        RunResult result = RunResult.builder().status(RunResult.Status.FINAL).build();
        when(orchestrator.run(SESSION_ID, 1)).thenReturn(result);

        StepVerifier.create(controller.run(SESSION_ID, new RunRequest(1)))
                .assertNext(response -> assertEquals(RunResult.Status.FINAL, response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldRunWithDefaultLimitWithoutBody() {
        when(orchestrator.run(SESSION_ID, null)).thenReturn(RunResult.builder()
                .status(RunResult.Status.STEP_LIMIT_REACHED)
                .build());

        StepVerifier.create(controller.run(SESSION_ID, null))
                .assertNext(response -> assertEquals(RunResult.Status.STEP_LIMIT_REACHED,
                        response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldApproveAndReject() {
        when(orchestrator.approve(SESSION_ID)).thenReturn(StepResult.builder()
                .status(StepResult.Status.EXECUTED).build());
        when(orchestrator.reject(SESSION_ID)).thenReturn(StepResult.builder()
                .status(StepResult.Status.DISCARDED).build());

        StepVerifier.create(controller.approve(SESSION_ID))
                .assertNext(response -> assertEquals(StepResult.Status.EXECUTED, response.getBody().getStatus()))
                .verifyComplete();
        StepVerifier.create(controller.reject(SESSION_ID))
                .assertNext(response -> assertEquals(StepResult.Status.DISCARDED, response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldPropagateNoPendingAction() {
        when(orchestrator.approve(SESSION_ID)).thenThrow(
                new AgentException(AgentErrorKind.NO_PENDING_ACTION, "nothing pending"));

        StepVerifier.create(controller.approve(SESSION_ID))
                .expectError(AgentException.class)
                .verify();
    }

    @Test
    void shouldRequestStop() {
        when(orchestrator.requestStop(SESSION_ID)).thenReturn(true);

        StepVerifier.create(controller.stop(SESSION_ID))
                .assertNext(response -> {
                    StopResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(SESSION_ID, body.getSessionId());
                    assertTrue(body.isRunInFlight());
                })
                .verifyComplete();
    }

    @Test
    void shouldListTools() {
        List<ToolDefinition> tools = List.of(ToolDefinition.simple("es_search", "search"),
                ToolDefinition.simple("sleep", "sleep"));
        when(orchestrator.listTools()).thenReturn(tools);

        StepVerifier.create(controller.listTools())
                .assertNext(response -> assertEquals(tools, response.getBody()))
                .verifyComplete();
        verify(orchestrator, never()).step(any());
    }
}
