package me.golemcore.analyst.adapter.inbound.web;

import me.golemcore.analyst.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.analyst.domain.model.AgentErrorKind;
import me.golemcore.analyst.domain.model.AgentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapAgentErrorKinds() {
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(AgentErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(AgentErrorKind.SESSION_DONE));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(AgentErrorKind.ACTION_ALREADY_PENDING));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(AgentErrorKind.NO_PENDING_ACTION));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(AgentErrorKind.INVALID_ARGUMENT));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(AgentErrorKind.UNKNOWN_TOOL));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(AgentErrorKind.INVALID_ARGUMENTS));
        assertEquals(HttpStatus.LOCKED, GlobalExceptionHandler.statusFor(AgentErrorKind.SESSION_BUSY));
    }

    @Test
    void shouldHandleAgentException() {
        AgentException ex = new AgentException(AgentErrorKind.ACTION_ALREADY_PENDING,
                "Session s1 has an action awaiting approval");

        StepVerifier.create(handler.handleAgentException(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(409, body.getStatus());
                    assertEquals("ACTION_ALREADY_PENDING", body.getKind());
                    assertEquals("Session s1 has an action awaiting approval", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.BAD_REQUEST, "Malformed body");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("Malformed body", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret stack detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
