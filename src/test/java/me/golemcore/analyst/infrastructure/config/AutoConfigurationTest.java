package me.golemcore.analyst.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.analyst.domain.model.AgentErrorKind;
import me.golemcore.analyst.domain.model.AgentException;
import me.golemcore.analyst.domain.service.ToolRegistry;
import me.golemcore.analyst.port.outbound.LlmPort;
import me.golemcore.analyst.port.outbound.SearchPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Mock
    private ToolRegistry toolRegistry;
    @Mock
    private LlmPort llmPort;
    @Mock
    private SearchPort searchPort;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(toolRegistry.list()).thenReturn(List.of());
        when(llmPort.getProviderId()).thenReturn("none");
    }

    @Test
    void shouldStartWithDefaultConfiguration() {
        AutoConfiguration autoConfiguration = new AutoConfiguration(new AnalystProperties(), toolRegistry, llmPort,
                searchPort);

        assertDoesNotThrow(autoConfiguration::init);
        verify(toolRegistry).list();
    }

    @Test
    void shouldFailFastOnInvalidDefaultApprovalMode() {
        AnalystProperties properties = new AnalystProperties();
        properties.getAgent().setDefaultApprovalMode("sometimes");
        AutoConfiguration autoConfiguration = new AutoConfiguration(properties, toolRegistry, llmPort, searchPort);

        AgentException ex = assertThrows(AgentException.class, autoConfiguration::init);

        assertEquals(AgentErrorKind.INVALID_ARGUMENT, ex.getKind());
        verify(toolRegistry, never()).list();
    }

    @Test
    void shouldWriteIsoTimestampsAndIgnoreUnknownProperties() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-01-01T12:00:00Z")));
        Payload payload = mapper.readValue("{\"name\":\"x\",\"extra\":1}", Payload.class);

        assertTrue(json.contains("2026-01-01T12:00:00Z"));
        assertEquals("x", payload.name);
    }

    static class Payload {
        public String name;
    }
}
