package me.golemcore.analyst.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.analyst.domain.model.ToolFailureKind;
import me.golemcore.analyst.domain.model.ToolResult;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import me.golemcore.analyst.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InterruptedIOException;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpGetToolTest {

    private static final String URL = "https://intel.example.com/api/ip/10.0.0.5";

    private OkHttpMockEngine mockEngine;
    private AnalystProperties properties;
    private HttpGetTool tool;

    @BeforeEach
    void setUp() {
        mockEngine = new OkHttpMockEngine();
        properties = new AnalystProperties();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(mockEngine).build();
        tool = new HttpGetTool(client, new ObjectMapper(), properties);
    }

    @Test
    void shouldReturnStatusHeadersAndText() {
        mockEngine.enqueue(200, "{\"reputation\":\"malicious\"}", "application/json",
                Map.of("X-RateLimit-Remaining", "42"));

        ToolResult result = tool.execute(Map.of("url", URL, "headers", Map.of("X-Api-Key", "k1"))).join();

        assertTrue(result.isSuccess());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals(200, data.get("status"));
        assertEquals("{\"reputation\":\"malicious\"}", data.get("text"));
        assertEquals("42", ((Map<?, ?>) data.get("headers")).get("X-RateLimit-Remaining"));
        assertTrue(result.getOutput().contains("\"status\":200"));

        OkHttpMockEngine.CapturedRequest request = mockEngine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/api/ip/10.0.0.5", request.target());
        assertEquals("k1", request.headers().get("X-Api-Key"));
    }

    @Test
    void shouldTreatErrorStatusAsSuccessfulCall() {
        mockEngine.enqueueText(404, "not found", "text/plain");

        ToolResult result = tool.execute(Map.of("url", URL)).join();

        assertTrue(result.isSuccess());
        assertEquals(404, ((Map<?, ?>) result.getData()).get("status"));
    }

    @Test
    void shouldTruncateLongBody() {
        properties.getTools().getHttpGet().setMaxBodyChars(10);
        HttpGetTool limited = new HttpGetTool(
                new OkHttpClient.Builder().addInterceptor(mockEngine).build(), new ObjectMapper(), properties);
        mockEngine.enqueueText(200, "abcdefghijklmnopqrstuvwxyz", "text/plain");

        ToolResult result = limited.execute(Map.of("url", URL)).join();

        assertEquals("abcdefghij", ((Map<?, ?>) result.getData()).get("text"));
    }

    @Test
    void shouldReportTimeout() {
        mockEngine.enqueueFailure(new InterruptedIOException("timeout"));

        ToolResult result = tool.execute(Map.of("url", URL, "timeout", 1)).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.TIMEOUT, result.getFailureKind());
    }

    @Test
    void shouldReportConnectionFailure() {
        mockEngine.enqueueFailure(new IOException("connection refused"));

        ToolResult result = tool.execute(Map.of("url", URL)).join();

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().contains("connection refused"));
    }

    @Test
    void shouldRejectMalformedUrl() {
        ToolResult result = tool.execute(Map.of("url", "http://")).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        assertEquals(0, mockEngine.getRequestCount());
    }

    @Test
    void shouldRequireHttpUrlInSchema() {
        Map<String, Object> schema = tool.getDefinition().getInputSchema();
        Map<?, ?> url = (Map<?, ?>) ((Map<?, ?>) schema.get("properties")).get("url");

        assertEquals("^https?://", url.get("pattern"));
        assertEquals(List.of("url"), schema.get("required"));
        assertEquals("http_get", tool.getToolName());
    }
}
