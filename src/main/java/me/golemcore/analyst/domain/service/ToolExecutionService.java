package me.golemcore.analyst.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.component.ToolComponent;
import me.golemcore.analyst.domain.model.AgentErrorKind;
import me.golemcore.analyst.domain.model.AgentException;
import me.golemcore.analyst.domain.model.AgentSession;
import me.golemcore.analyst.domain.model.Message;
import me.golemcore.analyst.domain.model.PendingAction;
import me.golemcore.analyst.domain.model.ToolExecutionOutcome;
import me.golemcore.analyst.domain.model.ToolFailureKind;
import me.golemcore.analyst.domain.model.ToolResult;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import me.golemcore.analyst.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes cleared tool invocations and records their outcome in the session
 * as a {@code tool} message. Failures of any kind (unknown tool, bad
 * arguments, tool errors, timeouts) become failed results; nothing thrown by a
 * tool escapes to the orchestrator and the session stays active.
 *
 * <p>
 * Callers must hold the session lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolExecutionService {

    static final String DATA_OK = "ok";
    static final String DATA_OUTPUT = "output";
    static final String DATA_ERROR = "error";
    static final String DATA_FAILURE_KIND = "failureKind";
    static final String DATA_RESULT = "result";

    private final ToolRegistry toolRegistry;
    private final SessionPort sessionPort;
    private final AnalystProperties properties;
    private final Clock clock;

    /**
     * Runs a tool for the session and appends the resulting tool message.
     *
     * @throws AgentException
     *             {@code NOT_FOUND} if the session does not exist
     */
    public ToolExecutionOutcome execute(String sessionId, String toolName, Map<String, Object> arguments) {
        AgentSession session = sessionPort.get(sessionId).orElseThrow(() -> AgentException.notFound(sessionId));
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        long start = clock.millis();
        ToolResult result = invoke(toolName, args);
        long durationMs = clock.millis() - start;

        String content = truncateToolResult(buildToolMessageContent(result), toolName);
        record(session, toolName, result, content, null);
        if (result.isSuccess()) {
            log.info("[Tools] Session {}: {} succeeded in {}ms", sessionId, toolName, durationMs);
        } else {
            log.warn("[Tools] Session {}: {} failed in {}ms ({}): {}", sessionId, toolName, durationMs,
                    result.getFailureKind(), result.getError());
        }
        return new ToolExecutionOutcome(toolName, args, result, content, durationMs);
    }

    /**
     * Records a discarded pending action as a rejected tool outcome.
     */
    public ToolExecutionOutcome recordRejection(String sessionId, PendingAction action) {
        AgentSession session = sessionPort.get(sessionId).orElseThrow(() -> AgentException.notFound(sessionId));
        ToolResult result = ToolResult.failure(ToolFailureKind.REJECTED,
                "Action rejected by analyst: " + action.getDescription());
        String content = buildToolMessageContent(result);
        record(session, action.getToolName(), result, content, Message.KIND_DISCARDED);
        log.info("[Tools] Session {}: {} rejected", sessionId, action.getToolName());
        return new ToolExecutionOutcome(action.getToolName(), action.getArguments(), result, content, 0);
    }

    private ToolResult invoke(String toolName, Map<String, Object> args) {
        CompletableFuture<ToolResult> future;
        ToolComponent tool;
        try {
            tool = toolRegistry.validate(toolName, args);
            future = toolRegistry.invoke(toolName, args);
        } catch (AgentException e) {
            ToolFailureKind kind = e.getKind() == AgentErrorKind.UNKNOWN_TOOL ? ToolFailureKind.UNKNOWN_TOOL
                    : ToolFailureKind.INVALID_ARGUMENTS;
            return ToolResult.failure(kind, e.getMessage());
        }

        Duration timeout = tool.getExecutionTimeout() != null ? tool.getExecutionTimeout()
                : properties.getTools().getDefaultTimeout();
        try {
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result
                    : ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool " + toolName + " timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution interrupted");
        } catch (ExecutionException e) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + ToolRegistry.rootMessage(e));
        }
    }

    private void record(AgentSession session, String toolName, ToolResult result, String content, String kind) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(DATA_OK, result.isSuccess());
        data.put(DATA_OUTPUT, result.getOutput());
        data.put(DATA_ERROR, result.getError());
        data.put(DATA_FAILURE_KIND, result.getFailureKind() != null ? result.getFailureKind().name() : null);
        if (result.getData() != null) {
            data.put(DATA_RESULT, result.getData());
        }

        sessionPort.appendMessage(session.getId(), Message.builder()
                .role(Message.ROLE_TOOL)
                .toolName(toolName)
                .content(content)
                .data(data)
                .metadata(kind != null ? new LinkedHashMap<>(Map.of(Message.META_KIND, kind)) : null)
                .timestamp(clock.instant())
                .build());
        if (!result.isSuccess()) {
            session.setLastError(toolName + ": " + result.getError());
        }
    }

    private String buildToolMessageContent(ToolResult result) {
        if (result.isSuccess()) {
            return result.getOutput() != null ? result.getOutput() : "";
        }
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        return "Error: " + result.getError();
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        int maxChars = properties.getTools().getMaxResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. Narrow the query or request fewer results.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
