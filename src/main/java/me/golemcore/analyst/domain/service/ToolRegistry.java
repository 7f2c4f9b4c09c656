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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.component.ToolComponent;
import me.golemcore.analyst.domain.model.AgentErrorKind;
import me.golemcore.analyst.domain.model.AgentException;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.model.ToolFailureKind;
import me.golemcore.analyst.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide catalog of investigation tools. Shared read-only across
 * sessions; registration happens at startup.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final ToolArgumentValidator argumentValidator;

    public ToolRegistry(List<ToolComponent> toolComponents, ToolArgumentValidator argumentValidator) {
        this.argumentValidator = argumentValidator;
        if (toolComponents != null) {
            toolComponents.forEach(this::registerTool);
        }
    }

    public void registerTool(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            log.warn("[Tools] Skipping tool without a name: {}", tool.getClass().getSimpleName());
            return;
        }
        tools.put(name, tool);
        log.debug("[Tools] Registered tool: {} (enabled={})", name, tool.isEnabled());
    }

    /**
     * Enabled tool definitions ordered by name.
     */
    public List<ToolDefinition> list() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .sorted(Comparator.comparing(ToolDefinition::getName))
                .toList();
    }

    public Optional<ToolComponent> find(String name) {
        ToolComponent tool = tools.get(sanitizeToolName(name));
        if (tool == null || !tool.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(tool);
    }

    /**
     * Resolves the tool and checks the arguments against its schema.
     *
     * @throws AgentException
     *             {@code UNKNOWN_TOOL} or {@code INVALID_ARGUMENTS}
     */
    public ToolComponent validate(String name, Map<String, Object> arguments) {
        ToolComponent tool = find(name).orElseThrow(() -> new AgentException(AgentErrorKind.UNKNOWN_TOOL,
                "Unknown tool: " + name + ". Available tools: " + availableNames()));
        List<String> violations = argumentValidator.validate(tool.getDefinition(), arguments);
        if (!violations.isEmpty()) {
            throw new AgentException(AgentErrorKind.INVALID_ARGUMENTS,
                    "Invalid arguments for " + tool.getToolName() + ": " + String.join("; ", violations));
        }
        return tool;
    }

    /**
     * Validates and invokes a tool. Runtime failures of the tool complete the
     * future with a failed {@link ToolResult}.
     *
     * @throws AgentException
     *             {@code UNKNOWN_TOOL} or {@code INVALID_ARGUMENTS}
     */
    public CompletableFuture<ToolResult> invoke(String name, Map<String, Object> arguments) {
        ToolComponent tool = validate(name, arguments);
        try {
            return tool.execute(arguments != null ? arguments : Map.of())
                    .exceptionally(error -> ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                            "Tool execution failed: " + rootMessage(error)));
        } catch (RuntimeException e) { // NOSONAR - tool implementations may throw synchronously
            log.error("[Tools] Tool {} threw before returning a future", tool.getToolName(), e);
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + rootMessage(e)));
        }
    }

    private String availableNames() {
        return String.join(", ", list().stream().map(ToolDefinition::getName).toList());
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return "";
        }
        String sanitized = name.strip().replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    static String rootMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
