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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.model.ApprovalMode;
import me.golemcore.analyst.domain.model.PlanDecision;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Decides whether a planned decision may run right away or must wait for an
 * explicit approval, and builds the human-readable description shown for
 * waiting actions.
 *
 * <p>
 * Final answers are never gated. Tool invocations run immediately in
 * {@link ApprovalMode#AUTO} unless the tool itself requires approval or is
 * listed in {@code analyst.security.approval-required-tools}; in
 * {@link ApprovalMode#MANUAL} every tool invocation is blocked.
 */
@Component
@Slf4j
public class ApprovalGate {

    private static final String UNKNOWN = "unknown";
    private static final int PREVIEW_LENGTH = 120;

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final Set<String> alwaysGated;

    public ApprovalGate(ToolRegistry toolRegistry, ObjectMapper objectMapper, AnalystProperties properties) {
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.alwaysGated = Set.copyOf(properties.getSecurity().getApprovalRequiredTools());
        log.info("[Approval] Tools always requiring approval: {}", alwaysGated);
    }

    public Verdict evaluate(ApprovalMode mode, PlanDecision decision) {
        if (decision instanceof PlanDecision.ToolInvocation invocation) {
            if (mode == ApprovalMode.MANUAL || requiresApproval(invocation.toolName())) {
                log.debug("[Approval] Blocking {} (mode={})", invocation.toolName(), mode.getValue());
                return Verdict.BLOCKED;
            }
        }
        return Verdict.CLEARED;
    }

    /**
     * Check if a tool is gated regardless of the session mode.
     */
    public boolean requiresApproval(String toolName) {
        if (alwaysGated.contains(toolName)) {
            return true;
        }
        return toolRegistry.find(toolName)
                .map(tool -> tool.getDefinition().isRequiresApproval())
                .orElse(false);
    }

    /**
     * Build a human-readable description of the action for the approval prompt.
     */
    public String describe(PlanDecision.ToolInvocation invocation) {
        Map<String, Object> args = invocation.arguments();
        return switch (invocation.toolName()) {
        case "es_search" -> describeSearch(args);
        case "http_get" -> "Fetch URL: " + valueOr(args.get("url"));
        case "sleep" -> "Wait " + valueOr(args.get("seconds")) + " seconds";
        default -> invocation.toolName() + ": " + preview(args);
        };
    }

    private String describeSearch(Map<String, Object> args) {
        String index = args.get("index") != null ? args.get("index").toString() : "default index";
        StringBuilder sb = new StringBuilder("Search ").append(index).append(": ").append(preview(args.get("query")));
        if (args.get("size") != null) {
            sb.append(" (size ").append(args.get("size")).append(')');
        }
        return sb.toString();
    }

    private String preview(Object value) {
        String text;
        try {
            text = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            text = String.valueOf(value);
        }
        if (text.length() > PREVIEW_LENGTH) {
            text = text.substring(0, PREVIEW_LENGTH) + "...";
        }
        return text;
    }

    private static String valueOr(Object value) {
        return value != null ? value.toString() : UNKNOWN;
    }

    /**
     * Gate result for one decision.
     */
    public enum Verdict {
        CLEARED, BLOCKED
    }
}
