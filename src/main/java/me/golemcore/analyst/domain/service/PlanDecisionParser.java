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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.analyst.domain.model.AgentException;
import me.golemcore.analyst.domain.model.PlanDecision;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses planner output of the form
 * {@code {"thought": "...", "action": "<tool>|final", "input": {...}}} into a
 * {@link PlanDecision}. Text around the outermost braces (prose, code fences)
 * is ignored. Tool decisions are checked against the registry so that an
 * accepted decision is always executable.
 */
@Component
@RequiredArgsConstructor
public class PlanDecisionParser {

    static final String ACTION_FINAL = "final";

    private final ObjectMapper objectMapper;
    private final ToolRegistry toolRegistry;

    /**
     * @throws PlanningProtocolException
     *             if the text is not a valid decision
     */
    public PlanDecision parse(String text) {
        String json = extractJson(text);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PlanningProtocolException("planner output is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new PlanningProtocolException("planner output must be a JSON object");
        }

        String thought = textOrNull(root.get("thought"));
        String action = textOrNull(root.get("action"));
        if (action == null || action.isBlank()) {
            throw new PlanningProtocolException("planner output has no action");
        }
        JsonNode input = root.get("input");
        if (input != null && !input.isNull() && !input.isObject()) {
            throw new PlanningProtocolException("planner input must be a JSON object");
        }

        if (ACTION_FINAL.equalsIgnoreCase(action.strip())) {
            String answer = input != null ? textOrNull(input.get("answer")) : null;
            if (answer == null || answer.isBlank()) {
                throw new PlanningProtocolException("final action requires a non-blank input.answer");
            }
            return new PlanDecision.FinalAnswer(answer.strip(), thought);
        }

        Map<String, Object> arguments = toArguments(input);
        String toolName;
        try {
            toolName = toolRegistry.validate(action, arguments).getToolName();
        } catch (AgentException e) {
            throw new PlanningProtocolException(e.getMessage());
        }
        return new PlanDecision.ToolInvocation(toolName, arguments, thought);
    }

    static String extractJson(String text) {
        if (text == null) {
            throw new PlanningProtocolException("planner returned no output");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new PlanningProtocolException("planner output contains no JSON object");
        }
        return text.substring(start, end + 1);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toArguments(JsonNode input) {
        if (input == null || input.isNull()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(input, LinkedHashMap.class);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    /**
     * Planner output that violates the decision protocol. Never reaches the
     * caller; the planning service falls back instead.
     */
    public static class PlanningProtocolException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public PlanningProtocolException(String message) {
            super(message);
        }
    }
}
