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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.model.LlmRequest;
import me.golemcore.analyst.domain.model.LlmResponse;
import me.golemcore.analyst.domain.model.Message;
import me.golemcore.analyst.domain.model.PlanDecision;
import me.golemcore.analyst.domain.model.StepResult.PlannerSource;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import me.golemcore.analyst.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Planning oracle. Asks the LLM for the next decision given the tail of the
 * session history and the tool catalog; on any backend failure, timeout or
 * protocol violation answers with the {@link HeuristicPlanner} instead.
 *
 * <p>
 * Stateless: every call sees only the history it is given.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanningService {

    private final LlmPort llmPort;
    private final PlanDecisionParser parser;
    private final HeuristicPlanner heuristicPlanner;
    private final ObjectMapper objectMapper;
    private final AnalystProperties properties;

    public PlanningOutcome plan(String sessionId, List<Message> history, List<ToolDefinition> catalog) {
        if (llmPort == null || !llmPort.isAvailable()) {
            return fallback(history, "reasoning backend not configured");
        }

        LlmRequest request;
        try {
            request = buildRequest(sessionId, history, catalog);
        } catch (JsonProcessingException e) {
            return fallback(history, "could not serialize planner context: " + e.getOriginalMessage());
        }

        long timeoutMs = properties.getPlanner().getTimeout().toMillis();
        String text;
        CompletableFuture<LlmResponse> future = null;
        try {
            future = llmPort.chat(request);
            LlmResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            text = response != null ? response.getContent() : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(history, "planner call interrupted");
        } catch (TimeoutException e) {
            future.cancel(true);
            return fallback(history, "planner timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            return fallback(history, "planner call failed: " + ToolRegistry.rootMessage(e));
        } catch (RuntimeException e) { // NOSONAR - adapters may fail before returning a future
            return fallback(history, "planner call failed: " + ToolRegistry.rootMessage(e));
        }

        try {
            PlanDecision decision = parser.parse(text);
            log.debug("[Planner] Session {}: {}", sessionId, describe(decision));
            return new PlanningOutcome(decision, PlannerSource.LLM, null);
        } catch (PlanDecisionParser.PlanningProtocolException e) {
            return fallback(history, "planning protocol violation: " + e.getMessage());
        }
    }

    LlmRequest buildRequest(String sessionId, List<Message> history, List<ToolDefinition> catalog)
            throws JsonProcessingException {
        String dialogue = objectMapper.writeValueAsString(dialogueTail(history));
        AnalystProperties.PlannerProperties planner = properties.getPlanner();
        return LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .systemPrompt(buildSystemPrompt(catalog))
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content("Dialogue (JSON array):\n" + dialogue + "\nRespond with strict JSON only.")
                        .build()))
                .temperature(planner.getTemperature())
                .maxTokens(planner.getMaxTokens())
                .sessionId(sessionId)
                .build();
    }

    String buildSystemPrompt(List<ToolDefinition> catalog) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an autonomous SOC analyst assistant. Think step by step. ")
                .append("Use tools to fetch data, then decide the next action.\n")
                .append("Always respond with a single JSON object with keys: thought, action, input.\n")
                .append("When you are ready to give the final answer use action \"final\" ")
                .append("with input {\"answer\": \"...\"}.\n")
                .append("Available tools:\n");
        for (ToolDefinition tool : catalog) {
            sb.append("- ").append(tool.getName()).append(": ").append(tool.getDescription());
            try {
                sb.append(" schema=").append(objectMapper.writeValueAsString(tool.getInputSchema()));
            } catch (JsonProcessingException e) {
                log.warn("[Planner] Cannot render schema of {}: {}", tool.getName(), e.getOriginalMessage());
            }
            sb.append('\n');
        }
        sb.append("Example: {\"thought\":\"look for failed logins\", \"action\":\"es_search\", ")
                .append("\"input\":{\"index\":\"alerts-enriched\", \"query\":{\"match\":{\"event.action\":\"ssh_login_failed\"}}}}\n")
                .append("Final answer example: {\"thought\":\"enough evidence\", \"action\":\"final\", ")
                .append("\"input\":{\"answer\":\"...\"}}");
        return sb.toString();
    }

    private List<Map<String, Object>> dialogueTail(List<Message> history) {
        AnalystProperties.PlannerProperties planner = properties.getPlanner();
        int limit = Math.max(1, planner.getContextMessages());
        List<Message> recent = history.size() > limit ? history.subList(history.size() - limit, history.size())
                : history;
        List<Map<String, Object>> compact = new ArrayList<>(recent.size());
        for (Message message : recent) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("role", message.getRole());
            if (message.getToolName() != null) {
                entry.put("name", message.getToolName());
            }
            entry.put("content", truncate(message.getContent(), planner.getMaxMessageChars()));
            compact.add(entry);
        }
        return compact;
    }

    private PlanningOutcome fallback(List<Message> history, String reason) {
        log.warn("[Planner] Falling back to heuristic answer: {}", reason);
        return new PlanningOutcome(heuristicPlanner.plan(history), PlannerSource.FALLBACK, reason);
    }

    private static String describe(PlanDecision decision) {
        if (decision instanceof PlanDecision.ToolInvocation invocation) {
            return "tool " + invocation.toolName() + " " + invocation.arguments().keySet();
        }
        return "final answer";
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (maxLen <= 0 || text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...[truncated]";
    }

    /**
     * Decision for one step and where it came from.
     *
     * @param decision
     *            the decision to apply
     * @param source
     *            LLM or FALLBACK
     * @param fallbackReason
     *            why the fallback answered, null for LLM decisions
     */
    public record PlanningOutcome(PlanDecision decision, PlannerSource source, String fallbackReason) {

        public boolean isFallback() {
            return source == PlannerSource.FALLBACK;
        }
    }
}
