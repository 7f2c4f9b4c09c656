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
import me.golemcore.analyst.domain.model.LlmRequest;
import me.golemcore.analyst.domain.model.LlmResponse;
import me.golemcore.analyst.domain.model.Message;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import me.golemcore.analyst.port.outbound.LlmPort;
import me.golemcore.analyst.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Keeps session history bounded. Old messages are replaced with a single
 * summary message, written by the LLM when it is reachable and built from the
 * messages themselves otherwise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompactionService {

    private final SessionPort sessionPort;
    private final LlmPort llmPort;
    private final AnalystProperties properties;
    private final Clock clock;

    private static final int MAX_SUMMARY_TOKENS = 500;
    private static final int MAX_LINE_CHARS = 300;
    private static final String SUMMARY_HEADER = "[Investigation summary]\n";

    private static final String SYSTEM_PROMPT = """
            Summarize the security investigation transcript below so that an analyst agent
            can continue the work without the original messages.

            Include, when applicable:
            - the analyst's goals and questions
            - which tools were run with which arguments, and what they found
            - indicators seen: hosts, users, IP addresses, URLs, alert ids
            - conclusions reached and open leads

            Keep it factual. Output only the summary.""";

    /**
     * Compacts the session when it holds more than
     * {@code analyst.memory.compaction.max-messages} messages.
     *
     * @return number of collapsed messages, 0 when nothing was done
     */
    public int compactIfNeeded(String sessionId) {
        AnalystProperties.CompactionProperties config = properties.getMemory().getCompaction();
        if (!config.isEnabled()) {
            return 0;
        }
        int count = sessionPort.getMessageCount(sessionId);
        if (count <= config.getMaxMessages()) {
            return 0;
        }

        int keepLast = Math.max(1, config.getKeepLast());
        List<Message> toCompact = sessionPort.getMessagesToCompact(sessionId, keepLast);
        if (toCompact.isEmpty()) {
            return 0;
        }

        String summary = summarize(toCompact);
        String source = "llm";
        if (summary == null) {
            summary = fallbackSummary(toCompact);
            source = "fallback";
        }
        summary = truncate(summary, config.getMaxSummaryChars());

        Message summaryMessage = createSummaryMessage(summary, toCompact.size(), source);
        int removed = sessionPort.compactWithSummary(sessionId, keepLast, summaryMessage);
        log.info("[Compaction] Session {}: {} messages over limit {}, collapsed {} ({} summary)",
                sessionId, count, config.getMaxMessages(), removed, source);
        return Math.max(removed, 0);
    }

    /**
     * Summarize a list of messages with the LLM.
     *
     * @return summary text, or null if the LLM is unavailable or failed
     */
    public String summarize(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return null;
        }
        if (llmPort == null || !llmPort.isAvailable()) {
            log.debug("[Compaction] LLM not available, using fallback summary");
            return null;
        }

        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .systemPrompt(SYSTEM_PROMPT)
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content(formatTranscript(messages))
                        .build()))
                .maxTokens(MAX_SUMMARY_TOKENS)
                .temperature(0.2)
                .build();

        long timeoutMs = properties.getMemory().getCompaction().getSummaryTimeout().toMillis();
        try {
            long start = clock.millis();
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            String summary = response != null ? response.getContent() : null;
            if (summary == null || summary.isBlank()) {
                log.warn("[Compaction] LLM returned empty summary");
                return null;
            }
            log.info("[Compaction] Summarized {} messages in {}ms ({} chars)",
                    messages.size(), clock.millis() - start, summary.length());
            return summary.strip();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Compaction] LLM summarization interrupted: {}", e.getMessage());
            return null;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Compaction] LLM summarization failed: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Deterministic summary: goals in order, tool usage counts, last answer.
     */
    String fallbackSummary(List<Message> messages) {
        List<String> goals = messages.stream()
                .filter(Message::isUserMessage)
                .map(m -> truncate(oneLine(m.getContent()), MAX_LINE_CHARS))
                .toList();

        Map<String, int[]> toolStats = new LinkedHashMap<>();
        String lastAnswer = null;
        for (Message message : messages) {
            if (message.isToolMessage()) {
                int[] stats = toolStats.computeIfAbsent(
                        message.getToolName() != null ? message.getToolName() : "unknown", k -> new int[2]);
                stats[0]++;
                if (!isOk(message)) {
                    stats[1]++;
                }
            } else if (message.isAgentMessage() && (Message.KIND_FINAL.equals(message.getKind())
                    || Message.KIND_SUMMARY.equals(message.getKind()))) {
                lastAnswer = message.getContent();
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append(messages.size()).append(" earlier messages.");
        if (!goals.isEmpty()) {
            sb.append("\nGoals:");
            goals.forEach(goal -> sb.append("\n- ").append(goal));
        }
        if (!toolStats.isEmpty()) {
            sb.append("\nTools run: ").append(toolStats.entrySet().stream()
                    .map(e -> e.getKey() + " x" + e.getValue()[0]
                            + (e.getValue()[1] > 0 ? " (" + e.getValue()[1] + " failed)" : ""))
                    .collect(Collectors.joining(", ")));
        }
        if (lastAnswer != null) {
            sb.append("\nLast conclusion: ").append(truncate(oneLine(lastAnswer), MAX_LINE_CHARS));
        }
        return sb.toString();
    }

    public Message createSummaryMessage(String summary, int collapsed, String source) {
        Message message = Message.agent(SUMMARY_HEADER + summary, Message.KIND_SUMMARY, clock.instant());
        message.getMetadata().put("collapsed", collapsed);
        message.getMetadata().put("source", source);
        return message;
    }

    private String formatTranscript(List<Message> messages) {
        return messages.stream()
                .filter(m -> m.getContent() != null && !m.getContent().isBlank())
                .map(m -> {
                    String role = m.isToolMessage() ? "tool " + m.getToolName() : m.getRole();
                    return role + ": " + truncate(oneLine(m.getContent()), MAX_LINE_CHARS);
                })
                .collect(Collectors.joining("\n"));
    }

    private static boolean isOk(Message message) {
        return message.getData() != null && Boolean.TRUE.equals(message.getData().get("ok"));
    }

    private static String oneLine(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").strip();
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (maxLen <= 0 || text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
