package me.golemcore.analyst.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.model.LlmRequest;
import me.golemcore.analyst.domain.model.LlmResponse;
import me.golemcore.analyst.domain.model.Message;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter for OpenAI-compatible chat completion endpoints using the
 * langchain4j library.
 *
 * <p>
 * Configuration via {@code analyst.llm.*}: {@code api-key} (available only
 * when set), {@code base-url}, {@code model} and {@code timeout-ms}. Requests
 * are not retried here; a failed call makes the caller fall back.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";

    private final AnalystProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized || !isAvailable()) {
            return;
        }
        AnalystProperties.LlmProperties config = properties.getLlm();
        try {
            this.chatModel = createModel(config);
            initialized = true;
            log.info("Langchain4j adapter initialized with model: {} at {}", config.getModel(), config.getBaseUrl());
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    ChatModel createModel(AnalystProperties.LlmProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            ChatRequest.Builder chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .temperature(request.getTemperature());
            if (request.getMaxTokens() != null) {
                chatRequest.maxOutputTokens(request.getMaxTokens());
            }

            try {
                ChatResponse response = chatModel.chat(chatRequest.build());
                return convertResponse(response);
            } catch (RuntimeException e) {
                log.warn("[LLM] Chat failed for session {}: {}", request.getSessionId(), e.getMessage());
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            if (msg.isAgentMessage()) {
                messages.add(AiMessage.from(content));
            } else if (msg.isToolMessage()) {
                messages.add(UserMessage.from("[Tool " + msg.getToolName() + " result]\n" + content));
            } else {
                messages.add(UserMessage.from(content));
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(properties.getLlm().getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }
}
