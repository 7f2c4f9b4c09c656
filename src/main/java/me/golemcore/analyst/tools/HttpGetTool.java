package me.golemcore.analyst.tools;

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
import me.golemcore.analyst.domain.component.ToolComponent;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.model.ToolFailureKind;
import me.golemcore.analyst.domain.model.ToolResult;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * HTTP GET for enrichment lookups such as threat intelligence APIs.
 *
 * <p>
 * Any HTTP status is a successful call; the status is part of the result. The
 * response body is read up to {@code analyst.tools.http-get.max-body-chars}
 * characters. The whole call, redirects included, is bounded by the
 * requested timeout, capped at {@code analyst.tools.http-get.max-timeout-seconds}.
 */
@Component
@Slf4j
public class HttpGetTool implements ToolComponent {

    public static final String NAME = "http_get";

    private static final String PARAM_URL = "url";
    private static final String PARAM_HEADERS = "headers";
    private static final String PARAM_TIMEOUT = "timeout";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";
    private static final int BYTES_PER_CHAR = 4;

    private final OkHttpClient baseHttpClient;
    private final ObjectMapper objectMapper;
    private final AnalystProperties.HttpGetToolProperties config;

    public HttpGetTool(OkHttpClient baseHttpClient, ObjectMapper objectMapper, AnalystProperties properties) {
        this.baseHttpClient = baseHttpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getTools().getHttpGet();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("HTTP GET request for enrichment, e.g. threat intelligence lookups. "
                        + "Returns status, headers and the response text.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_URL, Map.of(
                                        TYPE, "string",
                                        "pattern", "^https?://",
                                        DESCRIPTION, "Absolute http or https URL"),
                                PARAM_HEADERS, Map.of(
                                        TYPE, "object",
                                        "additionalProperties", Map.of(TYPE, "string"),
                                        DESCRIPTION, "Request headers"),
                                PARAM_TIMEOUT, Map.of(
                                        TYPE, "number",
                                        "minimum", 1,
                                        "maximum", config.getMaxTimeoutSeconds(),
                                        DESCRIPTION, "Timeout in seconds, default " + config.getDefaultTimeoutSeconds())),
                        "required", List.of(PARAM_URL),
                        "additionalProperties", false))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public Duration getExecutionTimeout() {
        return Duration.ofSeconds(config.getMaxTimeoutSeconds() + 5L);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String url = ((String) parameters.get(PARAM_URL)).strip();
            long timeoutMs = resolveTimeoutMillis(parameters.get(PARAM_TIMEOUT));

            Request request;
            try {
                Request.Builder builder = new Request.Builder().url(url).get();
                if (parameters.get(PARAM_HEADERS) instanceof Map<?, ?> headers) {
                    headers.forEach((name, value) -> builder.header(String.valueOf(name), String.valueOf(value)));
                }
                request = builder.build();
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Invalid request: " + e.getMessage());
            }

            OkHttpClient client = baseHttpClient.newBuilder()
                    .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .build();

            try (Response response = client.newCall(request).execute()) {
                String text = response.peekBody((long) config.getMaxBodyChars() * BYTES_PER_CHAR).string();
                if (text.length() > config.getMaxBodyChars()) {
                    text = text.substring(0, config.getMaxBodyChars());
                }

                Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                for (String name : response.headers().names()) {
                    headers.put(name, String.join(", ", response.headers(name)));
                }

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("status", response.code());
                data.put(PARAM_HEADERS, new LinkedHashMap<>(headers));
                data.put("text", text);
                log.debug("[HttpGet] {} -> HTTP {} ({} chars)", url, response.code(), text.length());
                return ToolResult.success(objectMapper.writeValueAsString(data), data);
            } catch (InterruptedIOException e) {
                log.warn("[HttpGet] {} timed out after {} ms", url, timeoutMs);
                return ToolResult.failure(ToolFailureKind.TIMEOUT,
                        "Request to " + url + " timed out after " + timeoutMs + " ms");
            } catch (JsonProcessingException e) {
                return ToolResult.failure("Cannot render response: " + e.getOriginalMessage());
            } catch (IOException e) {
                log.warn("[HttpGet] {} failed: {}", url, e.getMessage());
                return ToolResult.failure("Request to " + url + " failed: " + e.getMessage());
            }
        });
    }

    private long resolveTimeoutMillis(Object requested) {
        double seconds = requested instanceof Number n ? n.doubleValue() : config.getDefaultTimeoutSeconds();
        seconds = Math.min(seconds, config.getMaxTimeoutSeconds());
        return Math.max(1L, Math.round(seconds * 1000));
    }
}
