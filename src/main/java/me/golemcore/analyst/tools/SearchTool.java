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
import me.golemcore.analyst.domain.model.SearchRequest;
import me.golemcore.analyst.domain.model.SearchResult;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.model.ToolResult;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import me.golemcore.analyst.port.outbound.SearchPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Searches security events with an Elasticsearch DSL query, newest first.
 *
 * <p>
 * When the backend cannot be reached and
 * {@code analyst.tools.search.allow-partial} is true, the tool succeeds with an
 * empty result flagged {@code degraded} so the investigation can continue;
 * otherwise it fails. A result is never partial hits plus an error.
 */
@Component
@Slf4j
public class SearchTool implements ToolComponent {

    public static final String NAME = "es_search";

    private static final String PARAM_INDEX = "index";
    private static final String PARAM_QUERY = "query";
    private static final String PARAM_SIZE = "size";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";
    private static final Duration TIMEOUT_MARGIN = Duration.ofSeconds(5);

    private final SearchPort searchPort;
    private final ObjectMapper objectMapper;
    private final AnalystProperties.SearchToolProperties config;

    public SearchTool(SearchPort searchPort, ObjectMapper objectMapper, AnalystProperties properties) {
        this.searchPort = searchPort;
        this.objectMapper = objectMapper;
        this.config = properties.getTools().getSearch();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search an Elasticsearch index with a DSL query. Results are sorted by "
                        + "@timestamp, newest first.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_INDEX, Map.of(
                                        TYPE, "string",
                                        "minLength", 1,
                                        DESCRIPTION, "Index or pattern, defaults to " + config.getDefaultIndex()),
                                PARAM_QUERY, Map.of(
                                        TYPE, "object",
                                        DESCRIPTION, "Elasticsearch query DSL, e.g. {\"match\": {\"host.name\": \"web-1\"}}"),
                                PARAM_SIZE, Map.of(
                                        TYPE, "integer",
                                        "minimum", 1,
                                        "maximum", config.getMaxSize(),
                                        DESCRIPTION, "Max hits to return, default " + config.getDefaultSize())),
                        "required", List.of(PARAM_QUERY),
                        "additionalProperties", false))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public Duration getExecutionTimeout() {
        return config.getTimeout().plus(TIMEOUT_MARGIN);
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String index = parameters.get(PARAM_INDEX) instanceof String s && !s.isBlank() ? s.strip()
                    : config.getDefaultIndex();
            int size = parameters.get(PARAM_SIZE) instanceof Number n ? n.intValue() : config.getDefaultSize();
            size = Math.min(size, config.getMaxSize());

            SearchRequest request = SearchRequest.builder()
                    .index(index)
                    .query((Map<String, Object>) parameters.get(PARAM_QUERY))
                    .size(size)
                    .sort(List.of(Map.of("@timestamp", Map.of("order", "desc"))))
                    .build();

            try {
                SearchResult result = searchPort.search(request);
                log.debug("[Search] {} returned {} of {} hits", index, result.hits().size(), result.total());
                return success(result.total(), result.hits(), false, null);
            } catch (SearchPort.SearchBackendException e) {
                if (e.isUnreachable() && config.isAllowPartial()) {
                    log.warn("[Search] Backend unreachable, returning degraded empty result: {}", e.getMessage());
                    return success(0, List.of(), true, e.getMessage());
                }
                log.warn("[Search] Search on {} failed: {}", index, e.getMessage());
                return ToolResult.failure("Search failed: " + e.getMessage());
            }
        });
    }

    private ToolResult success(long total, List<Map<String, Object>> hits, boolean degraded, String warning) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("total", total);
        data.put("hits", hits);
        if (degraded) {
            data.put("degraded", true);
            data.put("warning", warning);
        }
        try {
            return ToolResult.success(objectMapper.writeValueAsString(data), data);
        } catch (JsonProcessingException e) {
            return ToolResult.failure("Cannot render search result: " + e.getOriginalMessage());
        }
    }
}
