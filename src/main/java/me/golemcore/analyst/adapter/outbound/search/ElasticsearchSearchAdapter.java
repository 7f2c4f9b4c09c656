package me.golemcore.analyst.adapter.outbound.search;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestInterceptor;
import feign.RequestLine;
import feign.RetryableException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.model.SearchRequest;
import me.golemcore.analyst.domain.model.SearchResult;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import me.golemcore.analyst.infrastructure.http.FeignClientFactory;
import me.golemcore.analyst.port.outbound.SearchPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Elasticsearch adapter: runs {@code POST /{index}/_search} through a Feign
 * client on the shared OkHttp transport.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code analyst.tools.search.url} - cluster base URL
 * <li>{@code analyst.tools.search.api-key} - optional API key, sent as
 * {@code Authorization: ApiKey ...}
 * <li>{@code analyst.tools.search.timeout} - per-request timeout
 * </ul>
 *
 * <p>
 * Both {@code hits.total} formats are understood: the object form of
 * Elasticsearch 7+ and the plain number of older clusters.
 */
@Component
@Slf4j
public class ElasticsearchSearchAdapter implements SearchPort {

    private final AnalystProperties.SearchToolProperties config;
    private final ObjectMapper objectMapper;
    private final ElasticsearchApi api;

    public ElasticsearchSearchAdapter(AnalystProperties properties, FeignClientFactory feignClientFactory,
            ObjectMapper objectMapper) {
        this.config = properties.getTools().getSearch();
        this.objectMapper = objectMapper;
        this.api = isAvailable()
                ? feignClientFactory.create(ElasticsearchApi.class, stripTrailingSlash(config.getUrl()),
                        config.getTimeout(), List.of(apiKeyInterceptor()))
                : null;
    }

    @Override
    public SearchResult search(SearchRequest request) {
        if (api == null) {
            throw new SearchBackendException("Search backend URL is not configured", true, null);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", request.getQuery());
        body.put("size", request.getSize());
        if (request.getSort() != null && !request.getSort().isEmpty()) {
            body.put("sort", request.getSort());
        }

        JsonNode response;
        try {
            response = api.search(request.getIndex(), body);
        } catch (RetryableException e) {
            throw new SearchBackendException("Search backend unreachable: " + e.getMessage(), true, e);
        } catch (FeignException e) {
            log.warn("[Search] Query on {} rejected: HTTP {}", request.getIndex(), e.status());
            throw new SearchBackendException("Search failed with HTTP " + e.status() + ": "
                    + e.contentUTF8(), e.status() >= 500, e);
        }
        return parse(response);
    }

    @Override
    public boolean isAvailable() {
        return config.getUrl() != null && !config.getUrl().isBlank();
    }

    @SuppressWarnings("unchecked")
    private SearchResult parse(JsonNode response) {
        if (response == null || response.isNull()) {
            return SearchResult.empty();
        }
        JsonNode hitsNode = response.path("hits");
        JsonNode totalNode = hitsNode.path("total");
        List<Map<String, Object>> hits = new ArrayList<>();
        for (JsonNode hit : hitsNode.path("hits")) {
            hits.add(objectMapper.convertValue(hit, LinkedHashMap.class));
        }
        long total = totalNode.isObject() ? totalNode.path("value").asLong(hits.size())
                : totalNode.asLong(hits.size());
        return new SearchResult(total, hits);
    }

    private RequestInterceptor apiKeyInterceptor() {
        return template -> {
            String apiKey = config.getApiKey();
            if (apiKey != null && !apiKey.isBlank()) {
                template.header("Authorization", "ApiKey " + apiKey);
            }
        };
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    interface ElasticsearchApi {
        @RequestLine("POST /{index}/_search")
        @Headers("Content-Type: application/json")
        JsonNode search(@Param("index") String index, Map<String, Object> body);
    }
}
