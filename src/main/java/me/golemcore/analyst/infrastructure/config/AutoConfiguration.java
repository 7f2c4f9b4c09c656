package me.golemcore.analyst.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.analyst.domain.model.ApprovalMode;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.service.ToolRegistry;
import me.golemcore.analyst.port.outbound.LlmPort;
import me.golemcore.analyst.port.outbound.SearchPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup diagnostics.
 *
 * <p>
 * Fails fast on an invalid default approval mode so that a misconfigured
 * deployment never starts creating sessions.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AnalystProperties properties;
    private final ToolRegistry toolRegistry;
    private final LlmPort llmPort;
    private final SearchPort searchPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        ApprovalMode defaultMode = ApprovalMode.parse(properties.getAgent().getDefaultApprovalMode());
        log.info("SOC analyst agent starting...");
        log.info("Default approval mode: {}", defaultMode.getValue());
        log.info("LLM Provider: {} (model {}, available={})", llmPort.getProviderId(), llmPort.getCurrentModel(),
                llmPort.isAvailable());
        log.info("Search backend: {} (available={})", properties.getTools().getSearch().getUrl(),
                searchPort.isAvailable());
        log.info("Tools: {}", toolRegistry.list().stream().map(ToolDefinition::getName).toList());
    }
}
