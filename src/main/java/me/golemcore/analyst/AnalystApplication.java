package me.golemcore.analyst;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the SOC analyst agent.
 *
 * <p>
 * The agent drives a bounded plan, approve, act loop over security events: an
 * analyst posts a goal, the planning oracle (an OpenAI-compatible LLM through
 * langchain4j, or a deterministic fallback) picks the next tool call or a
 * final answer, the approval gate optionally holds the call for a human, and
 * the executor runs it and records the outcome in session memory.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → AgentController (WebFlux)
 * Domain Layer       → AgentOrchestrator, PlanningService, ApprovalGate, ToolExecutionService
 * Infrastructure     → LLM / Elasticsearch adapters, OkHttp, Feign
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code analyst.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AnalystApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalystApplication.class, args);
    }

}
