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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the analyst agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code analyst.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - approval mode, step limits, session locking</li>
 * <li>{@link PlannerProperties} - planning context window and timeout</li>
 * <li>{@link LlmProperties} - reasoning backend endpoint and model</li>
 * <li>{@link MemoryProperties} - history compaction</li>
 * <li>{@link SecurityProperties} - tools that always require approval</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link ToolsProperties} - per-tool limits and timeouts</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "analyst")
@Data
public class AnalystProperties {

    private AgentProperties agent = new AgentProperties();
    private PlannerProperties planner = new PlannerProperties();
    private LlmProperties llm = new LlmProperties();
    private MemoryProperties memory = new MemoryProperties();
    private SecurityProperties security = new SecurityProperties();
    private HttpProperties http = new HttpProperties();
    private ToolsProperties tools = new ToolsProperties();

    // ==================== AGENT ====================

    @Data
    public static class AgentProperties {
        /** Mode used when a session is created without one: auto or manual. */
        private String defaultApprovalMode = "auto";

        /** Steps performed by run when the caller gives no limit. */
        private int defaultMaxSteps = 5;

        /** Largest step limit a caller may request. */
        private int maxStepsCap = 25;

        /** How long an operation waits for another one on the same session. */
        private Duration sessionLockTimeout = Duration.ofSeconds(30);

        /** Wall-clock budget for one run call. */
        private Duration runDeadline = Duration.ofMinutes(5);
    }

    // ==================== PLANNER ====================

    @Data
    public static class PlannerProperties {
        private Duration timeout = Duration.ofSeconds(20);

        /** Most recent messages shown to the planner. */
        private int contextMessages = 10;

        /** Per-message character cap inside the planner context. */
        private int maxMessageChars = 2000;

        private int maxTokens = 400;
        private double temperature = 0.2;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** Adapter id: langchain4j or none. */
        private String provider = "langchain4j";
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o-mini";
        private long timeoutMs = 20000;
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private CompactionProperties compaction = new CompactionProperties();
    }

    @Data
    public static class CompactionProperties {
        private boolean enabled = true;

        /** Compaction runs when a session holds more messages than this. */
        private int maxMessages = 40;

        /** Messages kept verbatim at the end of the log. */
        private int keepLast = 20;

        private Duration summaryTimeout = Duration.ofSeconds(15);
        private int maxSummaryChars = 4000;
    }

    // ==================== SECURITY ====================

    @Data
    public static class SecurityProperties {
        /** Tools gated behind approval even in auto mode. */
        private List<String> approvalRequiredTools = new ArrayList<>();
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        /** Timeout for tools that do not declare their own. */
        private Duration defaultTimeout = Duration.ofSeconds(30);

        /** Max characters of a tool result written into history. */
        private int maxResultChars = 20000;

        private SearchToolProperties search = new SearchToolProperties();
        private HttpGetToolProperties httpGet = new HttpGetToolProperties();
        private SleepToolProperties sleep = new SleepToolProperties();
    }

    @Data
    public static class SearchToolProperties {
        private boolean enabled = true;
        private String url = "http://elasticsearch:9200";
        private String apiKey;
        private String defaultIndex = "alerts-enriched";
        private int defaultSize = 50;
        private int maxSize = 100;

        /** Return an empty result instead of a failure when the backend is down. */
        private boolean allowPartial = true;

        private Duration timeout = Duration.ofSeconds(20);
    }

    @Data
    public static class HttpGetToolProperties {
        private boolean enabled = true;
        private int defaultTimeoutSeconds = 15;
        private int maxTimeoutSeconds = 60;
        private int maxBodyChars = 20000;
    }

    @Data
    public static class SleepToolProperties {
        private int maxSeconds = 30;
    }
}
