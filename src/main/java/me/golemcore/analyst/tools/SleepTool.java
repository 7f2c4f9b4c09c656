package me.golemcore.analyst.tools;

import me.golemcore.analyst.domain.component.ToolComponent;
import me.golemcore.analyst.domain.model.ToolDefinition;
import me.golemcore.analyst.domain.model.ToolResult;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Waits for a number of seconds, e.g. for events to be indexed or for a rate
 * limit to reset. The delay does not occupy a thread.
 */
@Component
public class SleepTool implements ToolComponent {

    public static final String NAME = "sleep";

    private static final String PARAM_SECONDS = "seconds";

    private final AnalystProperties.SleepToolProperties config;

    public SleepTool(AnalystProperties properties) {
        this.config = properties.getTools().getSleep();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Sleep for N seconds to wait for data or rate limits.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_SECONDS, Map.of(
                                        "type", "number",
                                        "minimum", 0,
                                        "maximum", config.getMaxSeconds(),
                                        "description", "Seconds to wait, at most " + config.getMaxSeconds())),
                        "required", List.of(PARAM_SECONDS),
                        "additionalProperties", false))
                .build();
    }

    @Override
    public Duration getExecutionTimeout() {
        return Duration.ofSeconds(config.getMaxSeconds() + 5L);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Number seconds = (Number) parameters.get(PARAM_SECONDS);
        long millis = Math.round(seconds.doubleValue() * 1000);
        return CompletableFuture.supplyAsync(
                () -> ToolResult.success("{\"slept\":" + seconds + "}", Map.of("slept", seconds)),
                CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
    }
}
