package me.golemcore.analyst.domain.model;

import java.util.Map;

/**
 * Result of executing a single tool invocation for a session.
 *
 * @param toolName
 *            tool name as written into history
 * @param arguments
 *            arguments the tool was invoked with
 * @param toolResult
 *            raw ToolResult (success/failure + structured data)
 * @param messageContent
 *            content written into the "tool" message (possibly truncated)
 * @param durationMs
 *            wall-clock time spent in the tool
 */
public record ToolExecutionOutcome(String toolName, Map<String, Object> arguments, ToolResult toolResult,
        String messageContent, long durationMs) {

    public boolean isSuccess() {
        return toolResult != null && toolResult.isSuccess();
    }
}
