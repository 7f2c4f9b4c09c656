package me.golemcore.analyst.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * No enabled tool with the requested name.
     */
    UNKNOWN_TOOL,

    /**
     * Arguments did not satisfy the tool's input schema.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (network error, backend error,
     * exception).
     */
    EXECUTION_FAILED,

    /**
     * Tool did not finish within its timeout.
     */
    TIMEOUT,

    /**
     * A blocked action was rejected by the operator and never executed.
     */
    REJECTED
}
