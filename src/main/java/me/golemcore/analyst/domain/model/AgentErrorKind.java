package me.golemcore.analyst.domain.model;

/**
 * Stable, machine-readable kinds of caller-facing contract violations.
 */
public enum AgentErrorKind {

    /** No session exists for the given id. */
    NOT_FOUND,

    /** The session already recorded a final answer. */
    SESSION_DONE,

    /** A blocked action waits for approval; approve or reject it first. */
    ACTION_ALREADY_PENDING,

    /** Approve or reject was called while nothing is pending. */
    NO_PENDING_ACTION,

    /** A caller-supplied argument is out of range or malformed. */
    INVALID_ARGUMENT,

    /** The tool registry has no enabled tool with that name. */
    UNKNOWN_TOOL,

    /** Tool arguments failed schema validation. */
    INVALID_ARGUMENTS,

    /** Another operation holds the session for longer than the lock timeout. */
    SESSION_BUSY
}
