package com.codemend.core.outcome;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a correction attempt did not reach zero issues. Drives the feedback
 * given to the next attempt.
 */
public enum FailureKind {
    /** Issue count did not drop and nothing new appeared. */
    NO_IMPROVEMENT("no_improvement"),
    /** At least one issue after the attempt has no counterpart before it. */
    NEW_ERRORS_INTRODUCED("new_errors_introduced"),
    /** No improvement, and the last two attempts left the same issues. */
    OSCILLATION_DETECTED("oscillation_detected"),
    /** The correction plan text could not be parsed; the file was not touched. */
    PARSING_FAILED("parsing_failed"),
    /** A plan step failed for a non-transient reason, or the plan did nothing. */
    COMMAND_FAILED("command_failed"),
    UNKNOWN("unknown");

    private final String wireName;

    FailureKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
