package org.neuralchilli.juglans.domain;

import java.util.Locale;

/**
 * Machine-readable category of a workflow failure.
 * Carried in the {@code code} field of {@code $error} and of a failed run's result.
 */
public enum ErrorCode {
    /**
     * Malformed source unit, fatal at compile time
     */
    PARSE_ERROR,

    /**
     * A flow import re-enters its own ancestry
     */
    CIRCULAR_IMPORT,

    /**
     * Structurally invalid graph (unknown endpoints, cycles, duplicate ids)
     */
    VALIDATION_ERROR,

    /**
     * Expression could not be compiled or evaluated
     */
    EXPRESSION_ERROR,

    /**
     * A variable the node depends on does not exist
     */
    UNRESOLVED_VARIABLE,

    /**
     * A required call argument resolved to null
     */
    MISSING_ARGUMENT,

    /**
     * No builtin, tool server or client bridge can handle the call
     */
    TOOL_RESOLUTION_ERROR,

    /**
     * Client bridge deadline exceeded
     */
    TOOL_TIMEOUT,

    /**
     * I/O failure from a collaborator
     */
    CALL_FAILURE,

    /**
     * A while loop ran past the configured iteration limit
     */
    LOOP_LIMIT_EXCEEDED,

    /**
     * Run aborted by timeout or external cancellation
     */
    CANCELLED;

    /**
     * Lower-case form used in {@code $error.code}
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
