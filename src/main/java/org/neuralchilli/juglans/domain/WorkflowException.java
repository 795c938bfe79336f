package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Base class of every failure raised while compiling or running a workflow.
 * Unchecked, like the rest of the project's validation errors.
 */
public class WorkflowException extends RuntimeException {

    private final ErrorCode code;
    private final String node;
    private final transient JsonNode details;

    public WorkflowException(ErrorCode code, String message) {
        this(code, message, null, null, null);
    }

    public WorkflowException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, null, cause);
    }

    public WorkflowException(ErrorCode code, String message, String node, JsonNode details, Throwable cause) {
        super(message, cause);
        if (code == null) {
            throw new IllegalArgumentException("Error code cannot be null");
        }
        this.code = code;
        this.node = node;
        this.details = details;
    }

    public ErrorCode code() {
        return code;
    }

    /**
     * Node that raised the failure, if known at construction time
     */
    public String node() {
        return node;
    }

    public JsonNode details() {
        return details;
    }
}
