package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Structured failure of a node or run: {@code {code, message, node, details}}.
 * This is the value injected into {@code ctx.error} when an error edge is taken.
 */
public record RunError(ErrorCode code, String message, String node, JsonNode details) {

    public RunError {
        if (code == null) {
            throw new IllegalArgumentException("Error code cannot be null");
        }
        if (message == null) {
            message = "";
        }
    }

    /**
     * Build an error from any throwable raised by a node, unwrapping async wrappers.
     * Non-workflow exceptions are reported as call failures.
     */
    public static RunError from(Throwable throwable, String node) {
        Throwable cause = unwrap(throwable);

        if (cause instanceof WorkflowException we) {
            String origin = we.node() != null ? we.node() : node;
            return new RunError(we.code(), we.getMessage(), origin, we.details());
        }
        if (cause instanceof CancellationException) {
            return new RunError(ErrorCode.CANCELLED, "Node execution was cancelled", node, null);
        }

        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new RunError(ErrorCode.CALL_FAILURE, message, node, null);
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * JSON form stored in the context as {@code $error}
     */
    public ObjectNode toJson() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("code", code.wireName());
        json.put("message", message);
        if (node != null) {
            json.put("node", node);
        } else {
            json.putNull("node");
        }
        json.set("details", details != null ? details.deepCopy() : JsonNodeFactory.instance.nullNode());
        return json;
    }

    /**
     * Rebuild as an exception without a node, so that it is attributed to whichever node
     * rethrows it (a loop node failing with its body's error)
     */
    public WorkflowException toException(String prefix) {
        String text = prefix != null ? prefix + ": " + message : message;
        return new WorkflowException(code, text, null, details, null);
    }
}
