package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Observer events emitted during a run, in order per run.
 */
public sealed interface WorkflowEvent {

    String runId();

    /**
     * Wire name of the event
     */
    String type();

    record NodeStarted(String runId, String nodeId) implements WorkflowEvent {
        @Override
        public String type() {
            return "node_start";
        }
    }

    /**
     * Incremental content of a streamed call
     */
    record Content(String runId, String nodeId, String text) implements WorkflowEvent {
        @Override
        public String type() {
            return "content";
        }
    }

    record Status(String runId, String status) implements WorkflowEvent {
        @Override
        public String type() {
            return "status";
        }
    }

    /**
     * Tool calls forwarded to the client, answered by {@code callId}
     */
    record ToolCall(String runId, String callId, JsonNode calls) implements WorkflowEvent {
        @Override
        public String type() {
            return "tool_call";
        }
    }

    /**
     * Node finished; {@code output} is null when the node's output is not streamed
     */
    record NodeCompleted(String runId, String nodeId, JsonNode output) implements WorkflowEvent {
        @Override
        public String type() {
            return "node_complete";
        }
    }

    record Error(String runId, RunError error) implements WorkflowEvent {
        @Override
        public String type() {
            return "error";
        }
    }

    record Done(String runId, RunResult result) implements WorkflowEvent {
        @Override
        public String type() {
            return "done";
        }
    }
}
