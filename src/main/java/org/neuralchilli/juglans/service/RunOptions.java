package org.neuralchilli.juglans.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.neuralchilli.juglans.core.EventSink;

/**
 * Per-run inputs of {@link WorkflowService#start}.
 *
 * @param input         read-only run input, {@code $input}
 * @param events        observer channel, no-op when null
 * @param connectClient give the run a client bridge so unknown tools are forwarded to the client
 * @param runId         run id to use, generated when null
 */
public record RunOptions(JsonNode input, EventSink events, boolean connectClient, String runId) {

    public RunOptions {
        events = events != null ? events : EventSink.noop();
    }

    public static RunOptions of(JsonNode input) {
        return new RunOptions(input, null, false, null);
    }

    public RunOptions withEvents(EventSink sink) {
        return new RunOptions(input, sink, connectClient, runId);
    }

    public RunOptions withClient() {
        return new RunOptions(input, events, true, runId);
    }

    public RunOptions withRunId(String id) {
        return new RunOptions(input, events, connectClient, id);
    }
}
