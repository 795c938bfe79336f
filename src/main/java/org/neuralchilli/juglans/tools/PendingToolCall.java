package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A batch of tool calls forwarded to the client, awaiting its answer.
 * The completion channel is single-use: the first completion wins.
 */
public final class PendingToolCall {

    private final String callId;
    private final String runId;
    private final JsonNode calls;
    private final Instant deadline;
    private final CompletableFuture<List<ToolCallResult>> completion = new CompletableFuture<>();

    public PendingToolCall(String callId, String runId, JsonNode calls, Instant deadline) {
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("Call id cannot be null or empty");
        }
        this.callId = callId;
        this.runId = runId;
        this.calls = calls;
        this.deadline = deadline;
    }

    public String callId() {
        return callId;
    }

    public String runId() {
        return runId;
    }

    public JsonNode calls() {
        return calls;
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public CompletableFuture<List<ToolCallResult>> completion() {
        return completion;
    }

    /**
     * @return false if the call was already completed, failed or cancelled
     */
    public boolean complete(List<ToolCallResult> results) {
        return completion.complete(List.copyOf(results));
    }

    public boolean fail(Throwable error) {
        return completion.completeExceptionally(error);
    }

    public boolean isDone() {
        return completion.isDone();
    }
}
