package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.RunCancelledException;
import org.neuralchilli.juglans.domain.RunError;
import org.neuralchilli.juglans.domain.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Forwards tool calls nobody in-process can handle to the connected client and correlates
 * the client's answers by call id.
 *
 * A run is connected when its {@link ExecutionContext} carries a bridge.
 */
@ApplicationScoped
public class ClientBridge {

    private static final Logger log = LoggerFactory.getLogger(ClientBridge.class);

    private final Map<String, PendingToolCall> pending = new ConcurrentHashMap<>();

    /**
     * Emit a {@code tool_call} event and wait for {@link #complete} or the deadline.
     * Fails with {@link ToolTimeoutException} on deadline and {@link RunCancelledException}
     * when the run is cancelled first.
     */
    public CompletableFuture<List<ToolCallResult>> emitAndAwait(ExecutionContext context, JsonNode calls, Duration timeout) {
        String callId = "call_" + UUID.randomUUID();
        Instant deadline = timeout != null ? Instant.now().plus(timeout) : null;
        PendingToolCall call = new PendingToolCall(callId, context.runId(), calls, deadline);
        pending.put(callId, call);

        Runnable unregister = context.onCancel(() -> call.fail(new RunCancelledException(
                "Run " + context.runId() + " cancelled while waiting for client tool call " + callId)));

        log.info("Forwarding {} tool call(s) to client as {} (run {})", calls.size(), callId, context.runId());
        context.emit(new WorkflowEvent.ToolCall(context.runId(), callId, calls));

        CompletableFuture<List<ToolCallResult>> completion = call.completion();
        if (timeout != null) {
            completion = completion.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return completion.handle((results, error) -> {
            pending.remove(callId);
            unregister.run();
            if (error == null) {
                log.debug("Client answered {} with {} result(s)", callId, results.size());
                return results;
            }
            Throwable cause = RunError.unwrap(error);
            if (cause instanceof TimeoutException) {
                log.warn("Client tool call {} timed out after {}", callId, timeout);
                throw new ToolTimeoutException(callId, timeout);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CallFailureException("Client tool call " + callId + " failed: " + cause.getMessage(), cause);
        });
    }

    /**
     * Deliver the client's answer. Returns false for unknown or already settled calls.
     */
    public boolean complete(String callId, List<ToolCallResult> results) {
        PendingToolCall call = pending.get(callId);
        if (call == null) {
            log.warn("Received results for unknown tool call {}", callId);
            return false;
        }
        return call.complete(results);
    }

    /**
     * Release every pending call of a run with a cancellation error
     */
    public int cancelRun(String runId) {
        int released = 0;
        for (PendingToolCall call : pending.values()) {
            if (runId.equals(call.runId()) && call.fail(new RunCancelledException("Run " + runId + " cancelled"))) {
                released++;
            }
        }
        if (released > 0) {
            log.info("Released {} pending tool call(s) of cancelled run {}", released, runId);
        }
        return released;
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(String callId) {
        return pending.containsKey(callId);
    }
}
