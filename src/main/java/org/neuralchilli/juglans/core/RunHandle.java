package org.neuralchilli.juglans.core;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.NodeStatus;
import org.neuralchilli.juglans.domain.RunError;
import org.neuralchilli.juglans.domain.RunResult;
import org.neuralchilli.juglans.domain.RunStatus;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Handle on a started run: its id, its eventual result and a way to cancel it.
 */
public final class RunHandle {

    private final ExecutionContext context;
    private final CompletableFuture<RunResult> result;
    private final Supplier<Map<String, NodeStatus>> statuses;

    RunHandle(ExecutionContext context, CompletableFuture<RunResult> result, Supplier<Map<String, NodeStatus>> statuses) {
        this.context = context;
        this.result = result;
        this.statuses = statuses;
    }

    public String runId() {
        return context.runId();
    }

    public ExecutionContext context() {
        return context;
    }

    public CompletableFuture<RunResult> result() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    public RunStatus status() {
        if (!result.isDone()) {
            return RunStatus.RUNNING;
        }
        RunResult outcome = result.getNow(null);
        if (outcome == null || !outcome.isSuccess()) {
            boolean cancelled = outcome != null
                    && outcome.error().map(error -> error.code() == ErrorCode.CANCELLED).orElse(false);
            return cancelled ? RunStatus.CANCELLED : RunStatus.FAILED;
        }
        return RunStatus.COMPLETED;
    }

    /**
     * Status of every top-level node, in declaration order
     */
    public Map<String, NodeStatus> nodeStatuses() {
        return statuses.get();
    }

    public NodeStatus status(String nodeId) {
        return nodeStatuses().get(nodeId);
    }

    /**
     * Cancel the run: in-flight nodes are cancelled and pending client tool calls released.
     * No-op once the run has finished.
     */
    public void cancel() {
        cancel("cancelled by caller");
    }

    public void cancel(String reason) {
        if (!result.isDone()) {
            context.cancel(reason);
        }
    }

    /**
     * Block until the run finishes
     */
    public RunResult await() {
        return result.join();
    }

    /**
     * Block until the run finishes or the timeout elapses. On timeout the run keeps going
     * and a CANCELLED failure is not produced; the caller decides whether to {@link #cancel()}.
     *
     * @throws TimeoutException when the run is still going after {@code timeout}
     */
    public RunResult await(Duration timeout) throws TimeoutException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RunResult.failure(new RunError(ErrorCode.CANCELLED, "Interrupted while awaiting run " + runId(), null, null));
        } catch (ExecutionException e) {
            return RunResult.failure(RunError.from(e, null));
        }
    }

    @Override
    public String toString() {
        return "RunHandle{runId='" + runId() + "', done=" + isDone() + "}";
    }
}
