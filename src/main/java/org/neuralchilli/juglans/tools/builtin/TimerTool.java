package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.core.RunCancelledException;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.tools.BuiltinTool;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResult;
import org.neuralchilli.juglans.worker.WorkerPool;

import java.util.concurrent.CompletableFuture;

/**
 * The {@code timer} tool: wait {@code ms} milliseconds or {@code seconds} seconds
 * (one second when neither is given) without holding a worker thread.
 */
@ApplicationScoped
public class TimerTool implements BuiltinTool {

    public static final String NAME = "timer";

    static final long DEFAULT_MILLIS = 1000;

    private final WorkerPool workers;

    protected TimerTool() {
        this.workers = null;
    }

    @Inject
    public TimerTool(WorkerPool workers) {
        this.workers = workers;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        long millis = durationMillis(invocation);

        CompletableFuture<Void> delay = workers.delay(millis);
        Runnable unregister = invocation.context().onCancel(() -> delay.completeExceptionally(
                new RunCancelledException("Timer cancelled after run " + invocation.context().runId() + " was cancelled")));
        delay.whenComplete((ignored, error) -> unregister.run());

        return delay.thenApply(ignored -> {
            ObjectNode result = Values.object();
            result.put("status", "finished");
            result.put("duration_ms", millis);
            return ToolResult.of(result);
        });
    }

    static long durationMillis(ToolInvocation invocation) {
        if (invocation.has("ms")) {
            return invocation.number("ms").map(Double::longValue).orElse(DEFAULT_MILLIS);
        }
        if (invocation.has("seconds")) {
            return invocation.number("seconds").map(seconds -> (long) (seconds * 1000)).orElse(DEFAULT_MILLIS);
        }
        return DEFAULT_MILLIS;
    }
}
