package org.neuralchilli.juglans.testing;

import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.tools.BuiltinTool;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records which nodes called it, per run, and returns the node id.
 * An optional {@code delay_ms} argument holds the worker to widen race windows.
 */
@ApplicationScoped
public class RecordingTool implements BuiltinTool {

    private final Map<String, List<String>> calls = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "record";
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        long delay = invocation.number("delay_ms").map(Double::longValue).orElse(0L);
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CompletableFuture.failedFuture(e);
            }
        }
        calls.computeIfAbsent(invocation.context().runId(), id -> new CopyOnWriteArrayList<>())
                .add(invocation.nodeId());
        return CompletableFuture.completedFuture(ToolResult.of(TextNode.valueOf(invocation.nodeId())));
    }

    public List<String> calls(String runId) {
        return List.copyOf(calls.getOrDefault(runId, List.of()));
    }

    public long count(String runId, String nodeId) {
        return calls(runId).stream().filter(nodeId::equals).count();
    }
}
