package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neuralchilli.juglans.domain.Edge;
import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.Node;
import org.neuralchilli.juglans.domain.NodeStatus;
import org.neuralchilli.juglans.domain.RunError;
import org.neuralchilli.juglans.domain.RunResult;
import org.neuralchilli.juglans.domain.WorkflowEvent;
import org.neuralchilli.juglans.domain.WorkflowGraph;
import org.neuralchilli.juglans.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Scheduler state of one execution of one graph.
 *
 * A node becomes ready the first time any incoming edge is satisfied; later satisfactions are
 * no-ops. An edge is dead when its source failed without taking it, its condition was false, a
 * sibling took precedence, or its source is unreachable. A pending node whose incoming edges are
 * all dead is unreachable. Every state transition happens under {@link #lock}.
 */
final class GraphRun {

    private static final Logger log = LoggerFactory.getLogger(GraphRun.class);

    private enum EdgeState {
        UNRESOLVED,
        SATISFIED,
        DEAD
    }

    private final WorkflowGraph graph;
    private final ExecutionContext context;
    private final WorkflowExecutor executor;
    private final boolean topLevel;

    private final List<Edge> edges;
    private final EdgeState[] edgeStates;
    private final Map<String, List<Integer>> outgoing = new HashMap<>();
    private final Map<String, List<Integer>> incoming = new HashMap<>();

    private final Map<String, NodeStatus> statuses = new LinkedHashMap<>();
    private final Map<String, JsonNode> values = new HashMap<>();
    private final Map<String, CompletableFuture<ToolResult>> inFlight = new HashMap<>();
    private final Deque<String> readyQueue = new ArrayDeque<>();
    private final CompletableFuture<RunResult> result = new CompletableFuture<>();
    private final Object lock = new Object();

    private String lastCompleted;

    GraphRun(WorkflowGraph graph, ExecutionContext context, WorkflowExecutor executor, boolean topLevel) {
        this.graph = graph;
        this.context = context;
        this.executor = executor;
        this.topLevel = topLevel;

        this.edges = graph.edges();
        this.edgeStates = new EdgeState[edges.size()];
        for (int i = 0; i < edges.size(); i++) {
            Edge edge = edges.get(i);
            edgeStates[i] = EdgeState.UNRESOLVED;
            outgoing.computeIfAbsent(edge.source(), id -> new ArrayList<>()).add(i);
            incoming.computeIfAbsent(edge.target(), id -> new ArrayList<>()).add(i);
        }
        for (String id : graph.nodeIds()) {
            statuses.put(id, NodeStatus.PENDING);
        }
    }

    CompletableFuture<RunResult> start() {
        synchronized (lock) {
            List<String> entries = graph.effectiveEntryNodes();
            log.debug("Run {} graph '{}': entries {}", context.runId(), graph.slug(), entries);

            for (String entry : entries) {
                markReady(entry);
            }
            for (String id : graph.nodeIds()) {
                if (statuses.get(id) == NodeStatus.PENDING && incomingOf(id).isEmpty()) {
                    log.debug("Node {} has no incoming edges and is not an entry", id);
                    markUnreachable(id);
                }
            }

            drain();
            checkCompletion();
        }

        Runnable unregister = context.onCancel(() -> cancel(context.cancellationReason().orElse("cancelled")));
        result.whenComplete((outcome, error) -> unregister.run());
        return result;
    }

    /**
     * Status snapshot, for diagnostics and tests
     */
    Map<String, NodeStatus> statuses() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
        }
    }

    private void cancel(String reason) {
        synchronized (lock) {
            if (result.isDone()) {
                return;
            }
            RunError error = new RunError(ErrorCode.CANCELLED, "Run cancelled: " + reason, null, null);
            if (topLevel) {
                context.emit(new WorkflowEvent.Error(context.runId(), error));
            }
            terminate(RunResult.failure(error));
        }
    }

    private void drain() {
        while (!readyQueue.isEmpty() && !result.isDone()) {
            launch(readyQueue.poll());
        }
    }

    private void launch(String nodeId) {
        if (context.isCancelled()) {
            terminate(RunResult.failure(new RunError(ErrorCode.CANCELLED,
                    "Run cancelled: " + context.cancellationReason().orElse("cancelled"), nodeId, null)));
            return;
        }

        Node node = graph.node(nodeId).orElseThrow(() ->
                new IllegalStateException("Node '" + nodeId + "' is not part of graph '" + graph.slug() + "'"));

        statuses.put(nodeId, NodeStatus.RUNNING);
        context.emit(new WorkflowEvent.NodeStarted(context.runId(), nodeId));
        log.info("[{}] Node {} started", context.runId(), nodeId);

        CompletableFuture<ToolResult> future = executor.workers().compose(() -> executor.executeNode(node, context));
        inFlight.put(nodeId, future);
        future.whenCompleteAsync((value, error) -> onNodeFinished(nodeId, value, error), executor.workers().executor());
    }

    private void onNodeFinished(String nodeId, ToolResult value, Throwable error) {
        synchronized (lock) {
            inFlight.remove(nodeId);
            if (result.isDone()) {
                log.debug("Ignoring completion of {} after run {} terminated", nodeId, context.runId());
                return;
            }

            if (error == null) {
                onSuccess(nodeId, value);
            } else {
                onFailure(nodeId, error);
            }

            drain();
            checkCompletion();
        }
    }

    private void onSuccess(String nodeId, ToolResult value) {
        statuses.put(nodeId, NodeStatus.DONE);
        values.put(nodeId, value.value());
        lastCompleted = nodeId;

        if (value.persist()) {
            context.recordOutput(nodeId, value.value());
        }
        context.emit(new WorkflowEvent.NodeCompleted(context.runId(), nodeId, value.stream() ? value.value() : null));
        log.info("[{}] Node {} completed", context.runId(), nodeId);

        resolveOutgoing(nodeId);
    }

    private void onFailure(String nodeId, Throwable error) {
        RunError runError = RunError.from(error, nodeId);
        statuses.put(nodeId, NodeStatus.FAILED);
        context.recordError(nodeId, runError);
        context.emit(new WorkflowEvent.Error(context.runId(), runError));

        List<Integer> outs = outgoingOf(nodeId);
        Integer handler = null;
        for (int index : outs) {
            if (edges.get(index).isErrorPath()) {
                handler = index;
                break;
            }
        }

        if (handler == null) {
            log.error("[{}] Node {} failed without error handler: {} ({})",
                    context.runId(), nodeId, runError.message(), runError.code().wireName());
            terminate(RunResult.failure(runError));
            return;
        }

        log.warn("[{}] Node {} failed, routing to {}: {}",
                context.runId(), nodeId, edges.get(handler).target(), runError.message());
        context.setCtx("error", runError.toJson());
        for (int index : outs) {
            if (index == handler) {
                satisfy(index);
            } else {
                kill(index);
            }
        }
    }

    /**
     * Decide every outgoing edge of a completed node, in declaration order. Conditional edges
     * and switch cases fire when they hold; unconditional edges next to them are defaults that
     * fire only if nothing else did.
     */
    private void resolveOutgoing(String nodeId) {
        List<Integer> outs = outgoingOf(nodeId);
        if (outs.isEmpty()) {
            return;
        }

        String subject = switchSubject(nodeId);
        boolean guarded = outs.stream()
                .map(edges::get)
                .anyMatch(edge -> edge.isConditional() || edge.isSwitchCase());

        boolean fired = false;
        boolean caseMatched = false;
        List<Integer> defaults = new ArrayList<>();

        for (int index : outs) {
            Edge edge = edges.get(index);

            if (edge.isErrorPath()) {
                kill(index);
            } else if (edge.isSwitchCase()) {
                if (!caseMatched && subject != null && subject.equals(edge.switchCase())) {
                    satisfy(index);
                    caseMatched = true;
                    fired = true;
                } else {
                    kill(index);
                }
            } else if (edge.isConditional()) {
                if (conditionHolds(edge)) {
                    satisfy(index);
                    fired = true;
                } else {
                    kill(index);
                }
            } else if (guarded) {
                defaults.add(index);
            } else {
                satisfy(index);
            }
        }

        for (int index : defaults) {
            if (fired) {
                kill(index);
            } else {
                satisfy(index);
            }
        }
    }

    private String switchSubject(String nodeId) {
        String expression = graph.switchRoutes().get(nodeId);
        if (expression == null) {
            return null;
        }
        try {
            String subject = executor.evaluator().render(expression, context);
            log.debug("Switch on {} evaluated to '{}'", nodeId, subject);
            return subject;
        } catch (RuntimeException e) {
            log.warn("Switch subject '{}' of node {} failed to evaluate, using default route: {}",
                    expression, nodeId, e.getMessage());
            return null;
        }
    }

    private boolean conditionHolds(Edge edge) {
        try {
            boolean holds = executor.evaluator().evaluateCondition(edge.condition(), context);
            log.debug("Edge {} condition is {}", edge, holds);
            return holds;
        } catch (RuntimeException e) {
            log.warn("Condition '{}' on {} failed to evaluate, treating as false: {}",
                    edge.condition(), edge, e.getMessage());
            return false;
        }
    }

    private void satisfy(int index) {
        edgeStates[index] = EdgeState.SATISFIED;
        markReady(edges.get(index).target());
    }

    private void kill(int index) {
        if (edgeStates[index] == EdgeState.DEAD) {
            return;
        }
        edgeStates[index] = EdgeState.DEAD;

        String target = edges.get(index).target();
        if (statuses.get(target) == NodeStatus.PENDING && allIncomingDead(target)) {
            markUnreachable(target);
        }
    }

    private void markReady(String nodeId) {
        if (statuses.get(nodeId) == NodeStatus.PENDING) {
            statuses.put(nodeId, NodeStatus.READY);
            readyQueue.add(nodeId);
        }
    }

    private void markUnreachable(String nodeId) {
        statuses.put(nodeId, NodeStatus.UNREACHABLE);
        log.debug("[{}] Node {} is unreachable", context.runId(), nodeId);
        for (int index : outgoingOf(nodeId)) {
            kill(index);
        }
    }

    private boolean allIncomingDead(String nodeId) {
        for (int index : incomingOf(nodeId)) {
            if (edgeStates[index] != EdgeState.DEAD) {
                return false;
            }
        }
        return true;
    }

    private void checkCompletion() {
        if (result.isDone() || !inFlight.isEmpty() || !readyQueue.isEmpty()) {
            return;
        }

        // Nothing running and nothing ready: whatever is still pending can never trigger
        for (Map.Entry<String, NodeStatus> entry : statuses.entrySet()) {
            if (entry.getValue() == NodeStatus.PENDING) {
                entry.setValue(NodeStatus.UNREACHABLE);
                log.debug("[{}] Node {} never triggered, marking unreachable", context.runId(), entry.getKey());
            }
        }

        terminate(buildSuccess());
    }

    private RunResult buildSuccess() {
        Map<String, JsonNode> exitValues = new LinkedHashMap<>();
        for (String exit : graph.exitNodes()) {
            if (statuses.get(exit) == NodeStatus.DONE) {
                exitValues.put(exit, values.get(exit));
            }
        }

        JsonNode value;
        if (exitValues.size() == 1) {
            value = exitValues.values().iterator().next();
        } else if (exitValues.size() > 1) {
            ObjectNode combined = Values.object();
            exitValues.forEach(combined::set);
            value = combined;
        } else if (lastCompleted != null) {
            value = values.get(lastCompleted);
        } else {
            value = NullNode.getInstance();
        }
        return RunResult.success(exitValues, value);
    }

    private void terminate(RunResult outcome) {
        if (result.isDone()) {
            return;
        }

        if (outcome.isSuccess()) {
            log.debug("[{}] Graph '{}' finished", context.runId(), graph.slug());
        }
        if (topLevel) {
            log.info("[{}] Run finished: {}", context.runId(), outcome.isSuccess() ? "success"
                    : outcome.error().map(RunError::message).orElse("failure"));
            context.emit(new WorkflowEvent.Done(context.runId(), outcome));
        }

        result.complete(outcome);

        for (CompletableFuture<ToolResult> future : new ArrayList<>(inFlight.values())) {
            future.cancel(true);
        }

        // Work already started by sibling nodes stops with the context
        if (topLevel && !outcome.isSuccess() && !context.isCancelled()) {
            context.cancel(outcome.error().map(RunError::message).orElse("run failed"));
        }
    }

    private List<Integer> outgoingOf(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    private List<Integer> incomingOf(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }
}
