package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.config.EngineSettings;
import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.Node;
import org.neuralchilli.juglans.domain.NodeKind;
import org.neuralchilli.juglans.domain.RunResult;
import org.neuralchilli.juglans.domain.WorkflowException;
import org.neuralchilli.juglans.domain.WorkflowGraph;
import org.neuralchilli.juglans.tools.ToolDispatcher;
import org.neuralchilli.juglans.tools.ToolResult;
import org.neuralchilli.juglans.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Executes merged workflow graphs.
 *
 * Every run gets its own {@link GraphRun}; node actions run on the shared {@link WorkerPool}.
 * Loop bodies are executed as nested graph runs over the same context with one more loop scope,
 * one iteration after the other.
 */
@ApplicationScoped
public class WorkflowExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    private final ExpressionEvaluator evaluator;
    private final ToolDispatcher dispatcher;
    private final WorkerPool workers;
    private final EngineSettings settings;

    protected WorkflowExecutor() {
        this.evaluator = null;
        this.dispatcher = null;
        this.workers = null;
        this.settings = null;
    }

    @Inject
    public WorkflowExecutor(ExpressionEvaluator evaluator, ToolDispatcher dispatcher,
                            WorkerPool workers, EngineSettings settings) {
        this.evaluator = evaluator;
        this.dispatcher = dispatcher;
        this.workers = workers;
        this.settings = settings;
    }

    /**
     * Start a top-level run. The returned handle completes when the run terminates;
     * a {@code done} event is emitted to the context's sink.
     */
    public RunHandle start(WorkflowGraph graph, ExecutionContext context) {
        log.info("[{}] Starting workflow '{}' ({} nodes, {} edges)",
                context.runId(), graph.slug(), graph.nodes().size(), graph.edges().size());

        GraphRun run = new GraphRun(graph, context, this, true);
        CompletableFuture<RunResult> result = run.start();

        settings.runTimeoutIfSet().ifPresent(timeout -> scheduleTimeout(context, result, timeout));
        return new RunHandle(context, result, run::statuses);
    }

    /**
     * Start a top-level run and return its eventual result
     */
    public CompletableFuture<RunResult> execute(WorkflowGraph graph, ExecutionContext context) {
        return start(graph, context).result();
    }

    /**
     * Run a graph inside an enclosing run: no {@code done} event, no run timeout of its own
     */
    public CompletableFuture<RunResult> runGraph(WorkflowGraph graph, ExecutionContext context) {
        return new GraphRun(graph, context, this, false).start();
    }

    /**
     * Execute one node's action. The future fails with a {@link WorkflowException} (or any
     * exception a tool raised) when the node fails.
     */
    public CompletableFuture<ToolResult> executeNode(Node node, ExecutionContext context) {
        if (context.isCancelled()) {
            return CompletableFuture.failedFuture(new RunCancelledException(
                    "Run cancelled before node " + node.id() + " started"));
        }

        try {
            NodeKind kind = node.kind();
            if (kind instanceof NodeKind.Call call) {
                return executeCall(node.id(), call, context);
            } else if (kind instanceof NodeKind.Literal literal) {
                return CompletableFuture.completedFuture(ToolResult.of(literal.value()));
            } else if (kind instanceof NodeKind.ForEach forEach) {
                return executeForEach(node.id(), forEach, context);
            } else if (kind instanceof NodeKind.While whileLoop) {
                return executeWhile(node.id(), whileLoop, context);
            }
            throw new IllegalStateException("Unknown node kind: " + kind);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<ToolResult> executeCall(String nodeId, NodeKind.Call call, ExecutionContext context) {
        Map<String, JsonNode> arguments = new LinkedHashMap<>();
        for (Map.Entry<String, String> argument : call.arguments().entrySet()) {
            arguments.put(argument.getKey(), evaluator.evaluate(argument.getValue(), context));
        }
        log.debug("Node {} calls {} with {}", nodeId, call.target(), arguments);

        return dispatcher.dispatch(call.target(), arguments, context, nodeId);
    }

    private CompletableFuture<ToolResult> executeForEach(String nodeId, NodeKind.ForEach forEach, ExecutionContext context) {
        JsonNode collection = evaluator.evaluate(forEach.collection(), context);
        if (Values.isNull(collection)) {
            throw new UnresolvedVariableException(forEach.collection(),
                    "Foreach collection '" + forEach.collection() + "' not found");
        }
        if (!collection.isArray()) {
            throw new ExpressionException("Foreach collection '" + forEach.collection()
                    + "' is not an array: " + Values.toJson(collection));
        }

        log.debug("Node {} iterates {} items as ${}", nodeId, collection.size(), forEach.itemVar());
        ArrayNode results = Values.array();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

        for (int i = 0; i < collection.size(); i++) {
            LoopScope scope = LoopScope.forEach(forEach.itemVar(), collection.get(i), i, collection.size());
            chain = chain.thenCompose(ignored -> runIteration(nodeId, forEach.body(), context, scope)
                    .thenAccept(results::add));
        }

        return chain.thenApply(ignored -> ToolResult.of(results));
    }

    private CompletableFuture<ToolResult> executeWhile(String nodeId, NodeKind.While whileLoop, ExecutionContext context) {
        ArrayNode results = Values.array();
        return iterateWhile(nodeId, whileLoop, context, 0, results)
                .thenApply(ignored -> ToolResult.of(results));
    }

    private CompletableFuture<Void> iterateWhile(String nodeId, NodeKind.While whileLoop, ExecutionContext context,
                                                 int index, ArrayNode results) {
        LoopScope scope = LoopScope.whileLoop(index);
        ExecutionContext scoped = context.enterLoop(scope);

        if (!evaluator.evaluateCondition(whileLoop.condition(), scoped)) {
            log.debug("Node {} loop condition false after {} iterations", nodeId, index);
            return CompletableFuture.completedFuture(null);
        }
        if (index >= settings.maxLoopIterations()) {
            throw new WorkflowException(ErrorCode.LOOP_LIMIT_EXCEEDED,
                    "Loop limit exceeded: more than " + settings.maxLoopIterations() + " iterations", nodeId, null, null);
        }

        return runIteration(nodeId, whileLoop.body(), context, scope)
                .thenCompose(value -> {
                    results.add(value);
                    return iterateWhile(nodeId, whileLoop, context, index + 1, results);
                });
    }

    /**
     * Run one loop body iteration; a failing body fails the loop node
     */
    CompletableFuture<JsonNode> runIteration(String nodeId, WorkflowGraph body, ExecutionContext context, LoopScope scope) {
        if (context.isCancelled()) {
            return CompletableFuture.failedFuture(new RunCancelledException("Run cancelled inside loop " + nodeId));
        }
        log.debug("Node {} iteration {}", nodeId, scope.index());

        return runGraph(body, context.enterLoop(scope)).thenApply(result -> {
            if (result instanceof RunResult.Failure failure) {
                throw failure.runError().toException("Error inside loop body of " + nodeId
                        + " at index " + scope.index());
            }
            return result.value();
        });
    }

    private void scheduleTimeout(ExecutionContext context, CompletableFuture<RunResult> result, Duration timeout) {
        ScheduledFuture<?> timer = workers.schedule(
                () -> context.cancel("run timeout of " + timeout + " exceeded"),
                timeout.toMillis());
        result.whenComplete((ignored, error) -> timer.cancel(false));
    }

    ExpressionEvaluator evaluator() {
        return evaluator;
    }

    WorkerPool workers() {
        return workers;
    }
}
