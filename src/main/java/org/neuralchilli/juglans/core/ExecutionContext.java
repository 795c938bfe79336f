package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.RunError;
import org.neuralchilli.juglans.domain.WorkflowEvent;
import org.neuralchilli.juglans.domain.WorkflowException;
import org.neuralchilli.juglans.tools.ClientBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-scoped state shared by every node of a run: the read-only input, the mutable {@code ctx},
 * node outputs, the current output pointer, reply metadata and the loop scope stack.
 *
 * Instances are cheap views. {@link #enterLoop} returns a view with one more loop scope over the
 * same shared state; {@link #isolated} creates a fresh state for a nested sub-run.
 */
public final class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 10;

    private final Shared shared;
    private final List<LoopScope> loopScopes;

    private ExecutionContext(Shared shared, List<LoopScope> loopScopes) {
        this.shared = shared;
        this.loopScopes = loopScopes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Context with the given input and no collaborators attached
     */
    public static ExecutionContext of(JsonNode input) {
        return builder().input(input).build();
    }

    public String runId() {
        return shared.runId;
    }

    public JsonNode input() {
        return shared.input;
    }

    // ctx

    /**
     * Read a dotted path below {@code ctx}; returns a copy, null node when missing
     */
    public JsonNode ctxValue(String path) {
        return ctxValue(splitPath(path));
    }

    public JsonNode ctxValue(List<String> segments) {
        synchronized (shared.ctx) {
            if (segments.isEmpty()) {
                return shared.ctx.deepCopy();
            }
            return Values.at(shared.ctx, segments).deepCopy();
        }
    }

    public boolean hasCtxKey(String key) {
        synchronized (shared.ctx) {
            return shared.ctx.has(key);
        }
    }

    public ObjectNode ctxSnapshot() {
        synchronized (shared.ctx) {
            return shared.ctx.deepCopy();
        }
    }

    /**
     * Write a dotted path below {@code ctx}, creating intermediate objects.
     * A non-object intermediate is replaced.
     */
    public void setCtx(String path, JsonNode value) {
        List<String> segments = splitPath(stripRoot(path, "ctx"));
        if (segments.isEmpty()) {
            throw new WorkflowException(ErrorCode.VALIDATION_ERROR, "Context path cannot be empty");
        }
        JsonNode stored = value != null ? value.deepCopy() : NullNode.getInstance();

        synchronized (shared.ctx) {
            ObjectNode parent = shared.ctx;
            for (int i = 0; i < segments.size() - 1; i++) {
                JsonNode child = parent.get(segments.get(i));
                if (child == null || !child.isObject()) {
                    child = parent.putObject(segments.get(i));
                }
                parent = (ObjectNode) child;
            }
            parent.set(segments.get(segments.size() - 1), stored);
        }
        log.trace("ctx.{} = {}", path, stored);
    }

    // node outputs

    public void recordOutput(String nodeId, JsonNode value) {
        JsonNode stored = value != null ? value : NullNode.getInstance();
        shared.nodeResults.compute(nodeId, (id, existing) -> {
            ObjectNode entry = existing != null ? existing.deepCopy() : Values.object();
            entry.set("output", stored);
            entry.remove("error");
            return entry;
        });
        shared.current.set(stored);
    }

    public void recordError(String nodeId, RunError error) {
        shared.nodeResults.compute(nodeId, (id, existing) -> {
            ObjectNode entry = existing != null ? existing.deepCopy() : Values.object();
            entry.set("error", error.toJson());
            return entry;
        });
    }

    /**
     * Stored entry {@code {"output": .., "error": ..}} of a node, if it ran
     */
    public Optional<JsonNode> nodeResult(String nodeId) {
        return Optional.ofNullable(shared.nodeResults.get(nodeId));
    }

    public JsonNode nodeOutput(String nodeId) {
        JsonNode entry = shared.nodeResults.get(nodeId);
        if (entry == null || !entry.has("output")) {
            return NullNode.getInstance();
        }
        return entry.get("output");
    }

    public Set<String> nodeResultIds() {
        return Collections.unmodifiableSet(shared.nodeResults.keySet());
    }

    /**
     * Value of {@code $output}: the last persisted node output
     */
    public JsonNode currentOutput() {
        return shared.current.get();
    }

    // reply

    public JsonNode replyValue(List<String> segments) {
        synchronized (shared.reply) {
            return Values.at(shared.reply, segments).deepCopy();
        }
    }

    public ObjectNode replySnapshot() {
        synchronized (shared.reply) {
            return shared.reply.deepCopy();
        }
    }

    public Optional<String> replyText(String field) {
        synchronized (shared.reply) {
            JsonNode value = shared.reply.get(field);
            if (value == null || value.isNull() || Values.asText(value).isBlank()) {
                return Optional.empty();
            }
            return Optional.of(Values.asText(value));
        }
    }

    /**
     * Set a reply field. Setting {@code status} emits a status event.
     */
    public void setReply(String field, JsonNode value) {
        synchronized (shared.reply) {
            shared.reply.set(field, value != null ? value : NullNode.getInstance());
        }
        if ("status".equals(field)) {
            emit(new WorkflowEvent.Status(runId(), Values.asText(value)));
        }
    }

    /**
     * Append streamed text to {@code reply.output}
     */
    public void appendReplyOutput(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        synchronized (shared.reply) {
            String existing = shared.reply.has("output") ? Values.asText(shared.reply.get("output")) : "";
            shared.reply.set("output", TextNode.valueOf(existing + text));
        }
    }

    /**
     * Read {@code reply.x}, {@code ctx.x}, {@code output} or a bare ctx path
     */
    public JsonNode read(String path) {
        List<String> segments = splitPath(path);
        if (segments.isEmpty()) {
            return NullNode.getInstance();
        }
        List<String> rest = segments.subList(1, segments.size());
        return switch (segments.get(0)) {
            case "reply" -> replyValue(rest);
            case "ctx" -> ctxValue(rest);
            case "output" -> Values.at(currentOutput(), rest);
            case "input" -> Values.at(input(), rest);
            default -> ctxValue(segments);
        };
    }

    // loops

    public ExecutionContext enterLoop(LoopScope scope) {
        List<LoopScope> scopes = new ArrayList<>(loopScopes);
        scopes.add(scope);
        return new ExecutionContext(shared, Collections.unmodifiableList(scopes));
    }

    /**
     * Active loop scopes, innermost last
     */
    public List<LoopScope> loopScopes() {
        return loopScopes;
    }

    public Optional<LoopScope> innermostLoop() {
        return loopScopes.isEmpty() ? Optional.empty() : Optional.of(loopScopes.get(loopScopes.size() - 1));
    }

    // collaborators

    public void emit(WorkflowEvent event) {
        try {
            shared.events.emit(event);
        } catch (RuntimeException e) {
            log.warn("Event sink rejected {} event for run {}: {}", event.type(), runId(), e.getMessage());
        }
    }

    public EventSink events() {
        return shared.events;
    }

    public Optional<ClientBridge> clientBridge() {
        return Optional.ofNullable(shared.bridge);
    }

    public Optional<NestedWorkflowRunner> nestedRunner() {
        return Optional.ofNullable(shared.nestedRunner);
    }

    // nested executions

    /**
     * Fresh state for a nested sub-run. Events, client bridge, runner, execution stack
     * and cancellation are inherited.
     */
    public ExecutionContext isolated(JsonNode input) {
        Shared child = new Shared(shared.runId, input, shared.events, shared.bridge,
                shared.nestedRunner, shared.executionStack, shared.maxNestingDepth);
        ExecutionContext isolated = new ExecutionContext(child, List.of());
        child.detachFromParent = onCancel(() -> isolated.cancel(cancellationReason().orElse("parent run cancelled")));
        return isolated;
    }

    /**
     * Stop following the parent's cancellation once a nested sub-run has finished.
     * No-op for contexts not created by {@link #isolated}.
     */
    public void detach() {
        Runnable detach = shared.detachFromParent;
        if (detach != null) {
            shared.detachFromParent = null;
            detach.run();
        }
    }

    /**
     * Push a nested execution identifier, rejecting recursion and excessive depth
     */
    public void enterExecution(String identifier) {
        Deque<String> stack = shared.executionStack;
        synchronized (stack) {
            if (stack.contains(identifier)) {
                List<String> chain = new ArrayList<>(stack);
                Collections.reverse(chain);
                chain.add(identifier);
                throw new WorkflowException(ErrorCode.CALL_FAILURE,
                        "Recursive workflow execution detected: " + String.join(" -> ", chain));
            }
            if (stack.size() >= shared.maxNestingDepth) {
                throw new WorkflowException(ErrorCode.CALL_FAILURE,
                        "Maximum workflow nesting depth (" + shared.maxNestingDepth + ") exceeded at " + identifier);
            }
            stack.push(identifier);
        }
        log.debug("Entered nested execution {} (depth {})", identifier, executionDepth());
    }

    public void exitExecution(String identifier) {
        Deque<String> stack = shared.executionStack;
        synchronized (stack) {
            stack.remove(identifier);
        }
    }

    public int executionDepth() {
        synchronized (shared.executionStack) {
            return shared.executionStack.size();
        }
    }

    /**
     * Copy the named fields of a finished nested run into this context's {@code ctx}
     */
    public void mergeReturned(ExecutionContext child, List<String> fields) {
        for (String field : fields) {
            JsonNode value = child.read(field);
            setCtx(stripRoot(field, "ctx"), value);
        }
    }

    // cancellation

    public boolean isCancelled() {
        return shared.cancelled.get();
    }

    public Optional<String> cancellationReason() {
        return Optional.ofNullable(shared.cancellationReason.get());
    }

    public void cancel(String reason) {
        if (!shared.cancelled.compareAndSet(false, true)) {
            return;
        }
        shared.cancellationReason.set(reason);
        log.info("Run {} cancelled: {}", runId(), reason);
        for (Runnable listener : shared.cancelListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed for run {}", runId(), e);
            }
        }
    }

    /**
     * Register a callback run once on cancellation; runs immediately if already cancelled.
     *
     * @return action that unregisters the callback, to be run when the owner finishes
     */
    public Runnable onCancel(Runnable listener) {
        shared.cancelListeners.add(listener);
        if (isCancelled()) {
            listener.run();
        }
        return () -> shared.cancelListeners.remove(listener);
    }

    int cancelListenerCount() {
        return shared.cancelListeners.size();
    }

    public static List<String> splitPath(String path) {
        if (path == null || path.isBlank()) {
            return List.of();
        }
        String cleaned = path.startsWith("$") ? path.substring(1) : path;
        return Arrays.stream(cleaned.split("\\."))
                .filter(segment -> !segment.isEmpty())
                .toList();
    }

    private static String stripRoot(String path, String root) {
        String cleaned = path.startsWith("$") ? path.substring(1) : path;
        if (cleaned.startsWith(root + ".")) {
            return cleaned.substring(root.length() + 1);
        }
        return cleaned;
    }

    private static final class Shared {
        final String runId;
        final JsonNode input;
        final ObjectNode ctx = Values.object();
        final Map<String, ObjectNode> nodeResults = new ConcurrentHashMap<>();
        final AtomicReference<JsonNode> current = new AtomicReference<>(NullNode.getInstance());
        final ObjectNode reply = Values.object();
        final EventSink events;
        final ClientBridge bridge;
        final NestedWorkflowRunner nestedRunner;
        final Deque<String> executionStack;
        final int maxNestingDepth;
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        final AtomicReference<String> cancellationReason = new AtomicReference<>();
        final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();
        volatile Runnable detachFromParent;

        Shared(String runId, JsonNode input, EventSink events, ClientBridge bridge,
               NestedWorkflowRunner nestedRunner, Deque<String> executionStack, int maxNestingDepth) {
            this.runId = runId;
            this.input = input != null ? input.deepCopy() : NullNode.getInstance();
            this.events = events != null ? events : EventSink.noop();
            this.bridge = bridge;
            this.nestedRunner = nestedRunner;
            this.executionStack = executionStack;
            this.maxNestingDepth = maxNestingDepth;
        }
    }

    public static class Builder {
        private String runId;
        private JsonNode input;
        private EventSink events;
        private ClientBridge clientBridge;
        private NestedWorkflowRunner nestedRunner;
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder input(JsonNode input) {
            this.input = input;
            return this;
        }

        public Builder events(EventSink events) {
            this.events = events;
            return this;
        }

        public Builder clientBridge(ClientBridge clientBridge) {
            this.clientBridge = clientBridge;
            return this;
        }

        public Builder nestedRunner(NestedWorkflowRunner nestedRunner) {
            this.nestedRunner = nestedRunner;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public ExecutionContext build() {
            String id = runId != null ? runId : UUID.randomUUID().toString();
            Shared shared = new Shared(id, input, events, clientBridge, nestedRunner,
                    new ArrayDeque<>(), maxNestingDepth);
            return new ExecutionContext(shared, List.of());
        }
    }
}
