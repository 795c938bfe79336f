package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.config.EngineSettings;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Routes a tool call to its executor: builtin registry, then external tool servers
 * ({@code namespace.tool}), then the run's client bridge.
 */
@ApplicationScoped
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    /**
     * Where a tool name resolves to
     */
    public enum Target {
        BUILTIN,
        TOOL_SERVER,
        CLIENT
    }

    private final BuiltinRegistry builtins;
    private final ToolServerRegistry servers;
    private final WorkerPool workers;
    private final EngineSettings settings;

    protected ToolDispatcher() {
        this.builtins = null;
        this.servers = null;
        this.workers = null;
        this.settings = null;
    }

    @Inject
    public ToolDispatcher(BuiltinRegistry builtins, ToolServerRegistry servers, WorkerPool workers, EngineSettings settings) {
        this.builtins = builtins;
        this.servers = servers;
        this.workers = workers;
        this.settings = settings;
    }

    /**
     * Resolve a tool name without calling it
     *
     * @throws ToolResolutionException when nothing can handle the name
     */
    public Target resolve(String name, ExecutionContext context) {
        if (builtins.contains(name)) {
            return Target.BUILTIN;
        }
        if (servers.contains(name)) {
            return Target.TOOL_SERVER;
        }
        if (context.clientBridge().isPresent()) {
            return Target.CLIENT;
        }
        throw new ToolResolutionException("Tool '" + name
                + "' not found: it is not a builtin, no tool server offers it and no client bridge is connected");
    }

    /**
     * True when the tool runs in this process or on a tool server
     */
    public boolean isLocal(String name) {
        return builtins.contains(name) || servers.contains(name);
    }

    public CompletableFuture<ToolResult> dispatch(String name, Map<String, JsonNode> arguments,
                                                  ExecutionContext context, String nodeId) {
        Target target;
        try {
            target = resolve(name, context);
        } catch (ToolResolutionException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Dispatching '{}' to {} (node {})", name, target, nodeId);

        return switch (target) {
            case BUILTIN -> callBuiltin(name, arguments, context, nodeId);
            case TOOL_SERVER -> callServer(name, arguments);
            case CLIENT -> callClient(name, arguments, context);
        };
    }

    /**
     * Call a tool with a JSON arguments object, as requested by a model
     */
    public CompletableFuture<ToolResult> dispatch(String name, JsonNode arguments, ExecutionContext context) {
        return dispatch(name, toArgumentMap(arguments), context, null);
    }

    private CompletableFuture<ToolResult> callBuiltin(String name, Map<String, JsonNode> arguments,
                                                      ExecutionContext context, String nodeId) {
        BuiltinTool tool = builtins.find(name).orElseThrow();
        try {
            return tool.execute(new ToolInvocation(name, arguments, context, nodeId, this));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<ToolResult> callServer(String name, Map<String, JsonNode> arguments) {
        Optional<ToolServerRegistry.ServerTool> tool = servers.find(name);
        if (tool.isEmpty()) {
            return CompletableFuture.failedFuture(new ToolResolutionException("Tool server tool '" + name + "' disappeared"));
        }
        ObjectNode json = Values.object();
        arguments.forEach(json::set);
        return workers.submit(() -> ToolResult.of(Values.parseLenient(servers.call(tool.get(), json))));
    }

    private CompletableFuture<ToolResult> callClient(String name, Map<String, JsonNode> arguments,
                                                     ExecutionContext context) {
        ClientBridge bridge = context.clientBridge().orElseThrow();

        ObjectNode args = Values.object();
        arguments.forEach(args::set);
        ArrayNode calls = Values.array();
        calls.add(toolCall("tc_" + UUID.randomUUID(), name, args));

        return bridge.emitAndAwait(context, calls, settings.bridgeTimeout())
                .thenApply(results -> toResult(name, results));
    }

    private ToolResult toResult(String name, List<ToolCallResult> results) {
        if (results.isEmpty()) {
            throw new CallFailureException("Client returned no result for tool '" + name + "'");
        }
        ToolCallResult first = results.get(0);
        ToolResult result = ToolResult.of(Values.parseLenient(first.content()));
        return first.executedOnClient() ? result.markExecutedOnClient() : result;
    }

    /**
     * Tool call in the OpenAI shape, arguments serialized to a JSON string
     */
    public static ObjectNode toolCall(String id, String name, JsonNode arguments) {
        ObjectNode function = Values.object();
        function.put("name", name);
        function.put("arguments", Values.toJson(arguments != null ? arguments : Values.object()));

        ObjectNode call = Values.object();
        call.put("id", id);
        call.put("type", "function");
        call.set("function", function);
        return call;
    }

    private static Map<String, JsonNode> toArgumentMap(JsonNode arguments) {
        Map<String, JsonNode> map = new LinkedHashMap<>();
        if (arguments != null && arguments.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = arguments.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), field.getValue());
            }
        }
        return map;
    }
}
