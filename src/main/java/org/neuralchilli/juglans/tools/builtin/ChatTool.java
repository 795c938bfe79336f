package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.config.EngineSettings;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.NestedWorkflowRunner;
import org.neuralchilli.juglans.core.RunCancelledException;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.AgentDefinition;
import org.neuralchilli.juglans.domain.MessageState;
import org.neuralchilli.juglans.domain.RunError;
import org.neuralchilli.juglans.domain.RunResult;
import org.neuralchilli.juglans.domain.ToolDefinition;
import org.neuralchilli.juglans.domain.WorkflowEvent;
import org.neuralchilli.juglans.domain.WorkflowException;
import org.neuralchilli.juglans.llm.ChatModelClient;
import org.neuralchilli.juglans.llm.ChatOutcome;
import org.neuralchilli.juglans.llm.ChatRequest;
import org.neuralchilli.juglans.service.AgentRegistry;
import org.neuralchilli.juglans.service.PromptRegistry;
import org.neuralchilli.juglans.tools.BuiltinTool;
import org.neuralchilli.juglans.tools.CallFailureException;
import org.neuralchilli.juglans.tools.ClientBridge;
import org.neuralchilli.juglans.tools.ToolCallResult;
import org.neuralchilli.juglans.tools.ToolDispatcher;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResolutionException;
import org.neuralchilli.juglans.tools.ToolResolver;
import org.neuralchilli.juglans.tools.ToolResult;
import org.neuralchilli.juglans.util.StringFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The {@code chat} tool: one agent call.
 *
 * An agent with an associated workflow runs it as an isolated nested run. Otherwise the
 * model is called in a loop: tool calls it requests are executed (in-process, on a tool
 * server, or forwarded to the client) and fed back until it answers with text.
 * The {@code state} argument decides whether the answer is persisted and whether it is streamed.
 */
@ApplicationScoped
public class ChatTool implements BuiltinTool {

    private static final Logger log = LoggerFactory.getLogger(ChatTool.class);

    public static final String NAME = "chat";
    static final String CLIENT_EXECUTED_REPLY = "Client tools executed on frontend.";

    private final AgentRegistry agents;
    private final PromptRegistry prompts;
    private final ToolResolver toolResolver;
    private final ChatModelClient model;
    private final EngineSettings settings;
    private final StringFunctions strings = new StringFunctions();

    protected ChatTool() {
        this.agents = null;
        this.prompts = null;
        this.toolResolver = null;
        this.model = null;
        this.settings = null;
    }

    @Inject
    public ChatTool(AgentRegistry agents, PromptRegistry prompts, ToolResolver toolResolver,
                    ChatModelClient model, EngineSettings settings) {
        this.agents = agents;
        this.prompts = prompts;
        this.toolResolver = toolResolver;
        this.model = model;
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        AgentDefinition agent = agents.get(invocation.textOr("agent", AgentRegistry.DEFAULT_AGENT));
        String message = invocation.requireText("message");
        MessageState.Visibility visibility = MessageState.resolve(
                invocation.text("state").orElse(null),
                invocation.text("stateless").orElse(null));

        log.debug("Chat with agent '{}' (persist={}, stream={})", agent.slug(), visibility.persist(), visibility.stream());

        CompletableFuture<JsonNode> reply = agent.resolvedWorkflow().isPresent()
                ? runAgentWorkflow(agent, agent.resolvedWorkflow().get(), message, invocation.context())
                : runModel(agent, message, visibility, invocation);

        return reply.thenApply(value -> ToolResult.withVisibility(value, visibility));
    }

    // agent workflow

    private CompletableFuture<JsonNode> runAgentWorkflow(AgentDefinition agent, Path workflow, String message,
                                                         ExecutionContext context) {
        NestedWorkflowRunner runner = context.nestedRunner().orElseThrow(() -> new CallFailureException(
                "Agent '" + agent.slug() + "' has a workflow but no nested runner is available"));

        String identifier = agent.slug() + ":" + workflow;
        context.enterExecution(identifier);

        ObjectNode input = Values.object();
        input.put("message", message);
        ExecutionContext child = context.isolated(input);
        log.info("Agent '{}' runs workflow {}", agent.slug(), workflow);

        CompletableFuture<RunResult> run;
        try {
            run = runner.runNested(workflow, child);
        } catch (RuntimeException e) {
            context.exitExecution(identifier);
            child.detach();
            throw e;
        }
        if (agent.workflowTimeoutSeconds() != null && agent.workflowTimeoutSeconds() > 0) {
            run = run.orTimeout(agent.workflowTimeoutSeconds(), TimeUnit.SECONDS);
        }

        return run.handle((result, error) -> {
            context.exitExecution(identifier);
            child.detach();
            if (error != null) {
                Throwable cause = RunError.unwrap(error);
                if (cause instanceof TimeoutException) {
                    child.cancel("workflow timeout of " + agent.workflowTimeoutSeconds() + "s exceeded");
                    throw new CallFailureException("Workflow of agent '" + agent.slug() + "' timed out after "
                            + agent.workflowTimeoutSeconds() + "s");
                }
                if (cause instanceof WorkflowException workflowException) {
                    throw workflowException;
                }
                throw new CallFailureException("Workflow of agent '" + agent.slug() + "' failed: " + cause.getMessage(), cause);
            }
            if (result instanceof RunResult.Failure failure) {
                throw failure.runError().toException("Workflow of agent '" + agent.slug() + "' failed");
            }

            context.mergeReturned(child, agent.returns());
            JsonNode output = child.replyValue(List.of("output"));
            return Values.isNull(output) ? result.value() : output;
        });
    }

    // model loop

    private CompletableFuture<JsonNode> runModel(AgentDefinition agent, String message,
                                                 MessageState.Visibility visibility, ToolInvocation invocation) {
        ExecutionContext context = invocation.context();
        List<ToolDefinition> tools = toolResolver.resolveTools(invocation.arg("tools"), agent);
        String chatId = chatId(invocation, visibility, context);

        ObjectNode user = Values.object();
        user.put("role", "user");
        user.put("content", message);

        ChatRequest request = new ChatRequest(
                invocation.text("model").orElse(agent.model()),
                systemPrompt(agent, invocation),
                List.of(user),
                invocation.number("temperature").orElse(agent.temperature()),
                tools,
                chatId,
                visibility.stream());

        AtomicBoolean streamed = new AtomicBoolean(false);
        AtomicInteger totalTokens = new AtomicInteger();

        return turn(request, 1, invocation, streamed, totalTokens, visibility).thenApply(outcome -> {
            String content = outcome.content();
            if (visibility.stream() && !streamed.get() && !content.isEmpty()) {
                context.emit(new WorkflowEvent.Content(context.runId(), invocation.nodeId(), content));
            }
            if (visibility.persist()) {
                if (!streamed.get()) {
                    context.appendReplyOutput(content);
                }
                context.setReply("content", TextNode.valueOf(content));
                context.setReply("tokens", IntNode.valueOf(totalTokens.get()));
                context.setReply("model", TextNode.valueOf(outcome.model() != null ? outcome.model() : ""));
                if (outcome instanceof ChatOutcome.Final finalOutcome) {
                    context.setReply("finish_reason", TextNode.valueOf(finalOutcome.finishReason()));
                }
            }
            log.debug("Agent '{}' answered with {} characters, {} tokens", agent.slug(), content.length(), totalTokens.get());
            return formatted(content, invocation);
        });
    }

    private CompletableFuture<ChatOutcome> turn(ChatRequest request, int turn, ToolInvocation invocation,
                                                AtomicBoolean streamed, AtomicInteger totalTokens,
                                                MessageState.Visibility visibility) {
        ExecutionContext context = invocation.context();
        if (context.isCancelled()) {
            return CompletableFuture.failedFuture(new RunCancelledException("Run cancelled during chat turn " + turn));
        }

        return model.chat(request, text -> {
            streamed.set(true);
            if (visibility.stream()) {
                context.emit(new WorkflowEvent.Content(context.runId(), invocation.nodeId(), text));
            }
            if (visibility.persist()) {
                context.appendReplyOutput(text);
            }
        }).thenCompose(outcome -> {
            totalTokens.addAndGet(outcome.tokens());
            if (outcome instanceof ChatOutcome.ToolCalls toolCalls) {
                if (turn >= settings.maxToolTurns()) {
                    throw new CallFailureException("Agent tool loop exceeded " + settings.maxToolTurns() + " model turns");
                }
                log.debug("Turn {}: model requested {} tool call(s)", turn, toolCalls.calls().size());
                return executeToolCalls(toolCalls.calls(), invocation).thenCompose(results -> {
                    List<ExecutedCall> answered = results.stream().filter(ExecutedCall::fromClient).toList();
                    if (!answered.isEmpty() && answered.stream().allMatch(ExecutedCall::executedOnClient)) {
                        log.info("Client executed the requested tools, ending agent loop");
                        return CompletableFuture.completedFuture(
                                new ChatOutcome.Final(CLIENT_EXECUTED_REPLY, outcome.model(), "stop", 0));
                    }
                    List<JsonNode> next = new ArrayList<>();
                    next.add(toolCalls.assistantMessage());
                    for (ExecutedCall result : results) {
                        ObjectNode toolMessage = Values.object();
                        toolMessage.put("role", "tool");
                        toolMessage.put("tool_call_id", result.callId());
                        toolMessage.put("content", result.content());
                        next.add(toolMessage);
                    }
                    return turn(request.withMessages(next), turn + 1, invocation, streamed, totalTokens, visibility);
                });
            }
            return CompletableFuture.completedFuture(outcome);
        });
    }

    /**
     * Execute one batch of model tool calls. Local tools run one by one; the rest are
     * forwarded to the client in a single round trip, identical calls only once.
     */
    private CompletableFuture<List<ExecutedCall>> executeToolCalls(ArrayNode calls, ToolInvocation invocation) {
        ExecutionContext context = invocation.context();
        ToolDispatcher dispatcher = invocation.dispatcher();

        Map<String, CompletableFuture<ExecutedCall>> byCallId = new LinkedHashMap<>();
        Map<String, ObjectNode> forwarded = new LinkedHashMap<>();
        Map<String, String> forwardedIdByCallId = new LinkedHashMap<>();

        for (JsonNode call : calls) {
            String callId = call.path("id").asText("tc_" + UUID.randomUUID());
            String name = call.path("function").path("name").asText();
            String rawArguments = call.path("function").path("arguments").asText("{}");

            if (dispatcher.isLocal(name)) {
                byCallId.put(callId, executeLocal(dispatcher, callId, name, rawArguments, context));
                continue;
            }
            if (context.clientBridge().isEmpty()) {
                return CompletableFuture.failedFuture(new ToolResolutionException("Tool '" + name
                        + "' requested by the model is not available and no client bridge is connected"));
            }

            String key = name + "|" + Values.toJson(Values.parseLenient(rawArguments));
            ObjectNode first = forwarded.get(key);
            if (first == null) {
                ObjectNode forwardedCall = call.deepCopy();
                forwardedCall.put("id", callId);
                forwarded.put(key, forwardedCall);
                forwardedIdByCallId.put(callId, callId);
            } else {
                log.debug("De-duplicated client tool call {} onto {}", callId, first.path("id").asText());
                forwardedIdByCallId.put(callId, first.path("id").asText());
            }
            byCallId.put(callId, null);
        }

        CompletableFuture<Map<String, ToolCallResult>> clientResults = forwarded.isEmpty()
                ? CompletableFuture.completedFuture(Map.of())
                : forwardToClient(context, forwarded);

        List<CompletableFuture<ExecutedCall>> local = byCallId.values().stream()
                .filter(Objects::nonNull)
                .toList();

        return CompletableFuture.allOf(local.toArray(new CompletableFuture[0]))
                .thenCombine(clientResults, (ignored, answers) -> {
                    List<ExecutedCall> results = new ArrayList<>();
                    for (Map.Entry<String, CompletableFuture<ExecutedCall>> entry : byCallId.entrySet()) {
                        if (entry.getValue() != null) {
                            results.add(entry.getValue().join());
                            continue;
                        }
                        ToolCallResult answer = answers.get(forwardedIdByCallId.get(entry.getKey()));
                        if (answer == null) {
                            throw new CallFailureException("Client returned no result for tool call " + entry.getKey());
                        }
                        results.add(new ExecutedCall(entry.getKey(), answer.content(), true, answer.executedOnClient()));
                    }
                    return results;
                });
    }

    private CompletableFuture<ExecutedCall> executeLocal(ToolDispatcher dispatcher, String callId, String name,
                                                         String rawArguments, ExecutionContext context) {
        JsonNode arguments = Values.parseLenient(rawArguments);
        return dispatcher.dispatch(name, arguments.isObject() ? arguments : Values.object(), context)
                .handle((result, error) -> {
                    if (error == null) {
                        return new ExecutedCall(callId, Values.asText(result.value()), false, result.executedOnClient());
                    }
                    Throwable cause = RunError.unwrap(error);
                    if (cause instanceof RunCancelledException cancelled) {
                        throw cancelled;
                    }
                    log.warn("Tool '{}' failed inside agent loop: {}", name, cause.getMessage());
                    return new ExecutedCall(callId, "Error during tool execution: " + cause.getMessage(), false, false);
                });
    }

    private CompletableFuture<Map<String, ToolCallResult>> forwardToClient(ExecutionContext context,
                                                                           Map<String, ObjectNode> forwarded) {
        ClientBridge bridge = context.clientBridge().orElseThrow();
        ArrayNode batch = Values.array();
        forwarded.values().forEach(batch::add);

        return bridge.emitAndAwait(context, batch, settings.bridgeTimeout()).thenApply(answers -> {
            Map<String, ToolCallResult> byId = new LinkedHashMap<>();
            for (ToolCallResult answer : answers) {
                byId.put(answer.toolCallId(), answer);
            }
            return byId;
        });
    }

    private String chatId(ToolInvocation invocation, MessageState.Visibility visibility, ExecutionContext context) {
        Optional<String> chatId = invocation.text("chat_id");
        if (chatId.isEmpty() && visibility.persist()) {
            chatId = context.replyText("chat_id");
        }
        String id = chatId.orElseGet(() -> "chat_" + UUID.randomUUID());
        if (visibility.persist()) {
            context.setReply("chat_id", TextNode.valueOf(id));
        }
        return id;
    }

    private String systemPrompt(AgentDefinition agent, ToolInvocation invocation) {
        if (invocation.has("system_prompt")) {
            return invocation.requireText("system_prompt");
        }
        if (agent.systemPrompt() != null && !agent.systemPrompt().isBlank()) {
            return agent.systemPrompt();
        }
        if (agent.systemPromptSlug() != null) {
            return prompts.get(agent.systemPromptSlug()).body();
        }
        return null;
    }

    private JsonNode formatted(String content, ToolInvocation invocation) {
        if ("json".equalsIgnoreCase(invocation.textOr("format", ""))) {
            JsonNode parsed = Values.parseLenient(strings.stripCodeFences(content));
            if (parsed.isTextual()) {
                log.warn("Chat answer requested as JSON is not valid JSON, keeping text");
            }
            return parsed;
        }
        return TextNode.valueOf(content);
    }

    /**
     * @param fromClient the answer came back over the client bridge
     */
    private record ExecutedCall(String callId, String content, boolean fromClient, boolean executedOnClient) {
    }
}
