package org.neuralchilli.juglans.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.ToolDefinition;
import org.neuralchilli.juglans.tools.CallFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Chat client for any endpoint speaking the OpenAI {@code /chat/completions} protocol,
 * plain JSON or server-sent events when streaming.
 */
@ApplicationScoped
public class OpenAiCompatibleChatClient implements ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleChatClient.class);

    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final ChatSettings settings;

    protected OpenAiCompatibleChatClient() {
        this.httpClient = null;
        this.mapper = null;
        this.settings = null;
    }

    @Inject
    public OpenAiCompatibleChatClient(ChatSettings settings) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Values.mapper(), settings);
    }

    public OpenAiCompatibleChatClient(HttpClient httpClient, ObjectMapper mapper, ChatSettings settings) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.settings = settings;
    }

    @Override
    public CompletableFuture<ChatOutcome> chat(ChatRequest request, Consumer<String> tokens) {
        String model = request.model() != null && !request.model().isBlank() ? request.model() : settings.defaultModel();
        boolean stream = request.stream() && tokens != null;

        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(requestBody(request, model, stream));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new CallFailureException("Cannot encode chat request: " + e.getMessage(), e));
        }
        log.debug("Chat request to {} (model {}, {} messages, {} tools, stream={})",
                settings.baseUrl(), model, request.messages().size(), request.tools().size(), stream);

        if (stream) {
            return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofLines())
                    .handle((response, error) -> {
                        if (error != null) {
                            throw unreachable(error);
                        }
                        if (response.statusCode() != 200) {
                            String body = String.join("\n", response.body().toList());
                            throw httpError(response.statusCode(), body);
                        }
                        return readStream(response.body(), model, tokens);
                    });
        }

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw unreachable(error);
                    }
                    if (response.statusCode() != 200) {
                        throw httpError(response.statusCode(), response.body());
                    }
                    return readResponse(response.body(), model);
                });
    }

    private HttpRequest buildRequest(String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl() + "/chat/completions"))
                .timeout(settings.requestTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (settings.hasApiKey()) {
            builder.header("Authorization", "Bearer " + settings.apiKey());
        }
        return builder.build();
    }

    String requestBody(ChatRequest request, String model, boolean stream) throws JsonProcessingException {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);

        ArrayNode messages = body.putArray("messages");
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", request.systemPrompt());
        }
        request.messages().forEach(message -> messages.add(message.deepCopy()));

        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (request.hasTools()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : request.tools()) {
                tools.add(tool.toJson());
            }
        }
        if (request.chatId() != null) {
            body.put("user", request.chatId());
        }
        if (stream) {
            body.put("stream", true);
            body.putObject("stream_options").put("include_usage", true);
        }
        return mapper.writeValueAsString(body);
    }

    ChatOutcome readResponse(String body, String requestedModel) {
        JsonNode json;
        try {
            json = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CallFailureException("Chat endpoint returned invalid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode choice = json.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new CallFailureException("Chat endpoint returned no choices: " + fallbackBody(body));
        }
        JsonNode message = choice.path("message");
        String content = message.path("content").isTextual() ? message.path("content").textValue() : "";
        String model = json.path("model").asText(requestedModel);
        int tokens = json.path("usage").path("total_tokens").asInt(0);

        JsonNode calls = message.path("tool_calls");
        if (calls.isArray() && !calls.isEmpty()) {
            return new ChatOutcome.ToolCalls(content, (ArrayNode) calls, model, tokens);
        }
        return new ChatOutcome.Final(content, model, choice.path("finish_reason").asText("stop"), tokens);
    }

    /**
     * Fold a server-sent event stream into one outcome. Content deltas go to {@code tokens};
     * tool call deltas are merged by their {@code index}.
     */
    ChatOutcome readStream(Stream<String> lines, String requestedModel, Consumer<String> tokens) {
        StringBuilder content = new StringBuilder();
        Map<Integer, ObjectNode> calls = new TreeMap<>();
        String model = requestedModel;
        String finishReason = "stop";
        int totalTokens = 0;

        Iterator<String> iterator = lines.iterator();
        while (iterator.hasNext()) {
            String line = iterator.next().trim();
            if (!line.startsWith(DATA_PREFIX)) {
                continue;
            }
            String data = line.substring(DATA_PREFIX.length()).trim();
            if (DONE_MARKER.equals(data)) {
                break;
            }

            JsonNode chunk;
            try {
                chunk = mapper.readTree(data);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed stream chunk: {}", fallbackBody(data));
                continue;
            }

            model = chunk.path("model").asText(model);
            if (chunk.path("usage").has("total_tokens")) {
                totalTokens = chunk.path("usage").path("total_tokens").asInt(totalTokens);
            }

            JsonNode choice = chunk.path("choices").path(0);
            if (choice.path("finish_reason").isTextual()) {
                finishReason = choice.path("finish_reason").textValue();
            }
            JsonNode delta = choice.path("delta");
            if (delta.path("content").isTextual() && !delta.path("content").textValue().isEmpty()) {
                String text = delta.path("content").textValue();
                content.append(text);
                tokens.accept(text);
            }
            for (JsonNode callDelta : delta.path("tool_calls")) {
                mergeToolCallDelta(calls, callDelta);
            }
        }

        if (!calls.isEmpty()) {
            ArrayNode array = mapper.createArrayNode();
            calls.values().forEach(array::add);
            return new ChatOutcome.ToolCalls(content.toString(), array, model, totalTokens);
        }
        return new ChatOutcome.Final(content.toString(), model, finishReason, totalTokens);
    }

    private void mergeToolCallDelta(Map<Integer, ObjectNode> calls, JsonNode delta) {
        int index = delta.path("index").asInt(calls.size());
        ObjectNode call = calls.computeIfAbsent(index, i -> {
            ObjectNode created = mapper.createObjectNode();
            created.put("type", "function");
            ObjectNode function = created.putObject("function");
            function.put("name", "");
            function.put("arguments", "");
            return created;
        });

        if (delta.path("id").isTextual()) {
            call.put("id", delta.path("id").textValue());
        }
        ObjectNode function = (ObjectNode) call.get("function");
        JsonNode functionDelta = delta.path("function");
        if (functionDelta.path("name").isTextual()) {
            function.put("name", function.path("name").asText() + functionDelta.path("name").textValue());
        }
        if (functionDelta.path("arguments").isTextual()) {
            function.put("arguments", function.path("arguments").asText() + functionDelta.path("arguments").textValue());
        }
    }

    private CallFailureException unreachable(Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        log.error("Chat endpoint {} unreachable: {}", settings.baseUrl(), cause.getMessage());
        return new CallFailureException("Chat endpoint unreachable: " + cause.getMessage(), cause);
    }

    private CallFailureException httpError(int status, String body) {
        log.error("Chat endpoint returned HTTP {}", status);
        return new CallFailureException("Chat API error " + status + ": " + extractError(body));
    }

    private String extractError(String body) {
        try {
            JsonNode parsed = mapper.readTree(body);
            JsonNode message = parsed.path("error").path("message");
            if (message.isTextual()) {
                return message.textValue();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return fallbackBody(body);
    }

    private static String fallbackBody(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
