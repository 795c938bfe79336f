package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tool server client speaking JSON-RPC 2.0 ({@code tools/list}, {@code tools/call}) over HTTP.
 */
@ApplicationScoped
public class JsonRpcToolServerClient implements ToolServerClient {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcToolServerClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcToolServerClient() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Values.mapper());
    }

    @Inject
    public JsonRpcToolServerClient(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper);
    }

    public JsonRpcToolServerClient(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ToolDefinition> listTools(ToolServer server) {
        JsonNode result = send(server, "tools/list", Values.object());

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode tool : result.path("tools")) {
            try {
                tools.add(ToolDefinition.fromJson(tool));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed tool from server {}: {}", server.name(), e.getMessage());
            }
        }
        log.debug("Server {} offers {} tools", server.name(), tools.size());
        return tools;
    }

    @Override
    public String callTool(ToolServer server, String toolName, JsonNode arguments) {
        ObjectNode params = Values.object();
        params.put("name", toolName);
        params.set("arguments", arguments != null ? arguments : Values.object());

        JsonNode result = send(server, "tools/call", params);

        if (result.path("isError").asBoolean(false)) {
            throw new CallFailureException(
                    "Tool " + server.namespace() + "." + toolName + " reported an error: " + contentText(result));
        }
        return contentText(result);
    }

    private JsonNode send(ToolServer server, String method, ObjectNode params) {
        ObjectNode request = Values.object();
        request.put("jsonrpc", "2.0");
        request.put("id", method.replace('/', '_') + "_" + requestIds.incrementAndGet());
        request.put("method", method);
        request.set("params", params);

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(server.messagesUrl()))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        if (server.token() != null) {
            builder.header("Authorization", "Bearer " + server.token());
        }

        try {
            String body = objectMapper.writeValueAsString(request);
            HttpResponse<String> response = httpClient.send(
                    builder.POST(HttpRequest.BodyPublishers.ofString(body)).build(),
                    HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new CallFailureException(
                        "Tool server " + server.name() + " returned HTTP " + response.statusCode() + " for " + method);
            }

            JsonNode json = objectMapper.readTree(response.body());
            if (json.hasNonNull("error")) {
                throw new CallFailureException(
                        "Tool server " + server.name() + " error for " + method + ": "
                                + json.path("error").path("message").asText(json.path("error").toString()));
            }
            return json.path("result");
        } catch (IOException e) {
            throw new CallFailureException("Tool server " + server.name() + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallFailureException("Interrupted calling tool server " + server.name(), e);
        }
    }

    /**
     * Concatenate the text parts of a {@code tools/call} result
     */
    static String contentText(JsonNode result) {
        JsonNode content = result.path("content");
        if (!content.isArray()) {
            return result.isMissingNode() ? "" : result.toString();
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : content) {
            if (part.hasNonNull("text")) {
                text.append(part.get("text").asText());
            }
        }
        return text.toString();
    }
}
