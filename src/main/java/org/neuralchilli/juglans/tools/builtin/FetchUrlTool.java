package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.tools.BuiltinTool;
import org.neuralchilli.juglans.tools.CallFailureException;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The {@code fetch_url} tool: one HTTP request.
 *
 * Result: {@code {status, method, url, content, ok}}; {@code content} is parsed JSON when
 * the body is JSON, the raw text otherwise. Non-2xx statuses are results, not failures.
 */
@ApplicationScoped
public class FetchUrlTool implements BuiltinTool {

    private static final Logger log = LoggerFactory.getLogger(FetchUrlTool.class);

    public static final String NAME = "fetch_url";

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;

    public FetchUrlTool() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public FetchUrlTool(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        String url = invocation.requireText("url");
        String method = invocation.textOr("method", "GET").toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            method = "GET";
        }

        HttpRequest request = buildRequest(invocation, url, method);
        String requestMethod = method;
        log.debug("{} {} (node {})", method, url, invocation.nodeId());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error.getCause() != null ? error.getCause() : error;
                        throw new CallFailureException(requestMethod + " " + url + " failed: " + cause.getMessage(), cause);
                    }
                    log.debug("{} {} -> HTTP {}", requestMethod, url, response.statusCode());

                    ObjectNode result = Values.object();
                    result.put("status", response.statusCode());
                    result.put("method", requestMethod);
                    result.put("url", url);
                    result.set("content", Values.parseLenient(response.body()));
                    result.put("ok", response.statusCode() >= 200 && response.statusCode() < 300);
                    return ToolResult.of(result);
                });
    }

    private HttpRequest buildRequest(ToolInvocation invocation, String url, String method) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new CallFailureException("Invalid URL '" + url + "': " + e.getMessage(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(REQUEST_TIMEOUT);
        JsonNode headers = invocation.arg("headers");
        if (headers.isTextual()) {
            headers = Values.parseLenient(headers.textValue());
        }
        if (headers.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = headers.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> header = fields.next();
                builder.header(header.getKey(), Values.asText(header.getValue()));
            }
        }

        if (invocation.has("body")) {
            JsonNode body = invocation.arg("body");
            String text = body.isTextual() ? body.textValue() : Values.toJson(body);
            if (!body.isTextual() && (headers.isMissingNode() || !headers.has("Content-Type"))) {
                builder.header("Content-Type", "application/json");
            }
            builder.method(method, HttpRequest.BodyPublishers.ofString(text));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }
}
