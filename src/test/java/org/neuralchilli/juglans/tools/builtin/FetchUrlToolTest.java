package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.tools.CallFailureException;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResult;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FetchUrlToolTest {

    private HttpClient client;
    private FetchUrlTool tool;

    @BeforeEach
    void setup() {
        client = mock(HttpClient.class);
        tool = new FetchUrlTool(client);
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(CompletableFuture.completedFuture(response)).when(client).sendAsync(any(), any());
    }

    private ToolResult fetch(Map<String, JsonNode> arguments) {
        ExecutionContext context = ExecutionContext.of(Values.object());
        return tool.execute(new ToolInvocation(FetchUrlTool.NAME, arguments, context, "fetch", null)).join();
    }

    private HttpRequest sentRequest() {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).sendAsync(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void shouldParseJsonBody() {
        // Given
        respond(200, "{\"orders\": [1, 2]}");

        // When
        ToolResult result = fetch(Map.of("url", TextNode.valueOf("http://localhost:8080/orders")));

        // Then
        JsonNode value = result.value();
        assertThat(value.get("status").asInt()).isEqualTo(200);
        assertThat(value.get("method").asText()).isEqualTo("GET");
        assertThat(value.get("ok").booleanValue()).isTrue();
        assertThat(value.get("content").get("orders")).hasSize(2);
        assertThat(sentRequest().method()).isEqualTo("GET");
    }

    @Test
    void shouldKeepTextBodyAndReportFailureStatus() {
        respond(404, "not here");

        ToolResult result = fetch(Map.of("url", TextNode.valueOf("http://localhost:8080/missing")));

        assertThat(result.value().get("ok").booleanValue()).isFalse();
        assertThat(result.value().get("content").asText()).isEqualTo("not here");
    }

    @Test
    void shouldSendObjectBodyAsJson() {
        respond(201, "{}");

        ToolResult result = fetch(Map.of(
                "url", TextNode.valueOf("http://localhost:8080/orders"),
                "method", TextNode.valueOf("post"),
                "body", Values.parseLenient("{\"sku\": \"a\"}"),
                "headers", TextNode.valueOf("{\"X-Trace\": \"t1\"}")));

        HttpRequest request = sentRequest();
        assertThat(result.value().get("method").asText()).isEqualTo("POST");
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(request.headers().firstValue("X-Trace")).contains("t1");
    }

    @Test
    void shouldFallBackToGetForUnknownMethod() {
        respond(200, "ok");

        fetch(Map.of("url", TextNode.valueOf("http://localhost:8080/"), "method", TextNode.valueOf("BREW")));

        assertThat(sentRequest().method()).isEqualTo("GET");
    }

    @Test
    void shouldFailOnTransportError() {
        doReturn(CompletableFuture.failedFuture(new ConnectException("connection refused")))
                .when(client).sendAsync(any(), any());

        assertThatThrownBy(() -> fetch(Map.of("url", TextNode.valueOf("http://localhost:1/"))))
                .hasCauseInstanceOf(CallFailureException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void shouldRequireUrl() {
        assertThatThrownBy(() -> fetch(Map.of()))
                .hasMessageContaining("requires argument 'url'");
        verifyNoInteractions(client);
    }
}
