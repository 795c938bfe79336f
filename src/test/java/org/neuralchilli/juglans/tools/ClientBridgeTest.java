package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.Test;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.RunCancelledException;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.WorkflowEvent;
import org.neuralchilli.juglans.testing.CollectingEventSink;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class ClientBridgeTest {

    private final ClientBridge bridge = new ClientBridge();

    private static ArrayNode oneCall() {
        ArrayNode calls = Values.array();
        calls.add(ToolDispatcher.toolCall("tc_1", "get_location", Values.object()));
        return calls;
    }

    @Test
    void shouldEmitToolCallAndCompleteWithClientResults() {
        // Given: A run waiting on the client
        CollectingEventSink sink = new CollectingEventSink();
        ExecutionContext context = ExecutionContext.builder().runId("run-1").events(sink).build();

        CompletableFuture<List<ToolCallResult>> pending = bridge.emitAndAwait(context, oneCall(), Duration.ofSeconds(5));

        // When: The client answers the emitted call id
        WorkflowEvent.ToolCall event = sink.ofType(WorkflowEvent.ToolCall.class).get(0);
        assertThat(bridge.isPending(event.callId())).isTrue();
        boolean accepted = bridge.complete(event.callId(), List.of(new ToolCallResult("tc_1", "Paris")));

        // Then
        assertThat(accepted).isTrue();
        assertThat(pending.join()).containsExactly(new ToolCallResult("tc_1", "Paris"));
        assertThat(event.runId()).isEqualTo("run-1");
        assertThat(event.calls().get(0).at("/function/name").asText()).isEqualTo("get_location");
        await().atMost(2, TimeUnit.SECONDS).until(() -> bridge.pendingCount() == 0);
    }

    @Test
    void shouldIgnoreUnknownAndRepeatedCompletions() {
        CollectingEventSink sink = new CollectingEventSink();
        ExecutionContext context = ExecutionContext.builder().events(sink).build();
        CompletableFuture<List<ToolCallResult>> pending = bridge.emitAndAwait(context, oneCall(), Duration.ofSeconds(5));
        String callId = sink.ofType(WorkflowEvent.ToolCall.class).get(0).callId();

        assertThat(bridge.complete("call_unknown", List.of())).isFalse();
        assertThat(bridge.complete(callId, List.of(new ToolCallResult("tc_1", "first")))).isTrue();
        pending.join();
        assertThat(bridge.complete(callId, List.of(new ToolCallResult("tc_1", "second")))).isFalse();
        assertThat(pending.join().get(0).content()).isEqualTo("first");
    }

    @Test
    void shouldTimeOutWhenClientNeverAnswers() {
        ExecutionContext context = ExecutionContext.of(Values.object());

        CompletableFuture<List<ToolCallResult>> pending = bridge.emitAndAwait(context, oneCall(), Duration.ofMillis(100));

        assertThatThrownBy(pending::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ToolTimeoutException.class);
        assertThat(bridge.pendingCount()).isZero();
    }

    @Test
    void shouldReleaseCallsWhenRunIsCancelled() {
        ExecutionContext context = ExecutionContext.builder().runId("run-2").build();
        CompletableFuture<List<ToolCallResult>> pending = bridge.emitAndAwait(context, oneCall(), Duration.ofSeconds(30));

        context.cancel("user left");

        assertThatThrownBy(pending::join).hasCauseInstanceOf(RunCancelledException.class);
    }

    @Test
    void shouldCancelPendingCallsByRunId() {
        ExecutionContext first = ExecutionContext.builder().runId("run-a").build();
        ExecutionContext second = ExecutionContext.builder().runId("run-b").build();
        CompletableFuture<List<ToolCallResult>> a = bridge.emitAndAwait(first, oneCall(), Duration.ofSeconds(30));
        CompletableFuture<List<ToolCallResult>> b = bridge.emitAndAwait(second, oneCall(), Duration.ofSeconds(30));

        int released = bridge.cancelRun("run-a");

        assertThat(released).isEqualTo(1);
        assertThat(a).isCompletedExceptionally();
        assertThat(b).isNotDone();
        second.cancel("cleanup");
    }

    @Test
    void shouldDetectExecutedOnClientResults() {
        assertThat(new ToolCallResult("tc", "{\"executed_on_client\": true}").executedOnClient()).isTrue();
        assertThat(new ToolCallResult("tc", "{\"executed_on_client\": \"yes\"}").executedOnClient()).isFalse();
        assertThat(new ToolCallResult("tc", "plain text").executedOnClient()).isFalse();
        assertThat(new ToolCallResult("tc", null).content()).isEmpty();
    }

    @Test
    void shouldReadResultFromJson() {
        ToolCallResult result = ToolCallResult.fromJson(
                Values.parseLenient("{\"tool_call_id\": \"tc_9\", \"content\": {\"temp\": 21}}"));

        assertThat(result.toolCallId()).isEqualTo("tc_9");
        assertThat(result.content()).isEqualTo("{\"temp\":21}");
        assertThatThrownBy(() -> ToolCallResult.fromJson(Values.object()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
