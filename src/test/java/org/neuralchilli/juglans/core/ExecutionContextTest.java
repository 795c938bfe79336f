package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;
import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.RunError;
import org.neuralchilli.juglans.domain.WorkflowEvent;
import org.neuralchilli.juglans.domain.WorkflowException;
import org.neuralchilli.juglans.testing.CollectingEventSink;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ExecutionContextTest {

    @Test
    void shouldWriteNestedContextPaths() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());

        ctx.setCtx("order.customer.name", TextNode.valueOf("Ada"));
        ctx.setCtx("$ctx.order.total", IntNode.valueOf(42));

        assertThat(ctx.ctxValue("order.customer.name").asText()).isEqualTo("Ada");
        assertThat(ctx.ctxValue("order.total").asInt()).isEqualTo(42);
        assertThat(ctx.hasCtxKey("order")).isTrue();
        assertThat(ctx.ctxValue("order.missing").isNull()).isTrue();
    }

    @Test
    void shouldReplaceScalarIntermediates() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        ctx.setCtx("plan", TextNode.valueOf("draft"));

        ctx.setCtx("plan.steps", IntNode.valueOf(3));

        assertThat(ctx.ctxValue("plan").isObject()).isTrue();
        assertThat(ctx.ctxValue("plan.steps").asInt()).isEqualTo(3);
    }

    @Test
    void shouldRejectEmptyContextPath() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());

        assertThatThrownBy(() -> ctx.setCtx("", TextNode.valueOf("x")))
                .isInstanceOf(WorkflowException.class)
                .hasMessageContaining("cannot be empty");
    }

    @Test
    void shouldReturnCopiesOfContextValues() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        ctx.setCtx("list", Values.array().add(1));

        ((ArrayNode) ctx.ctxValue("list")).add(2);

        assertThat(ctx.ctxValue("list")).hasSize(1);
    }

    @Test
    void shouldKeepInputReadOnly() {
        ObjectNode input = Values.object().put("name", "Ada");
        ExecutionContext ctx = ExecutionContext.of(input);

        input.put("name", "Grace");

        assertThat(ctx.input().get("name").asText()).isEqualTo("Ada");
    }

    @Test
    void shouldTrackNodeOutputsAndErrors() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());

        ctx.recordOutput("fetch", TextNode.valueOf("page"));
        ctx.recordError("fetch", new RunError(ErrorCode.CALL_FAILURE, "boom", "fetch", null));

        assertThat(ctx.nodeOutput("fetch").asText()).isEqualTo("page");
        assertThat(ctx.nodeResult("fetch").orElseThrow().get("error").get("code").asText()).isEqualTo("call_failure");
        assertThat(ctx.currentOutput().asText()).isEqualTo("page");
        assertThat(ctx.nodeOutput("never").isNull()).isTrue();
        assertThat(ctx.nodeResultIds()).containsExactly("fetch");
    }

    @Test
    void shouldAppendStreamedReplyText() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());

        ctx.appendReplyOutput("Hel");
        ctx.appendReplyOutput("lo");
        ctx.appendReplyOutput("");

        assertThat(ctx.replyText("output")).contains("Hello");
        assertThat(ctx.replyText("status")).isEmpty();
    }

    @Test
    void shouldEmitStatusWhenReplyStatusIsSet() {
        CollectingEventSink sink = new CollectingEventSink();
        ExecutionContext ctx = ExecutionContext.builder().runId("r-1").events(sink).build();

        ctx.setReply("status", TextNode.valueOf("thinking"));

        assertThat(sink.events()).hasSize(1);
        assertThat(sink.events().get(0)).isInstanceOf(WorkflowEvent.Status.class);
        assertThat(ctx.replyText("status")).contains("thinking");
    }

    @Test
    void shouldReadAcrossRoots() {
        ExecutionContext ctx = ExecutionContext.of(Values.object().put("id", "A-1"));
        ctx.setCtx("plan", TextNode.valueOf("steps"));
        ctx.setReply("output", TextNode.valueOf("answer"));
        ctx.recordOutput("last", IntNode.valueOf(7));

        assertThat(ctx.read("reply.output").asText()).isEqualTo("answer");
        assertThat(ctx.read("ctx.plan").asText()).isEqualTo("steps");
        assertThat(ctx.read("plan").asText()).isEqualTo("steps");
        assertThat(ctx.read("input.id").asText()).isEqualTo("A-1");
        assertThat(ctx.read("output").asInt()).isEqualTo(7);
        assertThat(ctx.read("").isNull()).isTrue();
    }

    @Test
    void shouldLayerLoopScopesWithoutTouchingParent() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());

        ExecutionContext inner = ctx.enterLoop(LoopScope.forEach("item", TextNode.valueOf("a"), 0, 2));
        inner.setCtx("seen", TextNode.valueOf("a"));

        assertThat(ctx.loopScopes()).isEmpty();
        assertThat(inner.innermostLoop()).hasValueSatisfying(scope -> assertThat(scope.first()).isTrue());
        assertThat(ctx.ctxValue("seen").asText()).isEqualTo("a");
    }

    @Test
    void shouldIsolateNestedRunState() {
        // Given: A parent with context and outputs
        ExecutionContext parent = ExecutionContext.builder().runId("run-7").build();
        parent.setCtx("secret", TextNode.valueOf("parent"));
        parent.recordOutput("a", TextNode.valueOf("x"));

        // When: A nested run starts
        ExecutionContext child = parent.isolated(Values.object().put("message", "hi"));
        child.setCtx("plan", TextNode.valueOf("child plan"));

        // Then: State is fresh, the run id is shared and returns are merged on request
        assertThat(child.runId()).isEqualTo("run-7");
        assertThat(child.ctxValue("secret").isNull()).isTrue();
        assertThat(child.nodeResult("a")).isEmpty();
        assertThat(parent.hasCtxKey("plan")).isFalse();

        parent.mergeReturned(child, List.of("ctx.plan"));
        assertThat(parent.ctxValue("plan").asText()).isEqualTo("child plan");
    }

    @Test
    void shouldRejectRecursiveExecution() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        ctx.enterExecution("agent:planner");
        ctx.enterExecution("agent:writer");

        assertThatThrownBy(() -> ctx.enterExecution("agent:planner"))
                .isInstanceOf(WorkflowException.class)
                .hasMessageContaining("Recursive workflow execution detected")
                .hasMessageContaining("agent:planner -> agent:writer -> agent:planner");

        ctx.exitExecution("agent:writer");
        assertThat(ctx.executionDepth()).isEqualTo(1);
    }

    @Test
    void shouldLimitNestingDepth() {
        ExecutionContext ctx = ExecutionContext.builder().maxNestingDepth(2).build();
        ctx.enterExecution("a");
        ctx.enterExecution("b");

        assertThatThrownBy(() -> ctx.enterExecution("c"))
                .isInstanceOf(WorkflowException.class)
                .hasMessageContaining("Maximum workflow nesting depth (2) exceeded");
    }

    @Test
    void shouldPropagateCancellationToNestedRuns() {
        ExecutionContext parent = ExecutionContext.of(Values.object());
        ExecutionContext child = parent.isolated(Values.object());
        AtomicInteger notified = new AtomicInteger();
        child.onCancel(notified::incrementAndGet);

        parent.cancel("user abort");
        parent.cancel("again");

        assertThat(child.isCancelled()).isTrue();
        assertThat(child.cancellationReason()).contains("user abort");
        assertThat(parent.cancellationReason()).contains("user abort");
        assertThat(notified).hasValue(1);
    }

    @Test
    void shouldRunLateCancelListenerImmediately() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        ctx.cancel("done");
        AtomicInteger notified = new AtomicInteger();

        ctx.onCancel(notified::incrementAndGet);

        assertThat(notified).hasValue(1);
    }

    @Test
    void shouldForgetUnregisteredCancelListeners() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        AtomicInteger notified = new AtomicInteger();
        Runnable unregister = ctx.onCancel(notified::incrementAndGet);
        assertThat(ctx.cancelListenerCount()).isEqualTo(1);

        unregister.run();
        ctx.cancel("late");

        assertThat(ctx.cancelListenerCount()).isZero();
        assertThat(notified).hasValue(0);
    }

    @Test
    void shouldDetachFinishedNestedRunsFromParent() {
        ExecutionContext parent = ExecutionContext.of(Values.object());

        for (int i = 0; i < 50; i++) {
            ExecutionContext child = parent.isolated(Values.object());
            child.detach();
            child.detach();
        }
        ExecutionContext detached = parent.isolated(Values.object());
        detached.detach();
        parent.cancel("user abort");

        assertThat(parent.cancelListenerCount()).isZero();
        assertThat(detached.isCancelled()).isFalse();
    }

    @Test
    void shouldSplitPaths() {
        assertThat(ExecutionContext.splitPath("$a.b..c")).containsExactly("a", "b", "c");
        assertThat(ExecutionContext.splitPath(" ")).isEmpty();
        assertThat(ExecutionContext.splitPath(null)).isEmpty();
    }
}
