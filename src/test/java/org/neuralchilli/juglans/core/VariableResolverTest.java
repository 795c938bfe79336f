package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VariableResolverTest {

    private final VariableResolver resolver = new VariableResolver();

    @Test
    void shouldPreferLoopVariableOverNodeAndContext() {
        // Given: A node, a ctx key and a loop variable all named "item"
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        ctx.recordOutput("item", TextNode.valueOf("node"));
        ctx.setCtx("item", TextNode.valueOf("ctx"));
        ExecutionContext inLoop = ctx.enterLoop(LoopScope.forEach("item", TextNode.valueOf("loop"), 0, 1));

        // Then
        assertThat(resolver.resolve("item", inLoop).asText()).isEqualTo("loop");
        assertThat(resolver.resolve("item.output", ctx).asText()).isEqualTo("node");
    }

    @Test
    void shouldPickLongestNodeIdPrefix() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        ctx.recordOutput("order", TextNode.valueOf("outer"));
        ctx.recordOutput("order.payment.charge", IntNode.valueOf(20));

        assertThat(resolver.resolve("order.payment.charge.output", ctx).asInt()).isEqualTo(20);
        assertThat(resolver.resolve("order.output", ctx).asText()).isEqualTo("outer");
    }

    @Test
    void shouldFallBackToBareContextKey() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        ctx.setCtx("plan.steps", IntNode.valueOf(3));

        assertThat(resolver.resolve("plan.steps", ctx).asInt()).isEqualTo(3);
        assertThat(resolver.resolve("$ctx.plan.steps", ctx).asInt()).isEqualTo(3);
    }

    @Test
    void shouldExposeLoopObjectOnlyInsideLoops() {
        ExecutionContext ctx = ExecutionContext.of(Values.object());
        ExecutionContext whileLoop = ctx.enterLoop(LoopScope.whileLoop(4));

        assertThat(resolver.resolve("loop.index", ctx).isNull()).isTrue();
        assertThat(resolver.resolve("loop.index", whileLoop).asInt()).isEqualTo(4);
        assertThat(resolver.resolve("loop.last", whileLoop).booleanValue()).isFalse();
        assertThat(resolver.resolve("loop.length", whileLoop).isNull()).isTrue();
    }

    @Test
    void shouldIndexIntoArraysAndJsonText() {
        ExecutionContext ctx = ExecutionContext.of(Values.parseLenient("{\"items\": [\"a\", \"b\"]}"));
        ctx.recordOutput("raw", TextNode.valueOf("{\"score\": 9}"));

        assertThat(resolver.resolve("input.items.1", ctx).asText()).isEqualTo("b");
        assertThat(resolver.resolve("raw.output.score", ctx).asInt()).isEqualTo(9);
        assertThat(resolver.resolve("input.items.5", ctx).isNull()).isTrue();
    }

    @Test
    void shouldResolveEmptyPathToNull() {
        assertThat(resolver.resolve("", ExecutionContext.of(Values.object())).isNull()).isTrue();
    }
}
