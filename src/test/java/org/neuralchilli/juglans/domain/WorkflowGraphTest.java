package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkflowGraphTest {

    private static Node echo(String id) {
        return Node.call(id, "echo", Map.of("value", "$input.x"));
    }

    @Test
    void shouldBuildGraph() {
        WorkflowGraph graph = WorkflowGraph.builder("checkout")
                .description("Checkout flow")
                .node(echo("a"))
                .node(echo("b"))
                .edge(Edge.of("a", "b"))
                .exitNodes(List.of("b"))
                .build();

        assertThat(graph.slug()).isEqualTo("checkout");
        assertThat(graph.name()).isEqualTo("checkout");
        assertThat(graph.nodeIds()).containsExactly("a", "b");
        assertThat(graph.outgoingEdges("a")).containsExactly(Edge.of("a", "b"));
        assertThat(graph.incomingEdges("b")).hasSize(1);
        assertThat(graph.node("missing")).isEmpty();
        assertThat(graph.hasFlowImports()).isFalse();
    }

    @Test
    void shouldRejectEmptyGraph() {
        assertThatThrownBy(() -> WorkflowGraph.builder("empty").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must have at least one node");
    }

    @Test
    void shouldAllowGraphMadeOnlyOfImports() {
        WorkflowGraph graph = WorkflowGraph.builder("wrapper")
                .flowImport("order", "flows/order.yaml")
                .build();

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.hasFlowImports()).isTrue();
    }

    @Test
    void shouldRejectDuplicateNodeIds() {
        assertThatThrownBy(() -> WorkflowGraph.builder("dup").node(echo("a")).node(echo("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate node id: a");
    }

    @Test
    void shouldDeriveEntriesFromRootsWhenNoneDeclared() {
        WorkflowGraph graph = WorkflowGraph.builder("roots")
                .node(echo("a"))
                .node(echo("b"))
                .node(echo("c"))
                .edge(Edge.of("a", "c"))
                .build();

        assertThat(graph.effectiveEntryNodes()).containsExactly("a", "b");
    }

    @Test
    void shouldPreferDeclaredEntries() {
        WorkflowGraph graph = WorkflowGraph.builder("declared")
                .node(echo("a"))
                .node(echo("b"))
                .entryNodes(List.of("b"))
                .build();

        assertThat(graph.effectiveEntryNodes()).containsExactly("b");
    }

    @Test
    void shouldCollectLoopBodyIds() {
        WorkflowGraph body = WorkflowGraph.builder(null).node(echo("step")).build();
        WorkflowGraph graph = WorkflowGraph.builder("loop")
                .node(new Node("each", new NodeKind.ForEach("$item", "$input.items", body)))
                .node(Node.literal("done", TextNode.valueOf("ok")))
                .build();

        assertThat(graph.allNodeIds()).containsExactlyInAnyOrder("each", "step", "done");
        assertThat(graph.node("each").orElseThrow().isLoop()).isTrue();
        NodeKind.ForEach forEach = (NodeKind.ForEach) graph.node("each").orElseThrow().kind();
        assertThat(forEach.itemVar()).isEqualTo("item");
    }

    @Test
    void shouldRoundTripThroughBuilder() {
        WorkflowGraph graph = WorkflowGraph.builder("copy")
                .version("2")
                .node(echo("a"))
                .node(echo("b"))
                .edge(Edge.forCase("a", "b", "refund"))
                .switchRoute("a", "$a.output")
                .build();

        WorkflowGraph copy = graph.toBuilder().build();

        assertThat(copy).isEqualTo(graph);
        assertThat(copy.hashCode()).isEqualTo(graph.hashCode());
        assertThat(copy.switchRoutes()).containsEntry("a", "$a.output");
    }
}
