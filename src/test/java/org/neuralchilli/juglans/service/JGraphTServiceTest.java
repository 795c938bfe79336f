package org.neuralchilli.juglans.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.junit.jupiter.api.Test;
import org.neuralchilli.juglans.domain.Edge;
import org.neuralchilli.juglans.domain.GraphStatistics;
import org.neuralchilli.juglans.domain.Node;
import org.neuralchilli.juglans.domain.WorkflowGraph;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class JGraphTServiceTest {

    @Inject
    JGraphTService service;

    @Test
    void shouldBuildSimpleLinearDag() {
        // Given: a -> b -> c
        WorkflowGraph graph = graph("linear", List.of("a", "b", "c"),
                Edge.of("a", "b"), Edge.of("b", "c"));

        // When: Building DAG
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(graph);

        // Then: DAG structure is correct
        assertThat(dag.vertexSet()).hasSize(3);
        assertThat(dag.edgeSet()).hasSize(2);
        assertThat(service.getTopologicalOrder(dag)).containsExactly("a", "b", "c");
    }

    @Test
    void shouldBuildDiamondDag() {
        // Given: a -> b -> d
        //          -> c ->
        WorkflowGraph graph = diamond();

        // When: Building DAG
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(graph);

        // Then: a is first, d is last, b and c share a level
        List<String> order = service.getTopologicalOrder(dag);
        assertThat(order.get(0)).isEqualTo("a");
        assertThat(order.get(3)).isEqualTo("d");

        List<Set<String>> levels = service.getExecutionLevels(dag);
        assertThat(levels).hasSize(3);
        assertThat(levels.get(1)).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void shouldCountErrorEdgesAsDependencies() {
        // Given: a risky node with an error handler
        WorkflowGraph graph = graph("risky", List.of("risky", "handler"), Edge.onError("risky", "handler"));

        // When: Building DAG
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(graph);

        // Then: the handler depends on the risky node
        assertThat(service.getPredecessors(dag, "handler")).containsExactly("risky");
    }

    @Test
    void shouldDetectSimpleCycle() {
        // Given: a -> b -> a
        WorkflowGraph graph = graph("cycle", List.of("a", "b"), Edge.of("a", "b"), Edge.of("b", "a"));

        // When/Then: Building DAG throws
        assertThatThrownBy(() -> service.buildDag(graph))
                .isInstanceOf(CycleDetectedException.class)
                .hasMessageContaining("cycle")
                .hasMessageContaining("'b' -> 'a'");
    }

    @Test
    void shouldDetectSelfLoop() {
        // Given: a node pointing at itself
        WorkflowGraph graph = graph("self", List.of("a"), Edge.of("a", "a"));

        // When/Then
        assertThatThrownBy(() -> service.buildDag(graph))
                .isInstanceOf(CycleDetectedException.class);
    }

    @Test
    void shouldRejectEdgeToUnknownNode() {
        // Given: an edge to a node that does not exist
        WorkflowGraph graph = graph("dangling", List.of("a"), Edge.of("a", "ghost"));

        // When/Then
        assertThatThrownBy(() -> service.buildDag(graph))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void shouldFindRootsLeavesAndDescendants() {
        // Given: the diamond
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDag(diamond());

        // Then
        assertThat(service.getRootNodes(dag)).containsExactly("a");
        assertThat(service.getLeafNodes(dag)).containsExactly("d");
        assertThat(service.getDescendants(dag, "b")).containsExactly("d");
        assertThat(service.getDescendants(dag, "a")).containsExactlyInAnyOrder("b", "c", "d");
    }

    @Test
    void shouldComputeStatistics() {
        // Given: the diamond plus an independent node
        WorkflowGraph graph = WorkflowGraph.builder("stats")
                .nodes(diamond().nodes().values())
                .node(echoNode("solo"))
                .edges(diamond().edges())
                .build();

        // When: Getting statistics
        GraphStatistics stats = service.getStatistics(service.buildDag(graph));

        // Then
        assertThat(stats.totalNodes()).isEqualTo(5);
        assertThat(stats.totalEdges()).isEqualTo(4);
        assertThat(stats.rootNodes()).isEqualTo(2);
        assertThat(stats.leafNodes()).isEqualTo(2);
        assertThat(stats.executionLevels()).isEqualTo(3);
        assertThat(stats.maxParallelism()).isEqualTo(2);
        assertThat(stats.hasParallelism()).isTrue();
    }

    @Test
    void shouldTreatSingleNodeAsLinear() {
        // Given: one node
        GraphStatistics stats = service.getStatistics(service.buildDag(graph("one", List.of("only"))));

        // Then
        assertThat(stats.isLinear()).isTrue();
        assertThat(stats.depth()).isEqualTo(1);
    }

    private static WorkflowGraph diamond() {
        return graph("diamond", List.of("a", "b", "c", "d"),
                Edge.of("a", "b"), Edge.of("a", "c"), Edge.of("b", "d"), Edge.of("c", "d"));
    }

    private static WorkflowGraph graph(String slug, List<String> ids, Edge... edges) {
        WorkflowGraph.Builder builder = WorkflowGraph.builder(slug);
        ids.forEach(id -> builder.node(echoNode(id)));
        builder.edges(List.of(edges));
        return builder.build();
    }

    private static Node echoNode(String id) {
        return Node.call(id, "echo", Map.of("value", id));
    }
}
