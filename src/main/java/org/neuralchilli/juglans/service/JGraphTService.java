package org.neuralchilli.juglans.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.juglans.domain.Edge;
import org.neuralchilli.juglans.domain.GraphStatistics;
import org.neuralchilli.juglans.domain.WorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for building and analyzing workflow DAGs using JGraphT.
 * Provides cycle detection, topological sorting and parallelism analysis.
 */
@ApplicationScoped
public class JGraphTService {

    private static final Logger log = LoggerFactory.getLogger(JGraphTService.class);

    /**
     * Build a DAG over the node ids of a workflow graph. Error edges count as dependencies.
     *
     * @param graph The workflow graph
     * @return DirectedAcyclicGraph with node id vertices
     * @throws CycleDetectedException if the graph contains a cycle
     * @throws ValidationException    if an edge names a node that does not exist
     */
    public DirectedAcyclicGraph<String, DefaultEdge> buildDag(WorkflowGraph graph) {
        log.debug("Building DAG for workflow: {}", graph.slug());

        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);

        // First pass: Create all vertices
        for (String nodeId : graph.nodeIds()) {
            dag.addVertex(nodeId);
        }

        // Second pass: Create edges
        for (Edge edge : graph.edges()) {
            if (!dag.containsVertex(edge.source()) || !dag.containsVertex(edge.target())) {
                throw new ValidationException("Edge " + edge + " references a node that does not exist in '"
                        + graph.slug() + "'");
            }

            try {
                dag.addEdge(edge.source(), edge.target());
                log.trace("Added edge: {} -> {}", edge.source(), edge.target());
            } catch (IllegalArgumentException e) {
                // JGraphT throws this if adding the edge would create a cycle
                throw new CycleDetectedException(
                        "Adding edge '" + edge.source() + "' -> '" + edge.target()
                                + "' would create a cycle in workflow '" + graph.slug() + "'");
            }
        }

        log.debug("DAG built successfully: {} vertices, {} edges",
                dag.vertexSet().size(),
                dag.edgeSet().size()
        );

        return dag;
    }

    /**
     * Get topological order of all nodes.
     * Nodes earlier in the list never depend on nodes later in the list.
     */
    public List<String> getTopologicalOrder(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<String> order = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator = new TopologicalOrderIterator<>(dag);

        while (iterator.hasNext()) {
            order.add(iterator.next());
        }

        return order;
    }

    /**
     * Nodes with no incoming edges
     */
    public Set<String> getRootNodes(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        return dag.vertexSet().stream()
                .filter(node -> dag.inDegreeOf(node) == 0)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Nodes with no outgoing edges
     */
    public Set<String> getLeafNodes(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        return dag.vertexSet().stream()
                .filter(node -> dag.outDegreeOf(node) == 0)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> getPredecessors(DirectedAcyclicGraph<String, DefaultEdge> dag, String node) {
        return dag.incomingEdgesOf(node).stream()
                .map(dag::getEdgeSource)
                .collect(Collectors.toSet());
    }

    /**
     * Every node reachable from {@code node} along edges
     */
    public Set<String> getDescendants(DirectedAcyclicGraph<String, DefaultEdge> dag, String node) {
        return dag.getDescendants(node);
    }

    /**
     * Get execution levels (nodes that can run in parallel).
     * Each level contains nodes that have no dependencies on each other.
     */
    public List<Set<String>> getExecutionLevels(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<Set<String>> levels = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        Set<String> remaining = new LinkedHashSet<>(dag.vertexSet());

        while (!remaining.isEmpty()) {
            Set<String> currentLevel = new LinkedHashSet<>();

            for (String node : remaining) {
                if (processed.containsAll(getPredecessors(dag, node))) {
                    currentLevel.add(node);
                }
            }

            if (currentLevel.isEmpty()) {
                // Should not happen in a valid DAG
                throw new IllegalStateException(
                        "Could not determine execution levels - possible cycle or invalid state");
            }

            levels.add(currentLevel);
            processed.addAll(currentLevel);
            remaining.removeAll(currentLevel);
        }

        log.debug("Graph has {} execution levels", levels.size());
        return levels;
    }

    public GraphStatistics getStatistics(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<Set<String>> levels = getExecutionLevels(dag);
        int maxParallelism = levels.stream()
                .mapToInt(Set::size)
                .max()
                .orElse(0);

        return new GraphStatistics(
                dag.vertexSet().size(),
                dag.edgeSet().size(),
                getRootNodes(dag).size(),
                getLeafNodes(dag).size(),
                levels.size(),
                maxParallelism
        );
    }
}
