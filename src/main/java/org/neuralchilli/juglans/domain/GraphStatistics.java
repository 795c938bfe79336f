package org.neuralchilli.juglans.domain;

/**
 * Shape of a workflow graph: size, entry and leaf counts, and how much of it can run in parallel.
 */
public record GraphStatistics(
        int totalNodes,
        int totalEdges,
        int rootNodes,
        int leafNodes,
        int executionLevels,
        int maxParallelism
) {
    public GraphStatistics {
        if (totalNodes < 0) {
            throw new IllegalArgumentException("Total nodes cannot be negative");
        }
        if (totalEdges < 0) {
            throw new IllegalArgumentException("Total edges cannot be negative");
        }
        if (rootNodes < 0 || leafNodes < 0) {
            throw new IllegalArgumentException("Root and leaf counts cannot be negative");
        }
        if (executionLevels < 0) {
            throw new IllegalArgumentException("Execution levels cannot be negative");
        }
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("Max parallelism cannot be negative");
        }
    }

    /**
     * Check if some nodes can run side by side
     */
    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    /**
     * Check if the graph is a single chain
     */
    public boolean isLinear() {
        return maxParallelism == 1;
    }

    public int depth() {
        return executionLevels;
    }

    public int width() {
        return maxParallelism;
    }

    @Override
    public String toString() {
        return String.format(
                "GraphStatistics[nodes=%d, edges=%d, levels=%d, max_parallel=%d, roots=%d, leaves=%d]",
                totalNodes, totalEdges, executionLevels, maxParallelism, rootNodes, leafNodes
        );
    }
}
