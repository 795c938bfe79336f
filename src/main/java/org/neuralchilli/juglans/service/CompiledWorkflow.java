package org.neuralchilli.juglans.service;

import org.neuralchilli.juglans.domain.GraphStatistics;
import org.neuralchilli.juglans.domain.WorkflowGraph;

import java.nio.file.Path;
import java.util.List;

/**
 * A workflow file merged with its imports, validated, with its resources loaded.
 */
public record CompiledWorkflow(Path source, WorkflowGraph graph, GraphStatistics statistics,
                               List<String> warnings, List<LoadResult> resources) {

    public CompiledWorkflow {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        resources = resources != null ? List.copyOf(resources) : List.of();
    }

    public long failedResources() {
        return resources.stream().filter(result -> !result.isSuccess()).count();
    }
}
