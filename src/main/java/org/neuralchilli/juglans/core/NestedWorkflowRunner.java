package org.neuralchilli.juglans.core;

import org.neuralchilli.juglans.domain.RunResult;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Runs another workflow file as an isolated sub-run, e.g. for an agent that owns a workflow.
 */
@FunctionalInterface
public interface NestedWorkflowRunner {

    /**
     * @param workflow path of the workflow file
     * @param context  fresh context created with {@link ExecutionContext#isolated}
     */
    CompletableFuture<RunResult> runNested(Path workflow, ExecutionContext context);
}
