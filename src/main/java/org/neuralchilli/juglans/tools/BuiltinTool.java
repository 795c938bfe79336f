package org.neuralchilli.juglans.tools;

import java.util.concurrent.CompletableFuture;

/**
 * An in-process tool. Implementations are CDI beans collected by {@link BuiltinRegistry}.
 */
public interface BuiltinTool {

    /**
     * Name the tool is called by
     */
    String name();

    /**
     * Run the tool. Failures are reported through the returned future.
     */
    CompletableFuture<ToolResult> execute(ToolInvocation invocation);
}
