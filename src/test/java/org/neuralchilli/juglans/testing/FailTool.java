package org.neuralchilli.juglans.testing;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.tools.BuiltinTool;
import org.neuralchilli.juglans.tools.CallFailureException;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResult;

import java.util.concurrent.CompletableFuture;

/**
 * Always fails like an unreachable collaborator.
 */
@ApplicationScoped
public class FailTool implements BuiltinTool {

    @Override
    public String name() {
        return "fail";
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        return CompletableFuture.failedFuture(
                new CallFailureException(invocation.textOr("message", "collaborator unavailable")));
    }
}
