package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.MissingArgumentException;
import org.neuralchilli.juglans.tools.BuiltinTool;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The {@code set_context} tool. Either {@code path} and {@code value}, or every argument
 * written as a {@code ctx} key of the same name.
 */
@ApplicationScoped
public class SetContextTool implements BuiltinTool {

    private static final Logger log = LoggerFactory.getLogger(SetContextTool.class);

    public static final String NAME = "set_context";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        ExecutionContext context = invocation.context();

        if (invocation.arguments().containsKey("path")) {
            String path = invocation.requireText("path");
            if (!invocation.arguments().containsKey("value")) {
                throw new MissingArgumentException(NAME, "value");
            }
            context.setCtx(path, invocation.arg("value"));
            log.debug("set_context {} (node {})", path, invocation.nodeId());
            return CompletableFuture.completedFuture(ToolResult.empty());
        }

        for (Map.Entry<String, JsonNode> field : invocation.arguments().entrySet()) {
            if ("value".equals(field.getKey())) {
                continue;
            }
            context.setCtx(field.getKey(), field.getValue());
        }
        log.debug("set_context {} (node {})", invocation.arguments().keySet(), invocation.nodeId());
        return CompletableFuture.completedFuture(ToolResult.empty());
    }
}
