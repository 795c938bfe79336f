package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.tools.BuiltinTool;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The {@code notify} tool: a {@code status} updates {@code reply.status} (and the observer
 * sees a status event), a {@code message} is logged.
 */
@ApplicationScoped
public class NotifyTool implements BuiltinTool {

    private static final Logger log = LoggerFactory.getLogger(NotifyTool.class);

    public static final String NAME = "notify";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        Optional<String> status = invocation.text("status");
        status.ifPresent(text -> {
            invocation.context().setReply("status", TextNode.valueOf(text));
            log.info("[{}] Status: {}", invocation.context().runId(), text);
        });

        String message = invocation.textOr("message", "");
        if (!message.isEmpty()) {
            log.info("[{}] Notification: {}", invocation.context().runId(), message);
        }

        ObjectNode result = Values.object();
        result.put("status", "sent");
        result.put("content", message);
        return CompletableFuture.completedFuture(ToolResult.of(result));
    }
}
