package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves dotted variable paths against an {@link ExecutionContext}.
 *
 * The first segment is tried, in order, as a loop iteration variable (innermost first),
 * a reserved root ({@code input}, {@code ctx}, {@code output}, {@code reply}, {@code loop}),
 * the longest node id prefix with a stored result, and finally a bare {@code ctx} key.
 * Missing segments yield a null node, never an error.
 */
@ApplicationScoped
public class VariableResolver {

    private static final Logger log = LoggerFactory.getLogger(VariableResolver.class);

    public JsonNode resolve(String path, ExecutionContext context) {
        List<String> segments = ExecutionContext.splitPath(path);
        if (segments.isEmpty()) {
            return NullNode.getInstance();
        }

        JsonNode value = lookup(segments, context);
        log.trace("Resolved ${} -> {}", path, value);
        return value;
    }

    private JsonNode lookup(List<String> segments, ExecutionContext context) {
        String root = segments.get(0);
        List<String> rest = segments.subList(1, segments.size());

        List<LoopScope> scopes = context.loopScopes();
        for (int i = scopes.size() - 1; i >= 0; i--) {
            LoopScope scope = scopes.get(i);
            if (scope.binds(root)) {
                return Values.at(scope.item(), rest);
            }
        }

        switch (root) {
            case "input":
                return Values.at(context.input(), rest);
            case "ctx":
                return context.ctxValue(rest);
            case "output":
                return Values.at(context.currentOutput(), rest);
            case "reply":
                return context.replyValue(rest);
            case "loop":
                return context.innermostLoop()
                        .map(scope -> Values.at(scope.toLoopObject(), rest))
                        .orElse(NullNode.getInstance());
            default:
                break;
        }

        Optional<JsonNode> fromNode = lookupNodeResult(segments, context);
        if (fromNode.isPresent()) {
            return fromNode.get();
        }

        return context.ctxValue(segments);
    }

    /**
     * Node ids may contain dots after merge, so the longest joined prefix that names a
     * stored node result wins: {@code order.payment.charge.output} finds node
     * {@code order.payment.charge} before {@code order}.
     */
    private Optional<JsonNode> lookupNodeResult(List<String> segments, ExecutionContext context) {
        for (int length = segments.size(); length >= 1; length--) {
            String candidate = String.join(".", segments.subList(0, length));
            Optional<JsonNode> entry = context.nodeResult(candidate);
            if (entry.isPresent()) {
                return Optional.of(Values.at(entry.get(), segments.subList(length, segments.size())));
            }
        }
        return Optional.empty();
    }
}
