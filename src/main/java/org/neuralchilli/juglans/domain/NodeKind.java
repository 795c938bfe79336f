package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a node does when it runs.
 */
public sealed interface NodeKind permits NodeKind.Call, NodeKind.Literal, NodeKind.ForEach, NodeKind.While {

    /**
     * Invoke a tool. Argument values are unevaluated expressions.
     */
    record Call(String target, Map<String, String> arguments) implements NodeKind {
        public Call {
            if (target == null || target.isBlank()) {
                throw new IllegalArgumentException("Call target cannot be null or empty");
            }
            arguments = arguments != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                    : Map.of();
        }
    }

    /**
     * Produce a constant value
     */
    record Literal(JsonNode value) implements NodeKind {
        public Literal {
            value = value != null ? value.deepCopy() : NullNode.getInstance();
        }
    }

    /**
     * Run {@code body} once per element of {@code collection}, binding it to {@code itemVar}
     */
    record ForEach(String itemVar, String collection, WorkflowGraph body) implements NodeKind {
        public ForEach {
            if (itemVar == null || itemVar.isBlank()) {
                throw new IllegalArgumentException("Foreach requires an iteration variable");
            }
            if (itemVar.startsWith("$")) {
                itemVar = itemVar.substring(1);
            }
            if (collection == null || collection.isBlank()) {
                throw new IllegalArgumentException("Foreach requires a collection expression");
            }
            if (body == null) {
                throw new IllegalArgumentException("Foreach requires a body");
            }
        }
    }

    /**
     * Run {@code body} while {@code condition} holds
     */
    record While(String condition, WorkflowGraph body) implements NodeKind {
        public While {
            if (condition == null || condition.isBlank()) {
                throw new IllegalArgumentException("While requires a condition");
            }
            if (body == null) {
                throw new IllegalArgumentException("While requires a body");
            }
        }
    }
}
