package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A unit of work in the execution graph.
 * The id is unique within its graph; after flow imports are merged it carries the alias prefix.
 */
public record Node(String id, NodeKind kind) {

    public Node {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node '" + id + "' must have a kind");
        }
    }

    public static Node call(String id, String target, Map<String, String> arguments) {
        return new Node(id, new NodeKind.Call(target, arguments));
    }

    public static Node literal(String id, JsonNode value) {
        return new Node(id, new NodeKind.Literal(value));
    }

    public boolean isLoop() {
        return kind instanceof NodeKind.ForEach || kind instanceof NodeKind.While;
    }

    public Node withId(String newId) {
        return new Node(newId, kind);
    }

    public Node withKind(NodeKind newKind) {
        return new Node(id, newKind);
    }
}
