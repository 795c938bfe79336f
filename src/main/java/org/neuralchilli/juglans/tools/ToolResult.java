package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.neuralchilli.juglans.domain.MessageState;

/**
 * Value produced by a tool together with its visibility.
 *
 * @param persist          write the value to the node outputs for downstream nodes
 * @param stream           include the value in the observer's node_complete event
 * @param executedOnClient the call was answered by the client and ends the agent loop
 */
public record ToolResult(JsonNode value, boolean persist, boolean stream, boolean executedOnClient) {

    public ToolResult {
        value = value != null ? value : NullNode.getInstance();
    }

    public static ToolResult of(JsonNode value) {
        return new ToolResult(value, true, true, false);
    }

    public static ToolResult empty() {
        return of(NullNode.getInstance());
    }

    public static ToolResult withVisibility(JsonNode value, MessageState.Visibility visibility) {
        return new ToolResult(value, visibility.persist(), visibility.stream(), false);
    }

    public ToolResult markExecutedOnClient() {
        return new ToolResult(value, persist, stream, true);
    }
}
