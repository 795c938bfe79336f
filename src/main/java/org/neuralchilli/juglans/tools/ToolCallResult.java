package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.neuralchilli.juglans.core.Values;

/**
 * Answer to one forwarded tool call.
 *
 * @param toolCallId id of the model's tool call this answers
 * @param content    result text; JSON results may carry {@code "executed_on_client": true}
 */
public record ToolCallResult(String toolCallId, String content) {

    public ToolCallResult {
        if (toolCallId == null || toolCallId.isBlank()) {
            throw new IllegalArgumentException("Tool call result requires a tool call id");
        }
        content = content != null ? content : "";
    }

    /**
     * The client executed the tool itself and the agent loop should end
     */
    public boolean executedOnClient() {
        JsonNode parsed = Values.parseLenient(content);
        return parsed.isObject()
                && parsed.path("executed_on_client").isBoolean()
                && parsed.path("executed_on_client").booleanValue();
    }

    public static ToolCallResult fromJson(JsonNode json) {
        JsonNode id = json.path("tool_call_id");
        JsonNode content = json.path("content");
        return new ToolCallResult(
                id.asText(null),
                content.isTextual() ? content.textValue() : Values.asText(content)
        );
    }
}
