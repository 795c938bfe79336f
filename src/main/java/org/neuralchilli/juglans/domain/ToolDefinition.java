package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A callable function signature in the OpenAI function-calling shape.
 *
 * @param parameters JSON schema of the arguments
 */
public record ToolDefinition(String name, String description, JsonNode parameters) {

    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name cannot be null or empty");
        }
        if (description == null) {
            description = "";
        }
        if (parameters == null || parameters.isNull() || parameters.isMissingNode()) {
            ObjectNode empty = JsonNodeFactory.instance.objectNode();
            empty.put("type", "object");
            empty.set("properties", JsonNodeFactory.instance.objectNode());
            parameters = empty;
        }
    }

    /**
     * Accepts both {@code {"type":"function","function":{...}}} and the flat
     * {@code {"name":..,"description":..,"parameters":..}} form.
     */
    public static ToolDefinition fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Tool definition must be a JSON object, got: " + json);
        }
        JsonNode function = json.has("function") ? json.get("function") : json;
        JsonNode name = function.get("name");
        if (name == null || !name.isTextual()) {
            throw new IllegalArgumentException("Tool definition is missing 'name': " + json);
        }
        JsonNode description = function.get("description");
        JsonNode parameters = function.has("parameters") ? function.get("parameters") : function.get("inputSchema");
        return new ToolDefinition(
                name.asText(),
                description != null ? description.asText() : null,
                parameters
        );
    }

    public ObjectNode toJson() {
        ObjectNode function = JsonNodeFactory.instance.objectNode();
        function.put("name", name);
        function.put("description", description);
        function.set("parameters", parameters.deepCopy());

        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("type", "function");
        json.set("function", function);
        return json;
    }
}
