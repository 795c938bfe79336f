package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.MissingArgumentException;
import org.neuralchilli.juglans.core.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One call of a tool with its evaluated arguments.
 *
 * @param nodeId     node the call belongs to, null for calls made by an agent loop
 * @param dispatcher dispatcher that routed the call, for tools that call other tools
 */
public record ToolInvocation(
        String name,
        Map<String, JsonNode> arguments,
        ExecutionContext context,
        String nodeId,
        ToolDispatcher dispatcher
) {

    public ToolInvocation {
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
    }

    /**
     * Argument value, null node when absent
     */
    public JsonNode arg(String key) {
        JsonNode value = arguments.get(key);
        return value != null ? value : NullNode.getInstance();
    }

    public boolean has(String key) {
        return !Values.isNull(arguments.get(key));
    }

    /**
     * Required argument; absent or null raises {@link MissingArgumentException}
     */
    public JsonNode require(String key) {
        JsonNode value = arguments.get(key);
        if (Values.isNull(value)) {
            throw new MissingArgumentException(name, key);
        }
        return value;
    }

    public String requireText(String key) {
        return Values.asText(require(key));
    }

    public Optional<String> text(String key) {
        return has(key) ? Optional.of(Values.asText(arguments.get(key))) : Optional.empty();
    }

    public String textOr(String key, String defaultValue) {
        return text(key).orElse(defaultValue);
    }

    public Optional<Double> number(String key) {
        JsonNode value = arguments.get(key);
        if (Values.isNull(value)) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.doubleValue());
        }
        try {
            return Optional.of(Double.parseDouble(Values.asText(value).trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public ObjectNode argumentsObject() {
        ObjectNode json = Values.object();
        arguments.forEach(json::set);
        return json;
    }
}
