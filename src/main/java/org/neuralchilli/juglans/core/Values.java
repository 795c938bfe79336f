package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coercion rules between workflow values ({@link JsonNode}) and the Java objects
 * expressions operate on.
 */
public final class Values {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Values() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode object() {
        return JsonNodeFactory.instance.objectNode();
    }

    public static ArrayNode array() {
        return JsonNodeFactory.instance.arrayNode();
    }

    public static boolean isNull(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    /**
     * Booleans are themselves; the texts "true"/"false" parse; everything else is false.
     */
    public static boolean isTruthy(JsonNode value) {
        if (isNull(value)) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            return "true".equalsIgnoreCase(value.textValue().trim());
        }
        return false;
    }

    /**
     * Text nodes unwrap, null becomes empty, anything else is compact JSON
     */
    public static String asText(JsonNode value) {
        if (isNull(value)) {
            return "";
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        return value.toString();
    }

    /**
     * Convert to the plain Java object handed to JEXL
     */
    public static Object toJava(JsonNode value) {
        if (isNull(value)) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isArray()) {
            List<Object> list = new ArrayList<>(value.size());
            for (JsonNode element : value) {
                list.add(toJava(element));
            }
            return list;
        }
        if (value.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), toJava(field.getValue()));
            }
            return map;
        }
        return value.asText();
    }

    /**
     * Convert an expression result back to a value
     */
    public static JsonNode fromJava(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof CharSequence text) {
            return TextNode.valueOf(text.toString());
        }
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(value.toString());
        }
    }

    /**
     * Parse JSON text, falling back to a text node when it is not JSON
     */
    public static JsonNode parseLenient(String text) {
        if (text == null) {
            return NullNode.getInstance();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return TextNode.valueOf(text);
        }
        char first = trimmed.charAt(0);
        boolean looksStructured = first == '{' || first == '[' || first == '"';
        if (!looksStructured) {
            return TextNode.valueOf(text);
        }
        try {
            return MAPPER.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    /**
     * Walk a path of object keys and array indices; missing segments yield null
     */
    public static JsonNode at(JsonNode root, List<String> segments) {
        JsonNode current = root;
        for (String segment : segments) {
            if (isNull(current)) {
                return NullNode.getInstance();
            }
            if (current.isArray() && isIndex(segment)) {
                current = current.get(Integer.parseInt(segment));
            } else if (current.isObject()) {
                current = current.get(segment);
            } else if (current.isTextual() && current.textValue().trim().startsWith("{")) {
                current = parseLenient(current.textValue()).get(segment);
            } else {
                return NullNode.getInstance();
            }
        }
        return current != null ? current : NullNode.getInstance();
    }

    public static String toJson(JsonNode value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize value: " + e.getMessage(), e);
        }
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
