package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A reusable prompt text with {@code {{name}}} placeholders.
 *
 * @param defaults placeholder values used when neither the call nor {@code ctx} provides one
 */
public record PromptTemplate(String slug, String name, String body, Map<String, JsonNode> defaults, Path source) {

    public PromptTemplate {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Prompt slug cannot be null or empty");
        }
        if (body == null) {
            body = "";
        }
        if (name == null) {
            name = slug;
        }
        defaults = defaults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(defaults))
                : Map.of();
    }
}
