package org.neuralchilli.juglans.domain;

import java.util.List;

/**
 * A named bundle of tool definitions, referenced by slug from agents and calls.
 */
public record ToolResource(String slug, String name, String description, List<ToolDefinition> tools) {

    public ToolResource {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Tool resource slug cannot be null or empty");
        }
        if (name == null) {
            name = slug;
        }
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
