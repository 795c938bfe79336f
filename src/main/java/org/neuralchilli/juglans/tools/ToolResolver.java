package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.AgentDefinition;
import org.neuralchilli.juglans.domain.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which tool definitions a chat call offers to the model.
 *
 * The call's own {@code tools} argument wins over the agent's defaults. A spec is an inline
 * definition or list of definitions, a {@code "@slug"} reference, or a list of slugs.
 * Bundles are merged in order; a later tool with the same name replaces an earlier one.
 */
@ApplicationScoped
public class ToolResolver {

    private static final Logger log = LoggerFactory.getLogger(ToolResolver.class);

    private final ToolRegistry registry;

    protected ToolResolver() {
        this.registry = null;
    }

    @Inject
    public ToolResolver(ToolRegistry registry) {
        this.registry = registry;
    }

    public List<ToolDefinition> resolveTools(JsonNode callTools, AgentDefinition agent) {
        if (!Values.isNull(callTools)) {
            List<ToolDefinition> tools = resolveSpec(callTools);
            log.debug("Using {} tools from the call", tools.size());
            return tools;
        }
        if (agent != null && agent.hasDefaultTools()) {
            List<ToolDefinition> tools = resolveSpec(agent.tools());
            log.debug("Using {} default tools of agent '{}'", tools.size(), agent.slug());
            return tools;
        }
        return List.of();
    }

    /**
     * Resolve one spec to a de-duplicated list of definitions
     */
    public List<ToolDefinition> resolveSpec(JsonNode spec) {
        Map<String, ToolDefinition> merged = new LinkedHashMap<>();
        collect(spec, merged);
        return new ArrayList<>(merged.values());
    }

    private void collect(JsonNode spec, Map<String, ToolDefinition> merged) {
        if (Values.isNull(spec)) {
            return;
        }
        if (spec.isTextual()) {
            collectText(spec.textValue().trim(), merged);
        } else if (spec.isArray()) {
            for (JsonNode element : spec) {
                collect(element, merged);
            }
        } else if (spec.isObject()) {
            ToolDefinition tool = parseDefinition(spec);
            merged.put(tool.name(), tool);
        } else {
            throw new ToolResolutionException("Unsupported tools specification: " + spec);
        }
    }

    private void collectText(String text, Map<String, ToolDefinition> merged) {
        if (text.isEmpty()) {
            return;
        }
        if (text.startsWith("[") || text.startsWith("{")) {
            JsonNode parsed = Values.parseLenient(text);
            if (parsed.isTextual()) {
                throw new ToolResolutionException("Tools specification is not valid JSON: " + text);
            }
            collect(parsed, merged);
            return;
        }
        for (String part : text.split(",")) {
            String slug = part.trim();
            if (slug.startsWith("@")) {
                slug = slug.substring(1);
            }
            if (slug.isEmpty()) {
                continue;
            }
            for (ToolDefinition tool : registry.get(slug).tools()) {
                merged.put(tool.name(), tool);
            }
        }
    }

    private ToolDefinition parseDefinition(JsonNode json) {
        try {
            return ToolDefinition.fromJson(json);
        } catch (IllegalArgumentException e) {
            throw new ToolResolutionException("Invalid inline tool definition: " + e.getMessage());
        }
    }
}
