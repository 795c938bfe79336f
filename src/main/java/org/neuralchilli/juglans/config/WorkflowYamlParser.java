package org.neuralchilli.juglans.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.AgentDefinition;
import org.neuralchilli.juglans.domain.Edge;
import org.neuralchilli.juglans.domain.EdgeKind;
import org.neuralchilli.juglans.domain.Node;
import org.neuralchilli.juglans.domain.NodeKind;
import org.neuralchilli.juglans.domain.PromptTemplate;
import org.neuralchilli.juglans.domain.ResourcePatterns;
import org.neuralchilli.juglans.domain.ToolDefinition;
import org.neuralchilli.juglans.domain.ToolResource;
import org.neuralchilli.juglans.domain.WorkflowGraph;
import org.neuralchilli.juglans.service.ParseException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses workflow, agent and prompt files (YAML) and tool bundles (JSON) into domain objects.
 *
 * Workflow layout:
 * <pre>
 * slug: review
 * entry: [start]
 * exit: [done]
 * flows: { order: ./order.yaml }
 * prompts: [ "prompts/*.prompt" ]
 * nodes:
 *   start: { call: chat, args: { agent: reviewer, message: $input.text } }
 *   items: { literal: [1, 2, 3] }
 *   each:  { foreach: { item: x, in: $items.output, body: { nodes: ..., edges: ... } } }
 * edges:
 *   - start -> each -> done
 *   - { from: start, to: fallback, on_error: true }
 *   - { from: start, to: done, when: $ctx.ok == true }
 * switch: { start: $ctx.kind }
 * </pre>
 */
@ApplicationScoped
public class WorkflowYamlParser {

    private static final String ARROW = "->";

    /**
     * Parse a workflow definition; {@code source} names the file in error messages
     */
    public WorkflowGraph parseWorkflow(String yamlContent, String source) {
        Map<String, Object> data = loadMap(yamlContent, source);
        try {
            String slug = getString(data, "slug", false);
            if (slug == null) {
                slug = slugFromSource(source);
            }
            return parseGraph(slug, data, true);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new ParseException("Invalid workflow " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse an agent definition; the workflow path is resolved against {@code source}
     */
    public AgentDefinition parseAgent(String yamlContent, Path source) {
        String label = source != null ? source.toString() : "<agent>";
        Map<String, Object> data = loadMap(yamlContent, label);
        try {
            String slug = getString(data, "slug", false);
            if (slug == null) {
                slug = slugFromSource(label);
            }

            Object timeout = data.get("workflow_timeout");
            return AgentDefinition.builder(slug)
                    .model(getString(data, "model", false))
                    .systemPrompt(getString(data, "system_prompt", false))
                    .systemPromptSlug(getString(data, "system_prompt_slug", false))
                    .temperature(getDouble(data, "temperature"))
                    .tools(data.containsKey("tools") ? Values.mapper().valueToTree(data.get("tools")) : null)
                    .workflow(getString(data, "workflow", false))
                    .workflowTimeoutSeconds(timeout != null ? toInt(timeout, "workflow_timeout") : null)
                    .returns(getStringList(data, "returns", List.of()))
                    .source(source)
                    .build();
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new ParseException("Invalid agent " + label + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a prompt file: optional YAML front matter between {@code ---} lines, then the body
     */
    public PromptTemplate parsePrompt(String content, Path source) {
        String label = source != null ? source.toString() : "<prompt>";
        String normalized = content.replace("\r\n", "\n");

        Map<String, Object> frontMatter = Map.of();
        String body = normalized;
        if (normalized.startsWith("---\n")) {
            int end = normalized.indexOf("\n---", 4);
            if (end < 0) {
                throw new ParseException("Unterminated front matter in prompt " + label);
            }
            frontMatter = loadMap(normalized.substring(4, end), label);
            int bodyStart = normalized.indexOf('\n', end + 4);
            body = bodyStart < 0 ? "" : normalized.substring(bodyStart + 1);
        }

        try {
            String slug = getString(frontMatter, "slug", false);
            Map<String, JsonNode> defaults = new LinkedHashMap<>();
            Object inputs = frontMatter.get("inputs");
            if (inputs instanceof Map<?, ?> map) {
                map.forEach((k, v) -> defaults.put(k.toString(), Values.mapper().valueToTree(v)));
            }
            return new PromptTemplate(
                    slug != null ? slug : slugFromSource(label),
                    getString(frontMatter, "name", false),
                    body.strip(),
                    defaults,
                    source
            );
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new ParseException("Invalid prompt " + label + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a JSON tool bundle: either {@code {slug, name, description, tools: [...]}}
     * or a bare list of definitions named after the file
     */
    public ToolResource parseToolResource(String json, Path source) {
        String label = source != null ? source.toString() : "<tools>";
        JsonNode root;
        try {
            root = Values.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParseException("Malformed tool bundle " + label + ": " + e.getOriginalMessage(), e);
        }

        try {
            JsonNode definitions = root.isArray() ? root : root.path("tools");
            if (!definitions.isArray()) {
                throw new IllegalArgumentException("expected a 'tools' array");
            }
            List<ToolDefinition> tools = new ArrayList<>();
            for (JsonNode definition : definitions) {
                tools.add(ToolDefinition.fromJson(definition));
            }

            String slug = root.isObject() && root.hasNonNull("slug") ? root.get("slug").asText() : slugFromSource(label);
            String name = root.isObject() && root.hasNonNull("name") ? root.get("name").asText() : null;
            String description = root.isObject() && root.hasNonNull("description") ? root.get("description").asText() : null;
            return new ToolResource(slug, name, description, tools);
        } catch (IllegalArgumentException e) {
            throw new ParseException("Invalid tool bundle " + label + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private WorkflowGraph parseGraph(String slug, Map<String, Object> data, boolean topLevel) {
        WorkflowGraph.Builder builder = WorkflowGraph.builder(slug)
                .name(getString(data, "name", false))
                .version(getString(data, "version", false))
                .description(getString(data, "description", false))
                .entryNodes(getStringList(data, "entry", List.of()))
                .exitNodes(getStringList(data, "exit", List.of()));

        if (topLevel) {
            builder.resources(new ResourcePatterns(
                    getStringList(data, "prompts", List.of()),
                    getStringList(data, "agents", List.of()),
                    getStringList(data, "tools", List.of()),
                    getStringList(data, "modules", List.of())
            ));
            builder.flowImports(getStringMap(data, "flows"));
        }

        Object nodes = data.get("nodes");
        if (nodes != null) {
            if (!(nodes instanceof Map)) {
                throw new IllegalArgumentException("'nodes' must be a map of node id to definition");
            }
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) nodes).entrySet()) {
                builder.node(parseNode(slug, String.valueOf(entry.getKey()), entry.getValue()));
            }
        }

        Object edges = data.get("edges");
        if (edges != null) {
            if (!(edges instanceof List)) {
                throw new IllegalArgumentException("'edges' must be a list");
            }
            for (Object edge : (List<Object>) edges) {
                builder.edges(parseEdges(edge));
            }
        }

        builder.switchRoutes(getStringMap(data, "switch"));
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private Node parseNode(String graphSlug, String id, Object definition) {
        if (definition instanceof String target) {
            return Node.call(id, target, Map.of());
        }
        if (!(definition instanceof Map)) {
            throw new IllegalArgumentException("Node '" + id + "' must be a map");
        }
        Map<String, Object> data = (Map<String, Object>) definition;

        if (data.containsKey("call")) {
            return Node.call(id, getString(data, "call", true), parseArguments(id, data.get("args")));
        }
        if (data.containsKey("literal")) {
            return Node.literal(id, Values.mapper().valueToTree(data.get("literal")));
        }
        if (data.containsKey("foreach")) {
            Map<String, Object> loop = asMap(data.get("foreach"), "foreach of node '" + id + "'");
            return new Node(id, new NodeKind.ForEach(
                    getString(loop, "item", true),
                    getString(loop, "in", true),
                    parseBody(graphSlug, id, loop)
            ));
        }
        if (data.containsKey("while")) {
            Map<String, Object> loop = asMap(data.get("while"), "while of node '" + id + "'");
            return new Node(id, new NodeKind.While(
                    getString(loop, "condition", true),
                    parseBody(graphSlug, id, loop)
            ));
        }
        throw new IllegalArgumentException("Node '" + id + "' needs one of: call, literal, foreach, while");
    }

    private WorkflowGraph parseBody(String graphSlug, String nodeId, Map<String, Object> loop) {
        Map<String, Object> body = asMap(loop.get("body"), "body of loop '" + nodeId + "'");
        return parseGraph(graphSlug + "." + nodeId, body, false);
    }

    private Map<String, String> parseArguments(String nodeId, Object args) {
        Map<String, String> arguments = new LinkedHashMap<>();
        if (args == null) {
            return arguments;
        }
        Map<String, Object> map = asMap(args, "args of node '" + nodeId + "'");
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            arguments.put(String.valueOf(entry.getKey()), toExpression(entry.getValue()));
        }
        return arguments;
    }

    /**
     * Strings are kept as written; structured values become JSON text, which the evaluator parses back
     */
    private String toExpression(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Map || value instanceof List) {
            return Values.toJson(Values.mapper().valueToTree(value));
        }
        return value.toString();
    }

    @SuppressWarnings("unchecked")
    private List<Edge> parseEdges(Object edge) {
        if (edge instanceof String chain) {
            String[] parts = chain.split(ARROW);
            if (parts.length < 2) {
                throw new IllegalArgumentException("Edge '" + chain + "' must look like 'a -> b'");
            }
            List<Edge> edges = new ArrayList<>();
            for (int i = 0; i < parts.length - 1; i++) {
                edges.add(Edge.of(parts[i].trim(), parts[i + 1].trim()));
            }
            return edges;
        }
        if (!(edge instanceof Map)) {
            throw new IllegalArgumentException("Edge must be 'a -> b' or a map, got: " + edge);
        }

        Map<String, Object> data = (Map<String, Object>) edge;
        String from = getString(data, "from", true);
        List<String> targets = data.get("to") instanceof List
                ? getStringList(data, "to", List.of())
                : List.of(getString(data, "to", true));
        boolean onError = getBoolean(data, "on_error", false);
        String condition = getString(data, "when", false);
        String switchCase = getString(data, "case", false);

        return targets.stream()
                .map(to -> new Edge(from, to, condition, onError ? EdgeKind.ON_ERROR : EdgeKind.NORMAL, switchCase))
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> loadMap(String content, String source) {
        Object data;
        try {
            data = new Yaml().load(content);
        } catch (YAMLException e) {
            throw new ParseException("Malformed YAML in " + source + ": " + e.getMessage(), e);
        }
        if (data == null) {
            return Map.of();
        }
        if (!(data instanceof Map)) {
            throw new ParseException("Expected a YAML map in " + source + ", got " + data.getClass().getSimpleName());
        }
        return (Map<String, Object>) data;
    }

    private static String slugFromSource(String source) {
        String fileName = Path.of(source).getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    // Helper methods for type-safe extraction

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(what + " must be a map");
        }
        return (Map<String, Object>) value;
    }

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private Double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    private int toInt(Object value, String key) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + key + "' must be an integer, got: " + value);
        }
    }

    /**
     * A single scalar counts as a one-element list
     */
    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        return List.of(value.toString());
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("'" + key + "' must be a map");
        }
        Map<String, String> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> result.put(k.toString(), v != null ? v.toString() : null));
        return result;
    }
}
