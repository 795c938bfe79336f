package org.neuralchilli.juglans.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A compiled unit: nodes, edges, entry and exit sets, resource patterns and flow imports.
 * Before merge {@code flowImports} maps alias to the relative path of the imported file;
 * after merge it is empty and every imported node carries its alias prefix.
 * Loop bodies are graphs too.
 */
public final class WorkflowGraph {

    private final String slug;
    private final String name;
    private final String version;
    private final String description;
    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final List<String> entryNodes;
    private final List<String> exitNodes;
    private final ResourcePatterns resources;
    private final Map<String, String> flowImports;
    private final Map<String, String> switchRoutes;

    public WorkflowGraph(
            String slug,
            String name,
            String version,
            String description,
            Map<String, Node> nodes,
            List<Edge> edges,
            List<String> entryNodes,
            List<String> exitNodes,
            ResourcePatterns resources,
            Map<String, String> flowImports,
            Map<String, String> switchRoutes
    ) {
        if ((nodes == null || nodes.isEmpty()) && (flowImports == null || flowImports.isEmpty())) {
            throw new IllegalArgumentException(
                    "Workflow '" + (slug != null ? slug : "<anonymous>") + "' must have at least one node");
        }
        if (nodes == null) {
            nodes = Map.of();
        }

        for (Map.Entry<String, Node> entry : nodes.entrySet()) {
            if (!entry.getKey().equals(entry.getValue().id())) {
                throw new IllegalArgumentException(
                        "Node registered as '" + entry.getKey() + "' has id '" + entry.getValue().id() + "'");
            }
        }

        this.slug = slug;
        this.name = name != null ? name : slug;
        this.version = version;
        this.description = description;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.entryNodes = entryNodes != null ? List.copyOf(entryNodes) : List.of();
        this.exitNodes = exitNodes != null ? List.copyOf(exitNodes) : List.of();
        this.resources = resources != null ? resources : ResourcePatterns.empty();
        this.flowImports = flowImports != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(flowImports))
                : Map.of();
        this.switchRoutes = switchRoutes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(switchRoutes))
                : Map.of();
    }

    // Getters
    public String slug() {
        return slug;
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public String description() {
        return description;
    }

    public Map<String, Node> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<String> entryNodes() {
        return entryNodes;
    }

    public List<String> exitNodes() {
        return exitNodes;
    }

    public ResourcePatterns resources() {
        return resources;
    }

    public Map<String, String> flowImports() {
        return flowImports;
    }

    /**
     * Switch subjects keyed by the routing node id
     */
    public Map<String, String> switchRoutes() {
        return switchRoutes;
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    public boolean hasFlowImports() {
        return !flowImports.isEmpty();
    }

    /**
     * Outgoing edges of a node in declaration order
     */
    public List<Edge> outgoingEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> edge.source().equals(nodeId))
                .toList();
    }

    public List<Edge> incomingEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> edge.target().equals(nodeId))
                .toList();
    }

    /**
     * Declared entries, or every node without incoming edges when none are declared
     */
    public List<String> effectiveEntryNodes() {
        if (!entryNodes.isEmpty()) {
            return entryNodes;
        }
        Set<String> targets = new LinkedHashSet<>();
        for (Edge edge : edges) {
            targets.add(edge.target());
        }
        List<String> roots = new ArrayList<>();
        for (String id : nodes.keySet()) {
            if (!targets.contains(id)) {
                roots.add(id);
            }
        }
        return roots;
    }

    /**
     * Ids of this graph's nodes and, recursively, of its loop bodies' nodes
     */
    public Set<String> allNodeIds() {
        Set<String> ids = new LinkedHashSet<>();
        collectIds(this, ids);
        return ids;
    }

    private static void collectIds(WorkflowGraph graph, Set<String> ids) {
        for (Node node : graph.nodes.values()) {
            ids.add(node.id());
            if (node.kind() instanceof NodeKind.ForEach forEach) {
                collectIds(forEach.body(), ids);
            } else if (node.kind() instanceof NodeKind.While loop) {
                collectIds(loop.body(), ids);
            }
        }
    }

    public Builder toBuilder() {
        return new Builder(slug)
                .name(name)
                .version(version)
                .description(description)
                .nodes(nodes.values())
                .edges(edges)
                .entryNodes(entryNodes)
                .exitNodes(exitNodes)
                .resources(resources)
                .flowImports(flowImports)
                .switchRoutes(switchRoutes);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        WorkflowGraph that = (WorkflowGraph) obj;
        return Objects.equals(this.slug, that.slug) &&
                Objects.equals(this.name, that.name) &&
                Objects.equals(this.version, that.version) &&
                Objects.equals(this.description, that.description) &&
                Objects.equals(this.nodes, that.nodes) &&
                Objects.equals(this.edges, that.edges) &&
                Objects.equals(this.entryNodes, that.entryNodes) &&
                Objects.equals(this.exitNodes, that.exitNodes) &&
                Objects.equals(this.resources, that.resources) &&
                Objects.equals(this.flowImports, that.flowImports) &&
                Objects.equals(this.switchRoutes, that.switchRoutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug, name, version, description, nodes, edges,
                entryNodes, exitNodes, resources, flowImports, switchRoutes);
    }

    @Override
    public String toString() {
        return "WorkflowGraph[" +
                "slug=" + slug + ", " +
                "nodes=" + nodes.keySet() + ", " +
                "edges=" + edges + ", " +
                "entry=" + entryNodes + ", " +
                "exit=" + exitNodes + ", " +
                "flows=" + flowImports + ']';
    }

    /**
     * Builder for creating graphs fluently
     */
    public static Builder builder(String slug) {
        return new Builder(slug);
    }

    public static class Builder {
        private final String slug;
        private String name;
        private String version;
        private String description;
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<String> entryNodes = new ArrayList<>();
        private final List<String> exitNodes = new ArrayList<>();
        private ResourcePatterns resources = ResourcePatterns.empty();
        private final Map<String, String> flowImports = new LinkedHashMap<>();
        private final Map<String, String> switchRoutes = new LinkedHashMap<>();

        public Builder(String slug) {
            this.slug = slug;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * Add a node; a second node with the same id is rejected
         */
        public Builder node(Node node) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
            return this;
        }

        public Builder nodes(Iterable<Node> nodes) {
            for (Node node : nodes) {
                node(node);
            }
            return this;
        }

        public Builder edge(Edge edge) {
            this.edges.add(edge);
            return this;
        }

        public Builder edges(List<Edge> edges) {
            this.edges.addAll(edges);
            return this;
        }

        public Builder entryNodes(List<String> entryNodes) {
            this.entryNodes.addAll(entryNodes);
            return this;
        }

        public Builder exitNodes(List<String> exitNodes) {
            this.exitNodes.addAll(exitNodes);
            return this;
        }

        public Builder resources(ResourcePatterns resources) {
            this.resources = resources;
            return this;
        }

        public Builder flowImport(String alias, String path) {
            this.flowImports.put(alias, path);
            return this;
        }

        public Builder flowImports(Map<String, String> flowImports) {
            this.flowImports.putAll(flowImports);
            return this;
        }

        public Builder clearFlowImports() {
            this.flowImports.clear();
            return this;
        }

        public Builder switchRoute(String source, String subject) {
            this.switchRoutes.put(source, subject);
            return this;
        }

        public Builder switchRoutes(Map<String, String> switchRoutes) {
            this.switchRoutes.putAll(switchRoutes);
            return this;
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(slug, name, version, description, nodes, edges,
                    entryNodes, exitNodes, resources, flowImports, switchRoutes);
        }
    }
}
