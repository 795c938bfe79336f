package org.neuralchilli.juglans.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.config.WorkflowYamlParser;
import org.neuralchilli.juglans.core.VariableReferences;
import org.neuralchilli.juglans.domain.Edge;
import org.neuralchilli.juglans.domain.Node;
import org.neuralchilli.juglans.domain.NodeKind;
import org.neuralchilli.juglans.domain.ResourcePatterns;
import org.neuralchilli.juglans.domain.WorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads a workflow file and splices every flow import into it, recursively.
 *
 * Imported nodes are renamed {@code alias.id}; references inside the imported unit whose first
 * segment is one of its own node ids are rewritten the same way, so {@code $verify.output}
 * inside {@code order.yaml} imported as {@code order} becomes {@code $order.verify.output}.
 * Reserved roots ({@code ctx}, {@code input}, ...) are never rewritten. The result has no flow
 * imports left.
 */
@ApplicationScoped
public class FlowImportResolver {

    private static final Logger log = LoggerFactory.getLogger(FlowImportResolver.class);

    private final WorkflowYamlParser parser;

    @Inject
    public FlowImportResolver(WorkflowYamlParser parser) {
        this.parser = parser;
    }

    /**
     * Load {@code root} and merge all of its flow imports into one flat graph
     *
     * @throws CircularImportException when an import chain leads back to a file being loaded
     * @throws ParseException          when a file cannot be read or parsed
     */
    public WorkflowGraph merge(Path root) {
        return load(canonical(root), new ArrayList<>());
    }

    private WorkflowGraph load(Path path, List<Path> chain) {
        if (chain.contains(path)) {
            List<String> names = chain.stream().map(this::displayName).collect(Collectors.toCollection(ArrayList::new));
            names.add(displayName(path));
            throw new CircularImportException(names);
        }
        chain.add(path);

        WorkflowGraph graph = parser.parseWorkflow(read(path), path.toString());
        Path baseDir = path.getParent();
        log.debug("Loaded workflow '{}' from {} ({} imports)", graph.slug(), path, graph.flowImports().size());

        WorkflowGraph.Builder merged = graph.toBuilder().clearFlowImports();
        ResourcePatterns resources = graph.resources().resolvedAgainst(baseDir);

        for (Map.Entry<String, String> flowImport : graph.flowImports().entrySet()) {
            String alias = flowImport.getKey();
            Path childPath = canonical(baseDir.resolve(flowImport.getValue()));

            WorkflowGraph child = load(childPath, chain);
            WorkflowGraph namespaced = prefix(child, alias);

            merged.nodes(namespaced.nodes().values())
                    .edges(namespaced.edges())
                    .switchRoutes(namespaced.switchRoutes());
            resources = resources.union(namespaced.resources());
            log.debug("Merged '{}' as '{}' into '{}' ({} nodes)", child.slug(), alias, graph.slug(), child.nodes().size());
        }

        chain.remove(chain.size() - 1);
        return merged.resources(resources).build();
    }

    /**
     * Namespace a fully merged graph under {@code alias}: node ids, edges, switch routes and
     * every reference to one of its local roots
     */
    WorkflowGraph prefix(WorkflowGraph graph, String alias) {
        Set<String> localRoots = graph.allNodeIds().stream()
                .map(VariableReferences::rootOf)
                .collect(Collectors.toSet());
        return rename(graph, alias, localRoots);
    }

    private WorkflowGraph rename(WorkflowGraph graph, String alias, Set<String> localRoots) {
        WorkflowGraph.Builder builder = WorkflowGraph.builder(graph.slug())
                .name(graph.name())
                .version(graph.version())
                .description(graph.description())
                .resources(graph.resources())
                .entryNodes(namespaced(graph.entryNodes(), alias))
                .exitNodes(namespaced(graph.exitNodes(), alias));

        for (Node node : graph.nodes().values()) {
            builder.node(new Node(alias + "." + node.id(), renameKind(node.kind(), alias, localRoots)));
        }

        for (Edge edge : graph.edges()) {
            builder.edge(edge
                    .withEndpoints(alias + "." + edge.source(), alias + "." + edge.target())
                    .withCondition(VariableReferences.prefix(edge.condition(), alias, localRoots)));
        }

        Map<String, String> switchRoutes = new LinkedHashMap<>();
        graph.switchRoutes().forEach((source, subject) ->
                switchRoutes.put(alias + "." + source, VariableReferences.prefix(subject, alias, localRoots)));
        builder.switchRoutes(switchRoutes);

        return builder.build();
    }

    private NodeKind renameKind(NodeKind kind, String alias, Set<String> localRoots) {
        if (kind instanceof NodeKind.Call call) {
            Map<String, String> arguments = new LinkedHashMap<>();
            call.arguments().forEach((key, value) ->
                    arguments.put(key, VariableReferences.prefix(value, alias, localRoots)));
            return new NodeKind.Call(call.target(), arguments);
        }
        if (kind instanceof NodeKind.ForEach forEach) {
            return new NodeKind.ForEach(
                    forEach.itemVar(),
                    VariableReferences.prefix(forEach.collection(), alias, localRoots),
                    rename(forEach.body(), alias, localRoots));
        }
        if (kind instanceof NodeKind.While whileLoop) {
            return new NodeKind.While(
                    VariableReferences.prefix(whileLoop.condition(), alias, localRoots),
                    rename(whileLoop.body(), alias, localRoots));
        }
        return kind;
    }

    private static List<String> namespaced(List<String> ids, String alias) {
        return ids.stream().map(id -> alias + "." + id).toList();
    }

    private String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new ParseException("Cannot read workflow file " + path + ": " + e.getMessage(), e);
        }
    }

    private Path canonical(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            throw new ParseException("Cannot resolve workflow file " + path + ": " + e.getMessage(), e);
        }
    }

    private String displayName(Path path) {
        return path.getFileName().toString();
    }
}
