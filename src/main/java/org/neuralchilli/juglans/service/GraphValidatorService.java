package org.neuralchilli.juglans.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.core.ExpressionEvaluator;
import org.neuralchilli.juglans.core.VariableReferences;
import org.neuralchilli.juglans.domain.Edge;
import org.neuralchilli.juglans.domain.Node;
import org.neuralchilli.juglans.domain.NodeKind;
import org.neuralchilli.juglans.domain.WorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates merged workflow graphs beyond basic domain validation.
 * Checks edge endpoints, entry and exit ids, cycles, expressions and required builtin arguments.
 */
@ApplicationScoped
public class GraphValidatorService {

    private static final Logger log = LoggerFactory.getLogger(GraphValidatorService.class);

    private static final Map<String, List<String>> REQUIRED_ARGUMENTS = Map.of(
            "chat", List.of("message"),
            "fetch_url", List.of("url"),
            "timer", List.of("ms|seconds"),
            "p", List.of("slug|file"),
            "notify", List.of("message|status")
    );

    private final JGraphTService graphService;
    private final ExpressionEvaluator evaluator;

    @Inject
    public GraphValidatorService(JGraphTService graphService, ExpressionEvaluator evaluator) {
        this.graphService = graphService;
        this.evaluator = evaluator;
    }

    /**
     * Validate a workflow graph, logging warnings
     *
     * @return the report, which then only carries warnings
     * @throws ValidationException if validation fails
     * @throws CycleDetectedException if the graph contains a cycle
     */
    public ValidationReport validateGraph(WorkflowGraph graph) {
        if (edgeEndpointsExist(graph)) {
            graphService.buildDag(graph);
        }

        ValidationReport report = validate(graph);

        report.warnings().forEach(warning -> log.warn("Workflow '{}': {}", graph.slug(), warning));

        if (!report.isValid()) {
            throw new ValidationException("Workflow validation failed for '" + graph.slug() + "':\n"
                    + String.join("\n", report.errors()));
        }
        log.debug("Workflow '{}' is valid ({} warnings)", graph.slug(), report.warnings().size());
        return report;
    }

    /**
     * Collect every problem without throwing
     */
    public ValidationReport validate(WorkflowGraph graph) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        validate(graph, Set.of(), "", errors, warnings);
        return new ValidationReport(errors, warnings);
    }

    private void validate(WorkflowGraph graph, Set<String> loopVariables, String scope,
                          List<String> errors, List<String> warnings) {
        int errorCount = errors.size();

        validateEdges(graph, scope, errors, warnings);
        validateEntryAndExit(graph, scope, errors);
        validateSwitchRoutes(graph, scope, errors, warnings);

        if (errors.size() == errorCount) {
            try {
                graphService.buildDag(graph);
                validateReachability(graph, scope, warnings);
            } catch (CycleDetectedException e) {
                errors.add(scope + e.getMessage());
            }
        }

        for (Node node : graph.nodes().values()) {
            validateNode(node, graph, loopVariables, scope, errors, warnings);
        }
    }

    private boolean edgeEndpointsExist(WorkflowGraph graph) {
        return graph.edges().stream()
                .allMatch(edge -> graph.node(edge.source()).isPresent() && graph.node(edge.target()).isPresent());
    }

    private void validateEdges(WorkflowGraph graph, String scope, List<String> errors, List<String> warnings) {
        for (Edge edge : graph.edges()) {
            if (graph.node(edge.source()).isEmpty()) {
                errors.add(scope + "Edge " + edge + " starts at unknown node '" + edge.source() + "'");
            }
            if (graph.node(edge.target()).isEmpty()) {
                errors.add(scope + "Edge " + edge + " points to unknown node '" + edge.target() + "'");
            }
            if (edge.isConditional()) {
                checkExpression(edge.condition(), "condition of edge " + edge, scope, errors);
            }
            if (edge.isErrorPath() && edge.isConditional()) {
                warnings.add(scope + "Condition on error edge " + edge + " is ignored");
            }
        }
    }

    private void validateEntryAndExit(WorkflowGraph graph, String scope, List<String> errors) {
        for (String entry : graph.entryNodes()) {
            if (graph.node(entry).isEmpty()) {
                errors.add(scope + "Entry node '" + entry + "' does not exist in the graph");
            }
        }
        for (String exit : graph.exitNodes()) {
            if (graph.node(exit).isEmpty()) {
                errors.add(scope + "Exit node '" + exit + "' does not exist in the graph");
            }
        }
    }

    private void validateSwitchRoutes(WorkflowGraph graph, String scope, List<String> errors, List<String> warnings) {
        for (Map.Entry<String, String> route : graph.switchRoutes().entrySet()) {
            String source = route.getKey();
            if (graph.node(source).isEmpty()) {
                errors.add(scope + "Switch on unknown node '" + source + "'");
                continue;
            }
            checkExpression(route.getValue(), "switch subject of '" + source + "'", scope, errors);

            Set<String> seen = new HashSet<>();
            boolean hasDefault = false;
            for (Edge edge : graph.outgoingEdges(source)) {
                if (edge.isSwitchCase() && !seen.add(edge.switchCase())) {
                    warnings.add(scope + "Switch at [" + source + "] has duplicate case value '" + edge.switchCase() + "'");
                }
                hasDefault |= edge.isUnconditional();
            }
            if (!hasDefault) {
                warnings.add(scope + "Switch at [" + source + "] has no default route; unmatched values will have no route");
            }
        }

        for (Edge edge : graph.edges()) {
            if (edge.isSwitchCase() && !graph.switchRoutes().containsKey(edge.source())) {
                errors.add(scope + "Edge " + edge + " has a case but '" + edge.source() + "' has no switch");
            }
        }
    }

    private void validateReachability(WorkflowGraph graph, String scope, List<String> warnings) {
        List<String> entries = graph.effectiveEntryNodes();
        Set<String> reachable = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>(entries);

        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (reachable.add(id)) {
                graph.outgoingEdges(id).forEach(edge -> stack.push(edge.target()));
            }
        }

        for (String id : graph.nodeIds()) {
            if (!reachable.contains(id)) {
                warnings.add(scope + "Node '" + id + "' is not reachable from the entry nodes and will never run");
            }
        }
    }

    private void validateNode(Node node, WorkflowGraph graph, Set<String> loopVariables, String scope,
                              List<String> errors, List<String> warnings) {
        NodeKind kind = node.kind();

        if (kind instanceof NodeKind.Call call) {
            validateRequiredArguments(node.id(), call, scope, errors);
            for (Map.Entry<String, String> argument : call.arguments().entrySet()) {
                String what = "argument '" + argument.getKey() + "' of node '" + node.id() + "'";
                checkExpression(argument.getValue(), what, scope, errors);
                checkReferences(argument.getValue(), what, graph, loopVariables, scope, warnings);
            }
        } else if (kind instanceof NodeKind.ForEach forEach) {
            String what = "collection of foreach '" + node.id() + "'";
            checkExpression(forEach.collection(), what, scope, errors);
            checkReferences(forEach.collection(), what, graph, loopVariables, scope, warnings);
            if (VariableReferences.isReserved(forEach.itemVar())) {
                errors.add(scope + "Foreach '" + node.id() + "' cannot use reserved name '" + forEach.itemVar() + "' as item");
            }

            Set<String> inner = new HashSet<>(loopVariables);
            inner.add(forEach.itemVar());
            validate(forEach.body(), inner, scope + "[in foreach '" + node.id() + "'] ", errors, warnings);
        } else if (kind instanceof NodeKind.While whileLoop) {
            checkExpression(whileLoop.condition(), "condition of loop '" + node.id() + "'", scope, errors);
            validate(whileLoop.body(), loopVariables, scope + "[in loop '" + node.id() + "'] ", errors, warnings);
        }
    }

    private void validateRequiredArguments(String nodeId, NodeKind.Call call, String scope, List<String> errors) {
        for (String requirement : REQUIRED_ARGUMENTS.getOrDefault(call.target(), List.of())) {
            String[] alternatives = requirement.split("\\|");
            boolean present = false;
            for (String alternative : alternatives) {
                present |= call.arguments().containsKey(alternative);
            }
            if (!present) {
                errors.add(scope + "Node '" + nodeId + "': " + call.target() + "() requires '"
                        + String.join("' or '", alternatives) + "' argument");
            }
        }
    }

    private void checkExpression(String expression, String what, String scope, List<String> errors) {
        String error = evaluator.getValidationError(expression);
        if (error != null) {
            errors.add(scope + "Invalid expression in " + what + ": " + error);
        }
    }

    private void checkReferences(String expression, String what, WorkflowGraph graph, Set<String> loopVariables,
                                 String scope, List<String> warnings) {
        Set<String> known = new HashSet<>(VariableReferences.RESERVED_ROOTS);
        known.addAll(loopVariables);
        for (String id : graph.allNodeIds()) {
            known.add(VariableReferences.rootOf(id));
        }

        for (String path : VariableReferences.references(expression)) {
            String root = VariableReferences.rootOf(path);
            if (!known.contains(root)) {
                warnings.add(scope + "Variable '$" + path + "' in " + what + " has unknown prefix '" + root
                        + "'; it resolves against ctx");
            }
        }
    }
}
