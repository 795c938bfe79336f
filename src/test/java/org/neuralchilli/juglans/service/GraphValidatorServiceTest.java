package org.neuralchilli.juglans.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.juglans.config.WorkflowYamlParser;
import org.neuralchilli.juglans.domain.WorkflowGraph;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class GraphValidatorServiceTest {

    @Inject
    GraphValidatorService validator;

    @Inject
    WorkflowYamlParser parser;

    @Test
    void shouldAcceptValidGraph() {
        // Given: A small valid workflow
        WorkflowGraph graph = parse("""
                slug: valid
                nodes:
                  ask: { call: chat, args: { message: $input.question } }
                  wait: { call: timer, args: { seconds: 1 } }
                edges:
                  - ask -> wait
                """);

        // When: Validating
        ValidationReport report = validator.validateGraph(graph);

        // Then: No errors, no warnings
        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    void shouldRejectEdgeToUnknownNode() {
        // Given: An edge to a missing node
        WorkflowGraph graph = parse("""
                slug: dangling
                nodes:
                  a: { literal: 1 }
                edges:
                  - a -> ghost
                """);

        // When/Then: Validation fails naming the node
        assertThatThrownBy(() -> validator.validateGraph(graph))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unknown node 'ghost'");
    }

    @Test
    void shouldRejectUnknownEntryAndExit() {
        // Given: Entry and exit ids that do not exist
        WorkflowGraph graph = parse("""
                slug: bad-ends
                entry: [begin]
                exit: [finish]
                nodes:
                  a: { literal: 1 }
                """);

        // When: Collecting problems
        ValidationReport report = validator.validate(graph);

        // Then: Both are reported
        assertThat(report.errors())
                .anyMatch(error -> error.contains("Entry node 'begin'"))
                .anyMatch(error -> error.contains("Exit node 'finish'"));
    }

    @Test
    void shouldRejectCycle() {
        // Given: a -> b -> a
        WorkflowGraph graph = parse("""
                slug: cycle
                nodes:
                  a: { literal: 1 }
                  b: { literal: 2 }
                edges:
                  - a -> b -> a
                """);

        // When/Then
        assertThatThrownBy(() -> validator.validateGraph(graph))
                .isInstanceOf(CycleDetectedException.class);
    }

    @Test
    void shouldRequireBuiltinArguments() {
        // Given: chat without message and timer without a duration
        WorkflowGraph graph = parse("""
                slug: missing-args
                nodes:
                  ask: { call: chat, args: { agent: support } }
                  wait: { call: timer }
                edges:
                  - ask -> wait
                """);

        // When: Collecting problems
        ValidationReport report = validator.validate(graph);

        // Then
        assertThat(report.errors())
                .anyMatch(error -> error.contains("chat() requires 'message'"))
                .anyMatch(error -> error.contains("timer() requires 'ms' or 'seconds'"));
    }

    @Test
    void shouldRejectMalformedCondition() {
        // Given: A condition that does not parse
        WorkflowGraph graph = parse("""
                slug: bad-condition
                nodes:
                  a: { literal: 1 }
                  b: { literal: 2 }
                edges:
                  - { from: a, to: b, when: '$ctx.x == == 1' }
                """);

        // When: Collecting problems
        ValidationReport report = validator.validate(graph);

        // Then
        assertThat(report.errors()).anyMatch(error -> error.contains("Invalid expression in condition"));
    }

    @Test
    void shouldWarnAboutUnreachableNodes() {
        // Given: An explicit entry and an orphan node
        WorkflowGraph graph = parse("""
                slug: orphan
                entry: [start]
                nodes:
                  start: { literal: 1 }
                  orphan: { literal: 2 }
                """);

        // When: Validating
        ValidationReport report = validator.validateGraph(graph);

        // Then: It is valid but warns
        assertThat(report.warnings()).anyMatch(warning -> warning.contains("'orphan' is not reachable"));
    }

    @Test
    void shouldCheckSwitchRoutes() {
        // Given: A switch without default and with a duplicate case, and a case edge without switch
        WorkflowGraph graph = parse("""
                slug: switches
                nodes:
                  classify: { literal: refund }
                  refund: { literal: 1 }
                  refund_again: { literal: 2 }
                  other: { literal: 3 }
                  after: { literal: 4 }
                switch:
                  classify: $classify.output
                edges:
                  - { from: classify, to: refund, case: refund }
                  - { from: classify, to: refund_again, case: refund }
                  - { from: other, to: after, case: x }
                """);

        // When: Collecting problems
        ValidationReport report = validator.validate(graph);

        // Then
        assertThat(report.warnings())
                .anyMatch(warning -> warning.contains("duplicate case value 'refund'"))
                .anyMatch(warning -> warning.contains("has no default route"));
        assertThat(report.errors()).anyMatch(error -> error.contains("'other' has no switch"));
    }

    @Test
    void shouldWarnAboutUnknownReferencePrefix() {
        // Given: An argument referencing neither a node nor a reserved root
        WorkflowGraph graph = parse("""
                slug: prefixes
                nodes:
                  a: { call: notify, args: { message: $mystery.value } }
                """);

        // When: Validating
        ValidationReport report = validator.validateGraph(graph);

        // Then: It resolves against ctx, with a warning
        assertThat(report.warnings()).anyMatch(warning -> warning.contains("unknown prefix 'mystery'"));
    }

    @Test
    void shouldValidateLoopBodies() {
        // Given: A foreach using a reserved name and a body that references its item
        WorkflowGraph graph = parse("""
                slug: loops
                nodes:
                  each:
                    foreach:
                      item: ctx
                      in: '[1, 2]'
                      body:
                        nodes:
                          ask: { call: chat }
                """);

        // When: Collecting problems
        ValidationReport report = validator.validate(graph);

        // Then: Both the item name and the body node are reported, scoped to the loop
        assertThat(report.errors())
                .anyMatch(error -> error.contains("cannot use reserved name 'ctx'"))
                .anyMatch(error -> error.startsWith("[in foreach 'each'] ") && error.contains("requires 'message'"));
    }

    @Test
    void shouldAcceptLoopVariablesInBody() {
        // Given: A body using its item variable
        WorkflowGraph graph = parse("""
                slug: loop-vars
                nodes:
                  each:
                    foreach:
                      item: doc
                      in: '[1, 2]'
                      body:
                        nodes:
                          say: { call: notify, args: { message: $doc.title } }
                """);

        // When: Validating
        ValidationReport report = validator.validateGraph(graph);

        // Then: No warning about the loop variable
        assertThat(report.warnings()).noneMatch(warning -> warning.contains("'doc'"));
    }

    @Test
    void shouldWarnAboutConditionOnErrorEdge() {
        // Given: An error edge with a condition
        WorkflowGraph graph = parse("""
                slug: error-condition
                nodes:
                  risky: { literal: 1 }
                  handler: { literal: 2 }
                edges:
                  - { from: risky, to: handler, on_error: true, when: '$ctx.retry == true' }
                """);

        // When: Validating
        ValidationReport report = validator.validateGraph(graph);

        // Then
        assertThat(report.warnings()).anyMatch(warning -> warning.contains("is ignored"));
    }

    private WorkflowGraph parse(String yaml) {
        return parser.parseWorkflow(yaml, "test.yaml");
    }
}
