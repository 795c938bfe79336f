package org.neuralchilli.juglans.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AgentDefinitionTest {

    @Test
    void shouldDefaultReturnsToReplyOutput() {
        AgentDefinition agent = AgentDefinition.builder("support").model("gpt-4o").build();

        assertThat(agent.returns()).containsExactly("reply.output");
        assertThat(agent.workflowPath()).isEmpty();
        assertThat(agent.hasDefaultTools()).isFalse();
    }

    @Test
    void shouldValidateSlug() {
        assertThatThrownBy(() -> AgentDefinition.builder("bad slug").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must match pattern");
        assertThatThrownBy(() -> AgentDefinition.builder(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be null or empty");
    }

    @Test
    void shouldValidateTemperatureRange() {
        assertThatThrownBy(() -> AgentDefinition.builder("hot").temperature(2.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 0 and 2");

        assertThat(AgentDefinition.builder("warm").temperature(2.0).build().temperature()).isEqualTo(2.0);
    }

    @Test
    void shouldResolveWorkflowAgainstAgentFile() {
        AgentDefinition agent = AgentDefinition.builder("planner")
                .workflow("../planner-flow.yaml")
                .returns(List.of("reply.output", "ctx.plan"))
                .source(Path.of("workflows/agents/planner.yaml"))
                .build();

        assertThat(agent.resolvedWorkflow()).contains(Path.of("workflows/planner-flow.yaml"));
        assertThat(agent.returns()).containsExactly("reply.output", "ctx.plan");
    }

    @Test
    void shouldKeepWorkflowPathWithoutSource() {
        AgentDefinition agent = AgentDefinition.builder("planner").workflow("flows/plan.yaml").build();

        assertThat(agent.resolvedWorkflow()).contains(Path.of("flows/plan.yaml"));
    }
}
