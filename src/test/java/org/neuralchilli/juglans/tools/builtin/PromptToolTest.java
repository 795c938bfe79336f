package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.juglans.config.WorkflowYamlParser;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.MissingArgumentException;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.PromptTemplate;
import org.neuralchilli.juglans.domain.WorkflowException;
import org.neuralchilli.juglans.service.PromptRegistry;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResolutionException;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PromptToolTest {

    private PromptRegistry prompts;
    private PromptTool tool;
    private ExecutionContext context;

    @BeforeEach
    void setup() {
        prompts = new PromptRegistry();
        prompts.register(new PromptTemplate("greeting", "Greeting",
                "Hello {{ name }}, in a {{tone}} voice. Ticket {{ticket}}.",
                Map.of("tone", TextNode.valueOf("warm"), "name", TextNode.valueOf("friend")), null));
        tool = new PromptTool(prompts, new WorkflowYamlParser());
        context = ExecutionContext.of(Values.object());
    }

    private String render(Map<String, JsonNode> arguments) {
        return tool.execute(new ToolInvocation("p", arguments, context, "prompt", null)).join().value().asText();
    }

    @Test
    void shouldPreferArgumentsThenContextThenDefaults() {
        // Given: tone only in ctx, name passed by the call, ticket nowhere
        context.setCtx("tone", TextNode.valueOf("calm"));

        // When
        String rendered = render(Map.of("slug", TextNode.valueOf("greeting"), "name", TextNode.valueOf("Ada")));

        // Then: Unresolved placeholders stay as written
        assertThat(rendered).isEqualTo("Hello Ada, in a calm voice. Ticket {{ticket}}.");
    }

    @Test
    void shouldFallBackToDefaults() {
        String rendered = render(Map.of("slug", TextNode.valueOf("greeting"), "ticket", Values.fromJava(42)));

        assertThat(rendered).isEqualTo("Hello friend, in a warm voice. Ticket 42.");
    }

    @Test
    void shouldLoadPromptFromFile() {
        String rendered = render(Map.of(
                "file", TextNode.valueOf("src/test/resources/workflows/prompts/greeting.prompt"),
                "name", TextNode.valueOf("Grace")));

        assertThat(rendered).startsWith("Hello Grace, in a warm voice.");
    }

    @Test
    void shouldRejectUnknownPrompt() {
        assertThatThrownBy(() -> render(Map.of("slug", TextNode.valueOf("missing"))))
                .isInstanceOf(WorkflowException.class)
                .hasMessageContaining("Prompt 'missing' not found");
        assertThatThrownBy(() -> render(Map.of("file", TextNode.valueOf("nowhere/x.prompt"))))
                .isInstanceOf(ToolResolutionException.class)
                .hasMessageContaining("Prompt file not found");
    }

    @Test
    void shouldRequireSlugOrFile() {
        assertThatThrownBy(() -> render(Map.of()))
                .isInstanceOf(MissingArgumentException.class)
                .hasMessageContaining("requires argument 'slug'");
    }
}
