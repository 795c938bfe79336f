package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.AgentDefinition;
import org.neuralchilli.juglans.domain.ToolDefinition;
import org.neuralchilli.juglans.domain.ToolResource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ToolResolverTest {

    private ToolRegistry registry;
    private ToolResolver resolver;

    @BeforeEach
    void setup() {
        registry = new ToolRegistry();
        registry.register(new ToolResource("support-tools", "Support", null, List.of(
                new ToolDefinition("lookup_order", "Find an order", null),
                new ToolDefinition("refund", "Refund an order", null))));
        registry.register(new ToolResource("billing", null, null, List.of(
                new ToolDefinition("refund", "Refund through billing", null),
                new ToolDefinition("invoice", "Send an invoice", null))));
        resolver = new ToolResolver(registry);
    }

    private static List<String> names(List<ToolDefinition> tools) {
        return tools.stream().map(ToolDefinition::name).toList();
    }

    @Test
    void shouldResolveSlugReference() {
        List<ToolDefinition> tools = resolver.resolveSpec(TextNode.valueOf("@support-tools"));

        assertThat(names(tools)).containsExactly("lookup_order", "refund");
    }

    @Test
    void shouldMergeBundlesLaterWinning() {
        // Given: Two bundles that both define "refund"
        JsonNode spec = Values.parseLenient("[\"support-tools\", \"@billing\"]");

        // When
        List<ToolDefinition> tools = resolver.resolveSpec(spec);

        // Then: First-seen order, the later definition replaces the earlier one
        assertThat(names(tools)).containsExactly("lookup_order", "refund", "invoice");
        assertThat(tools.get(1).description()).isEqualTo("Refund through billing");
    }

    @Test
    void shouldAcceptCommaSeparatedSlugs() {
        List<ToolDefinition> tools = resolver.resolveSpec(TextNode.valueOf("support-tools, billing"));

        assertThat(names(tools)).containsExactly("lookup_order", "refund", "invoice");
    }

    @Test
    void shouldAcceptInlineDefinitions() {
        JsonNode spec = Values.parseLenient("""
                [{"type": "function", "function": {"name": "weather"}}, {"name": "time"}]
                """);

        assertThat(names(resolver.resolveSpec(spec))).containsExactly("weather", "time");
    }

    @Test
    void shouldParseJsonText() {
        List<ToolDefinition> tools = resolver.resolveSpec(TextNode.valueOf("{\"name\": \"weather\"}"));

        assertThat(names(tools)).containsExactly("weather");
    }

    @Test
    void shouldPreferCallToolsOverAgentDefaults() {
        AgentDefinition agent = AgentDefinition.builder("support").tools(TextNode.valueOf("@support-tools")).build();

        assertThat(names(resolver.resolveTools(TextNode.valueOf("@billing"), agent)))
                .containsExactly("refund", "invoice");
        assertThat(names(resolver.resolveTools(null, agent)))
                .containsExactly("lookup_order", "refund");
        assertThat(resolver.resolveTools(null, AgentDefinition.builder("plain").build())).isEmpty();
        assertThat(resolver.resolveTools(null, null)).isEmpty();
    }

    @Test
    void shouldFailOnUnknownSlug() {
        assertThatThrownBy(() -> resolver.resolveSpec(TextNode.valueOf("@nope")))
                .isInstanceOf(ToolResolutionException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void shouldFailOnInvalidSpecs() {
        assertThatThrownBy(() -> resolver.resolveSpec(TextNode.valueOf("[not json")))
                .isInstanceOf(ToolResolutionException.class)
                .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> resolver.resolveSpec(Values.parseLenient("[{\"description\": \"x\"}]")))
                .isInstanceOf(ToolResolutionException.class)
                .hasMessageContaining("Invalid inline tool definition");
        assertThatThrownBy(() -> resolver.resolveSpec(Values.fromJava(42)))
                .isInstanceOf(ToolResolutionException.class)
                .hasMessageContaining("Unsupported tools specification");
    }
}
