package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * An agent: model settings, system prompt, default tools and an optional associated workflow.
 *
 * @param tools    default tools spec, either {@code "@slug"}, a list of slugs or inline definitions
 * @param workflow path of a workflow to run instead of a plain chat, relative to {@code source}
 * @param returns  fields of the nested run copied back into the caller's context
 * @param source   file the agent was loaded from
 */
public record AgentDefinition(
        String slug,
        String model,
        String systemPrompt,
        String systemPromptSlug,
        Double temperature,
        JsonNode tools,
        String workflow,
        Integer workflowTimeoutSeconds,
        List<String> returns,
        Path source
) {

    public static final List<String> DEFAULT_RETURNS = List.of("reply.output");

    public AgentDefinition {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Agent slug cannot be null or empty");
        }
        if (!slug.matches("^[a-zA-Z0-9_-]+$")) {
            throw new IllegalArgumentException(
                    "Agent slug must match pattern ^[a-zA-Z0-9_-]+$, got: " + slug);
        }
        if (temperature != null && (temperature < 0 || temperature > 2)) {
            throw new IllegalArgumentException("Agent temperature must be between 0 and 2, got: " + temperature);
        }
        returns = returns != null && !returns.isEmpty() ? List.copyOf(returns) : DEFAULT_RETURNS;
    }

    public Optional<String> workflowPath() {
        return Optional.ofNullable(workflow).filter(w -> !w.isBlank());
    }

    /**
     * Resolve the associated workflow against the agent's own directory
     */
    public Optional<Path> resolvedWorkflow() {
        return workflowPath().map(w -> {
            Path path = Path.of(w);
            if (path.isAbsolute() || source == null || source.getParent() == null) {
                return path;
            }
            return source.getParent().resolve(path).normalize();
        });
    }

    public boolean hasDefaultTools() {
        return tools != null && !tools.isNull() && !tools.isMissingNode();
    }

    /**
     * Builder for creating agents fluently
     */
    public static Builder builder(String slug) {
        return new Builder(slug);
    }

    public static class Builder {
        private final String slug;
        private String model;
        private String systemPrompt;
        private String systemPromptSlug;
        private Double temperature;
        private JsonNode tools;
        private String workflow;
        private Integer workflowTimeoutSeconds;
        private List<String> returns;
        private Path source;

        public Builder(String slug) {
            this.slug = slug;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder systemPromptSlug(String systemPromptSlug) {
            this.systemPromptSlug = systemPromptSlug;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder tools(JsonNode tools) {
            this.tools = tools;
            return this;
        }

        public Builder workflow(String workflow) {
            this.workflow = workflow;
            return this;
        }

        public Builder workflowTimeoutSeconds(Integer workflowTimeoutSeconds) {
            this.workflowTimeoutSeconds = workflowTimeoutSeconds;
            return this;
        }

        public Builder returns(List<String> returns) {
            this.returns = returns;
            return this;
        }

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public AgentDefinition build() {
            return new AgentDefinition(slug, model, systemPrompt, systemPromptSlug, temperature,
                    tools, workflow, workflowTimeoutSeconds, returns, source);
        }
    }
}
