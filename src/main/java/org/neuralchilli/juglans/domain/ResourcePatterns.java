package org.neuralchilli.juglans.domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Glob patterns of resources a workflow imports: prompts, agents, tool bundles and modules.
 */
public record ResourcePatterns(List<String> prompts, List<String> agents, List<String> tools, List<String> modules) {

    private static final ResourcePatterns EMPTY = new ResourcePatterns(List.of(), List.of(), List.of(), List.of());

    public ResourcePatterns {
        prompts = prompts != null ? List.copyOf(prompts) : List.of();
        agents = agents != null ? List.copyOf(agents) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
        modules = modules != null ? List.copyOf(modules) : List.of();
    }

    public static ResourcePatterns empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return prompts.isEmpty() && agents.isEmpty() && tools.isEmpty() && modules.isEmpty();
    }

    /**
     * Union with another set of patterns, keeping first-seen order and dropping duplicates
     */
    public ResourcePatterns union(ResourcePatterns other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        return new ResourcePatterns(
                merge(prompts, other.prompts),
                merge(agents, other.agents),
                merge(tools, other.tools),
                merge(modules, other.modules)
        );
    }

    /**
     * Resolve relative patterns against the directory of the file that declared them
     */
    public ResourcePatterns resolvedAgainst(Path baseDir) {
        if (baseDir == null) {
            return this;
        }
        UnaryOperator<String> resolve = pattern -> {
            if (Path.of(pattern).isAbsolute()) {
                return pattern;
            }
            return baseDir.resolve(pattern).normalize().toString();
        };
        return map(resolve);
    }

    private ResourcePatterns map(UnaryOperator<String> fn) {
        return new ResourcePatterns(
                prompts.stream().map(fn).toList(),
                agents.stream().map(fn).toList(),
                tools.stream().map(fn).toList(),
                modules.stream().map(fn).toList()
        );
    }

    private static List<String> merge(List<String> first, List<String> second) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }
}
