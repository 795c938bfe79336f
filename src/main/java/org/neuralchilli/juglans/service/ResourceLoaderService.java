package org.neuralchilli.juglans.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.config.WorkflowYamlParser;
import org.neuralchilli.juglans.domain.AgentDefinition;
import org.neuralchilli.juglans.domain.PromptTemplate;
import org.neuralchilli.juglans.domain.ResourcePatterns;
import org.neuralchilli.juglans.domain.ToolResource;
import org.neuralchilli.juglans.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Expands a workflow's resource patterns into files and loads them into the prompt, agent and
 * tool registries. A file that fails to load is reported and skipped.
 */
@ApplicationScoped
public class ResourceLoaderService {

    private static final Logger log = LoggerFactory.getLogger(ResourceLoaderService.class);

    private final WorkflowYamlParser parser;
    private final PromptRegistry prompts;
    private final AgentRegistry agents;
    private final ToolRegistry tools;

    @Inject
    public ResourceLoaderService(WorkflowYamlParser parser, PromptRegistry prompts, AgentRegistry agents, ToolRegistry tools) {
        this.parser = parser;
        this.prompts = prompts;
        this.agents = agents;
        this.tools = tools;
    }

    /**
     * Load every resource the patterns name. Modules are not loaded here.
     */
    public List<LoadResult> load(ResourcePatterns patterns) {
        List<LoadResult> results = new ArrayList<>();

        results.addAll(loadAll("prompt", patterns.prompts(), path -> {
            PromptTemplate prompt = parser.parsePrompt(read(path), path);
            prompts.register(prompt);
            return prompt.slug();
        }));
        results.addAll(loadAll("agent", patterns.agents(), path -> {
            AgentDefinition agent = parser.parseAgent(read(path), path);
            agents.register(agent);
            return agent.slug();
        }));
        results.addAll(loadAll("tools", patterns.tools(), path -> {
            ToolResource bundle = parser.parseToolResource(read(path), path);
            tools.register(bundle);
            return bundle.slug();
        }));

        if (!patterns.modules().isEmpty()) {
            log.debug("Ignoring module patterns {}", patterns.modules());
        }

        logResults(results);
        return results;
    }

    /**
     * Files matching a glob, in a stable order. A pattern without glob characters names one file.
     */
    public List<Path> expand(String pattern) {
        Path base = baseDirectory(pattern);
        if (base.toString().equals(pattern)) {
            return Files.isRegularFile(base) ? List.of(base) : List.of();
        }
        if (!Files.isDirectory(base)) {
            log.warn("Resource directory does not exist: {}", base);
            return List.of();
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> paths = Files.walk(base)) {
            return paths.filter(Files::isRegularFile)
                    .filter(matcher::matches)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Error scanning resource directory: {}", base, e);
            return List.of();
        }
    }

    private List<LoadResult> loadAll(String kind, List<String> patterns, Function<Path, String> loader) {
        Set<Path> files = new LinkedHashSet<>();
        for (String pattern : patterns) {
            List<Path> matched = expand(pattern);
            if (matched.isEmpty()) {
                log.warn("No {} files match '{}'", kind, pattern);
            }
            files.addAll(matched);
        }

        List<LoadResult> results = new ArrayList<>();
        for (Path file : files) {
            try {
                String slug = loader.apply(file);
                log.info("✓ Loaded {}: {}", kind, slug);
                results.add(LoadResult.success(kind, slug));
            } catch (RuntimeException e) {
                log.warn("✗ Failed to load {} from {}: {}", kind, file, e.getMessage());
                results.add(LoadResult.failure(kind, file.getFileName().toString(), e));
            }
        }
        return results;
    }

    private static Path baseDirectory(String pattern) {
        Path path = Path.of(pattern.replace("\\", "/"));
        Path base = path.getRoot();
        for (Path part : path) {
            if (isGlob(part.toString())) {
                break;
            }
            base = base == null ? part : base.resolve(part);
        }
        return base != null ? base : Path.of(".");
    }

    private static boolean isGlob(String segment) {
        return segment.contains("*") || segment.contains("?") || segment.contains("[") || segment.contains("{");
    }

    private static String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new ParseException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} resources: {} successful, {} failed", results.size(), successful, failed);
            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  ✗ {} {}: {}", r.kind(), r.name(), r.error().orElse("unknown error")));
        } else if (!results.isEmpty()) {
            log.info("Loaded {} resources: all successful", results.size());
        }
    }
}
