package org.neuralchilli.juglans.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.juglans.config.EngineSettings;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.NestedWorkflowRunner;
import org.neuralchilli.juglans.core.RunHandle;
import org.neuralchilli.juglans.core.WorkflowExecutor;
import org.neuralchilli.juglans.domain.GraphStatistics;
import org.neuralchilli.juglans.domain.RunResult;
import org.neuralchilli.juglans.domain.WorkflowGraph;
import org.neuralchilli.juglans.tools.ClientBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point: compiles workflow files (merge, validate, load resources) and runs them.
 *
 * Compiled workflows are cached by canonical path until {@link #invalidate} is called.
 * Also runs agent-associated workflows as nested sub-runs.
 */
@ApplicationScoped
public class WorkflowService implements NestedWorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml");

    private final FlowImportResolver resolver;
    private final GraphValidatorService validator;
    private final JGraphTService graphService;
    private final ResourceLoaderService resources;
    private final WorkflowExecutor executor;
    private final ClientBridge bridge;
    private final EngineSettings settings;
    private final Path workflowsDir;

    private final Map<Path, CompiledWorkflow> compiled = new ConcurrentHashMap<>();

    protected WorkflowService() {
        this.resolver = null;
        this.validator = null;
        this.graphService = null;
        this.resources = null;
        this.executor = null;
        this.bridge = null;
        this.settings = null;
        this.workflowsDir = null;
    }

    @Inject
    public WorkflowService(FlowImportResolver resolver, GraphValidatorService validator, JGraphTService graphService,
                           ResourceLoaderService resources, WorkflowExecutor executor, ClientBridge bridge,
                           EngineSettings settings,
                           @ConfigProperty(name = "juglans.workflows.path", defaultValue = "workflows") String workflowsPath) {
        this.resolver = resolver;
        this.validator = validator;
        this.graphService = graphService;
        this.resources = resources;
        this.executor = executor;
        this.bridge = bridge;
        this.settings = settings;
        this.workflowsDir = Path.of(workflowsPath);
    }

    /**
     * Compile a workflow file, or return the cached result
     *
     * @throws ParseException           if a file cannot be read or parsed
     * @throws CircularImportException  if flow imports form a cycle
     * @throws CycleDetectedException   if the merged graph has a cycle
     * @throws ValidationException      if the merged graph is invalid
     */
    public CompiledWorkflow compile(Path file) {
        Path key = canonical(file);
        CompiledWorkflow cached = compiled.get(key);
        if (cached != null) {
            return cached;
        }

        log.info("Compiling workflow {}", key);
        WorkflowGraph graph = resolver.merge(key);
        ValidationReport report = validator.validateGraph(graph);
        GraphStatistics statistics = graphService.getStatistics(graphService.buildDag(graph));
        List<LoadResult> loaded = resources.load(graph.resources());

        CompiledWorkflow workflow = new CompiledWorkflow(key, graph, statistics, report.warnings(), loaded);
        compiled.put(key, workflow);
        log.info("✓ Compiled workflow '{}': {}", graph.slug(), statistics);
        return workflow;
    }

    /**
     * Compile and start a top-level run
     */
    public RunHandle start(Path file, RunOptions options) {
        CompiledWorkflow workflow = compile(file);

        ExecutionContext context = ExecutionContext.builder()
                .runId(options.runId())
                .input(options.input())
                .events(options.events())
                .clientBridge(options.connectClient() ? bridge : null)
                .nestedRunner(this)
                .maxNestingDepth(settings.maxNestingDepth())
                .build();

        return executor.start(workflow.graph(), context);
    }

    public CompletableFuture<RunResult> run(Path file, RunOptions options) {
        return start(file, options).result();
    }

    /**
     * Start a workflow by name, looked up in the workflows directory
     */
    public RunHandle start(String name, RunOptions options) {
        return start(resolve(name).orElseThrow(() -> new ParseException(
                "Workflow '" + name + "' not found in " + workflowsDir.toAbsolutePath())), options);
    }

    @Override
    public CompletableFuture<RunResult> runNested(Path workflow, ExecutionContext context) {
        CompiledWorkflow nested = compile(workflow);
        log.debug("Running nested workflow '{}' in run {}", nested.graph().slug(), context.runId());
        return executor.runGraph(nested.graph(), context);
    }

    /**
     * Find a workflow file: the name as a path, then below the workflows directory,
     * each time also with a YAML extension
     */
    public Optional<Path> resolve(String name) {
        for (Path base : List.of(Path.of(name), workflowsDir.resolve(name))) {
            if (Files.isRegularFile(base)) {
                return Optional.of(base);
            }
            for (String extension : EXTENSIONS) {
                Path candidate = base.resolveSibling(base.getFileName() + extension);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Drop the compiled form of a file; the next run compiles it again
     */
    public void invalidate(Path file) {
        if (compiled.remove(tryCanonical(file)) != null) {
            log.info("Invalidated compiled workflow {}", file);
        }
    }

    /**
     * Drop every compiled workflow, e.g. after an imported file or resource changed
     */
    public void invalidateAll() {
        int count = compiled.size();
        compiled.clear();
        log.info("Invalidated {} compiled workflows", count);
    }

    public Optional<CompiledWorkflow> cached(Path file) {
        return Optional.ofNullable(compiled.get(tryCanonical(file)));
    }

    public Path workflowsDirectory() {
        return workflowsDir;
    }

    private static Path canonical(Path file) {
        try {
            return file.toRealPath();
        } catch (IOException e) {
            throw new ParseException("Cannot read workflow file " + file + ": " + e.getMessage(), e);
        }
    }

    private static Path tryCanonical(Path file) {
        try {
            return file.toRealPath();
        } catch (IOException e) {
            return file.toAbsolutePath().normalize();
        }
    }
}
