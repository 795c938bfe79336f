package org.neuralchilli.juglans.config;

import io.quarkus.arc.profile.IfBuildProfile;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.juglans.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches the workflows directory and drops compiled workflows when a workflow,
 * prompt, agent or tool file changes. Only active in dev mode.
 *
 * Any change invalidates every compiled workflow: a file may be imported or loaded
 * as a resource by workflows elsewhere in the tree.
 */
@ApplicationScoped
@IfBuildProfile("dev")
public class WorkflowWatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkflowWatcher.class);

    static final List<String> WATCHED_EXTENSIONS = List.of(".yaml", ".yml", ".json", ".md", ".txt", ".prompt");

    @Inject
    WorkflowService workflowService;

    @ConfigProperty(name = "juglans.workflows.path", defaultValue = "workflows")
    String workflowsPath;

    @ConfigProperty(name = "juglans.workflows.watch", defaultValue = "true")
    boolean watchEnabled;

    private WatchService watchService;
    private ExecutorService executor;
    private volatile boolean running = false;

    void onStart(@Observes StartupEvent event) {
        if (!watchEnabled) {
            log.info("Workflow watching is disabled");
            return;
        }

        try {
            startWatching();
        } catch (IOException e) {
            log.error("Failed to start workflow watcher", e);
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stopWatching();
    }

    private void startWatching() throws IOException {
        Path root = Path.of(workflowsPath);
        if (!Files.isDirectory(root)) {
            log.warn("Workflows directory does not exist: {}", root);
            return;
        }

        watchService = FileSystems.getDefault().newWatchService();
        try (Stream<Path> dirs = Files.walk(root)) {
            for (Path dir : dirs.filter(Files::isDirectory).toList()) {
                dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
            }
        }
        log.info("Watching workflows directory: {}", root);

        running = true;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "workflow-watcher");
            t.setDaemon(true);
            return t;
        });
        executor.submit(this::watchLoop);
    }

    private void watchLoop() {
        log.debug("Watch loop started");

        while (running) {
            try {
                WatchKey key = watchService.poll(1, TimeUnit.SECONDS);
                if (key == null) {
                    continue;
                }

                boolean relevant = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == OVERFLOW) {
                        log.warn("Watch event overflow - some changes may have been missed");
                        relevant = true;
                        continue;
                    }

                    @SuppressWarnings("unchecked")
                    WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                    Path changed = ((Path) key.watchable()).resolve(pathEvent.context());
                    if (event.kind() == ENTRY_CREATE && Files.isDirectory(changed)) {
                        changed.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                        continue;
                    }
                    if (isWatched(changed)) {
                        log.info("File {} detected: {}", event.kind().name(), changed);
                        relevant = true;
                    }
                }

                if (relevant) {
                    workflowService.invalidateAll();
                }

                if (!key.reset()) {
                    log.debug("Watch key for {} no longer valid", key.watchable());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Workflow watcher interrupted");
                break;
            } catch (IOException | RuntimeException e) {
                log.error("Error in watch loop", e);
            }
        }

        log.debug("Watch loop stopped");
    }

    static boolean isWatched(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return WATCHED_EXTENSIONS.stream().anyMatch(fileName::endsWith);
    }

    private void stopWatching() {
        if (watchService == null) {
            return;
        }

        log.info("Stopping workflow watcher");
        running = false;

        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        try {
            watchService.close();
        } catch (IOException e) {
            log.error("Error closing watch service", e);
        }
    }
}
