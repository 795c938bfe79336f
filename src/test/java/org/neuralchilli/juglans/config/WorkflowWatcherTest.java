package org.neuralchilli.juglans.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.juglans.service.WorkflowService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.*;

/**
 * Tests for WorkflowWatcher against a real temporary directory.
 * File watching is timing dependent, so changes are awaited rather than asserted at once.
 */
class WorkflowWatcherTest {

    private Path tempDir;
    private WorkflowWatcher watcher;
    private WorkflowService workflowService;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("juglans-watch-");
        Files.createDirectories(tempDir.resolve("flows"));

        workflowService = mock(WorkflowService.class);
        watcher = new WorkflowWatcher();
        watcher.workflowService = workflowService;
        watcher.workflowsPath = tempDir.toString();
        watcher.watchEnabled = true;
    }

    @AfterEach
    void teardown() throws IOException {
        watcher.onStop(null);
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        }
    }

    @Test
    void shouldRecognizeWatchedFiles() {
        assertThat(WorkflowWatcher.isWatched(Path.of("main.yaml"))).isTrue();
        assertThat(WorkflowWatcher.isWatched(Path.of("agents/support.YML"))).isTrue();
        assertThat(WorkflowWatcher.isWatched(Path.of("prompts/greeting.prompt"))).isTrue();
        assertThat(WorkflowWatcher.isWatched(Path.of("tools/support.json"))).isTrue();

        assertThat(WorkflowWatcher.isWatched(Path.of("notes.bak"))).isFalse();
        assertThat(WorkflowWatcher.isWatched(Path.of(".main.yaml.swp"))).isFalse();
    }

    @Test
    void shouldInvalidateWhenWorkflowChanges() throws IOException {
        // Given: A running watcher
        watcher.onStart(null);

        // When: A workflow file is created in a subdirectory
        Files.writeString(tempDir.resolve("flows/order.yaml"), "nodes:\n  a: echo\n");

        // Then: Every compiled workflow is dropped
        await().atMost(10, TimeUnit.SECONDS)
                .untilAsserted(() -> verify(workflowService, atLeastOnce()).invalidateAll());
    }

    @Test
    void shouldIgnoreUnrelatedFiles() throws Exception {
        watcher.onStart(null);

        Files.writeString(tempDir.resolve("scratch.bak"), "ignored");
        Thread.sleep(1500);

        verify(workflowService, never()).invalidateAll();
    }

    @Test
    void shouldDoNothingWhenDisabled() throws IOException {
        watcher.watchEnabled = false;
        watcher.onStart(null);

        Files.writeString(tempDir.resolve("main.yaml"), "nodes:\n  a: echo\n");

        verifyNoInteractions(workflowService);
    }

    @Test
    void shouldSurviveMissingDirectory() {
        watcher.workflowsPath = tempDir.resolve("does-not-exist").toString();

        watcher.onStart(null);
        watcher.onStop(null);

        verifyNoInteractions(workflowService);
    }
}
