package org.neuralchilli.juglans.worker;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.config.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fixed pool of worker threads that node actions run on, plus a single scheduler thread
 * for timers and deadlines.
 */
@ApplicationScoped
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int workerThreads;
    private final ExecutorService executorService;
    private final ScheduledExecutorService scheduler;
    private final AtomicInteger activeTasks = new AtomicInteger(0);
    private volatile boolean running = true;

    /**
     * Required for CDI client proxies; not used at runtime
     */
    protected WorkerPool() {
        this.workerThreads = 0;
        this.executorService = null;
        this.scheduler = null;
    }

    @Inject
    public WorkerPool(EngineSettings settings) {
        this.workerThreads = settings.workerThreads();
        this.executorService = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory("juglans-worker"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new WorkerThreadFactory("juglans-scheduler"));
        log.info("Worker pool started: {} threads", workerThreads);
    }

    /**
     * Run a blocking action on a worker thread
     */
    public <T> CompletableFuture<T> submit(Supplier<T> action) {
        return CompletableFuture.supplyAsync(() -> {
            activeTasks.incrementAndGet();
            try {
                return action.get();
            } finally {
                activeTasks.decrementAndGet();
            }
        }, executorService);
    }

    /**
     * Start an asynchronous action from a worker thread
     */
    public <T> CompletableFuture<T> compose(Supplier<CompletableFuture<T>> action) {
        return submit(action).thenCompose(future -> future);
    }

    public ExecutorService executor() {
        return executorService;
    }

    /**
     * Complete a future with null after a delay, without holding a worker thread
     */
    public CompletableFuture<Void> delay(long millis) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        ScheduledFuture<?> scheduled = scheduler.schedule(() -> future.complete(null), millis, TimeUnit.MILLISECONDS);
        future.whenComplete((ignored, error) -> scheduled.cancel(false));
        return future;
    }

    /**
     * Run {@code task} once after {@code millis}; the returned handle cancels it
     */
    public ScheduledFuture<?> schedule(Runnable task, long millis) {
        return scheduler.schedule(task, millis, TimeUnit.MILLISECONDS);
    }

    public WorkerPoolStats getStats() {
        return new WorkerPoolStats(workerThreads, activeTasks.get(), running);
    }

    @PreDestroy
    @Override
    public void close() {
        if (!running || executorService == null) {
            return;
        }
        running = false;

        log.info("Stopping worker pool");
        scheduler.shutdownNow();
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 10 seconds, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Worker pool stopped");
    }

    /**
     * Thread factory for creating named daemon threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String prefix;

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Worker pool statistics.
     */
    public record WorkerPoolStats(int totalThreads, int activeTasks, boolean running) {

        public double utilization() {
            return totalThreads > 0 ? (double) Math.min(activeTasks, totalThreads) / totalThreads : 0.0;
        }
    }
}
