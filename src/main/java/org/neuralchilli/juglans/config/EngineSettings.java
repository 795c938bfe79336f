package org.neuralchilli.juglans.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Tunables of the execution engine.
 *
 * @param workerThreads     size of the node worker pool
 * @param maxLoopIterations upper bound on while-loop iterations
 * @param maxNestingDepth   upper bound on nested sub-workflow executions
 * @param runTimeout        optional wall-clock limit of a top-level run
 * @param bridgeTimeout     how long a client-bridged tool call may stay pending
 * @param maxToolTurns      upper bound on model turns in one agent tool-call loop
 */
public record EngineSettings(
        int workerThreads,
        int maxLoopIterations,
        int maxNestingDepth,
        Duration runTimeout,
        Duration bridgeTimeout,
        int maxToolTurns
) {

    public EngineSettings {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("Worker threads must be at least 1, got: " + workerThreads);
        }
        if (maxLoopIterations < 1) {
            throw new IllegalArgumentException("Max loop iterations must be at least 1, got: " + maxLoopIterations);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Max nesting depth must be at least 1, got: " + maxNestingDepth);
        }
        if (maxToolTurns < 1) {
            throw new IllegalArgumentException("Max tool turns must be at least 1, got: " + maxToolTurns);
        }
        if (bridgeTimeout == null || bridgeTimeout.isNegative() || bridgeTimeout.isZero()) {
            bridgeTimeout = Duration.ofSeconds(120);
        }
        if (runTimeout != null && (runTimeout.isNegative() || runTimeout.isZero())) {
            runTimeout = null;
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(4, 100, 10, null, Duration.ofSeconds(120), 16);
    }

    public Optional<Duration> runTimeoutIfSet() {
        return Optional.ofNullable(runTimeout);
    }

    public EngineSettings withRunTimeout(Duration timeout) {
        return new EngineSettings(workerThreads, maxLoopIterations, maxNestingDepth, timeout, bridgeTimeout, maxToolTurns);
    }

    public EngineSettings withBridgeTimeout(Duration timeout) {
        return new EngineSettings(workerThreads, maxLoopIterations, maxNestingDepth, runTimeout, timeout, maxToolTurns);
    }

    public EngineSettings withMaxLoopIterations(int iterations) {
        return new EngineSettings(workerThreads, iterations, maxNestingDepth, runTimeout, bridgeTimeout, maxToolTurns);
    }
}
