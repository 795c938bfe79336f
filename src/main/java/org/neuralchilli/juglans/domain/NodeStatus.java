package org.neuralchilli.juglans.domain;

/**
 * Lifecycle status of a node within one run.
 */
public enum NodeStatus {
    /**
     * Waiting for an incoming edge to be satisfied
     */
    PENDING,

    /**
     * Triggered, waiting for a worker
     */
    READY,

    /**
     * Node action in progress
     */
    RUNNING,

    /**
     * Completed successfully
     */
    DONE,

    /**
     * Completed with an error
     */
    FAILED,

    /**
     * Every incoming edge is dead, the node will never run
     */
    UNREACHABLE;

    /**
     * Check if this is a terminal state (node settled)
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == UNREACHABLE;
    }

    /**
     * Check if node is in progress
     */
    public boolean isInProgress() {
        return this == READY || this == RUNNING;
    }
}
