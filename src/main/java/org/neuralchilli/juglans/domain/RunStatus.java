package org.neuralchilli.juglans.domain;

/**
 * Overall status of a workflow run.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
