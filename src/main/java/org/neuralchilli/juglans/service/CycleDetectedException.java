package org.neuralchilli.juglans.service;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * Thrown when a cycle is detected in a workflow graph.
 * Raised while compiling a workflow, never during execution.
 */
public class CycleDetectedException extends WorkflowException {

    public CycleDetectedException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
