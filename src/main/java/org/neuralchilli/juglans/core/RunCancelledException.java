package org.neuralchilli.juglans.core;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * Thrown into work that is still outstanding when its run is cancelled or times out.
 */
public class RunCancelledException extends WorkflowException {

    public RunCancelledException(String message) {
        super(ErrorCode.CANCELLED, message);
    }
}
