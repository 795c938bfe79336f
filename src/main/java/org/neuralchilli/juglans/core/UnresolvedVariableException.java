package org.neuralchilli.juglans.core;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * Thrown when a node depends on a variable that does not exist, e.g. a foreach collection.
 */
public class UnresolvedVariableException extends WorkflowException {

    private final String path;

    public UnresolvedVariableException(String path, String message) {
        super(ErrorCode.UNRESOLVED_VARIABLE, message);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
