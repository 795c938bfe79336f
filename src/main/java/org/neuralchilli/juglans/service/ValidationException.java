package org.neuralchilli.juglans.service;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * A workflow definition is structurally invalid: unknown edge endpoints, unknown entry or
 * exit nodes, malformed expressions.
 */
public class ValidationException extends WorkflowException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
