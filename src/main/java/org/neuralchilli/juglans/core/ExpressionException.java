package org.neuralchilli.juglans.core;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * Thrown when an expression cannot be compiled or evaluated.
 */
public class ExpressionException extends WorkflowException {

    public ExpressionException(String message) {
        super(ErrorCode.EXPRESSION_ERROR, message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(ErrorCode.EXPRESSION_ERROR, message, cause);
    }
}
