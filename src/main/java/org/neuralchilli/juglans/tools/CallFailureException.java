package org.neuralchilli.juglans.tools;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * Thrown when a collaborator (model endpoint, tool server, HTTP target) fails.
 */
public class CallFailureException extends WorkflowException {

    public CallFailureException(String message) {
        super(ErrorCode.CALL_FAILURE, message);
    }

    public CallFailureException(String message, Throwable cause) {
        super(ErrorCode.CALL_FAILURE, message, cause);
    }
}
