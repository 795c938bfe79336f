package org.neuralchilli.juglans.service;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * A workflow, agent, prompt or tool file could not be read into the domain model.
 */
public class ParseException extends WorkflowException {

    public ParseException(String message) {
        super(ErrorCode.PARSE_ERROR, message);
    }

    public ParseException(String message, Throwable cause) {
        super(ErrorCode.PARSE_ERROR, message, cause);
    }
}
