package org.neuralchilli.juglans.tools;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * Thrown when no builtin, tool server, bundle or client bridge matches a name.
 */
public class ToolResolutionException extends WorkflowException {

    public ToolResolutionException(String message) {
        super(ErrorCode.TOOL_RESOLUTION_ERROR, message);
    }
}
