package org.neuralchilli.juglans.core;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

/**
 * Thrown at a call site when a required argument is absent or resolved to null.
 */
public class MissingArgumentException extends WorkflowException {

    private final String tool;
    private final String argument;

    public MissingArgumentException(String tool, String argument) {
        super(ErrorCode.MISSING_ARGUMENT, "Tool '" + tool + "' requires argument '" + argument + "'");
        this.tool = tool;
        this.argument = argument;
    }

    public String tool() {
        return tool;
    }

    public String argument() {
        return argument;
    }
}
