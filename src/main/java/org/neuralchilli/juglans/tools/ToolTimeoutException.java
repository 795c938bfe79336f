package org.neuralchilli.juglans.tools;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

import java.time.Duration;

/**
 * Thrown when a client-bridged tool call is not answered before its deadline.
 */
public class ToolTimeoutException extends WorkflowException {

    private final String callId;

    public ToolTimeoutException(String callId, Duration timeout) {
        super(ErrorCode.TOOL_TIMEOUT, "Client tool call " + callId + " timed out after " + timeout.toSeconds() + "s");
        this.callId = callId;
    }

    public String callId() {
        return callId;
    }
}
