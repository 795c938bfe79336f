package org.neuralchilli.juglans.service;

import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;

import java.util.List;

/**
 * A flow import chain leads back to a file that is already being loaded.
 */
public class CircularImportException extends WorkflowException {

    private final List<String> chain;

    public CircularImportException(List<String> chain) {
        super(ErrorCode.CIRCULAR_IMPORT, "Circular flow import: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    /**
     * Files of the import chain, the repeated file first and last
     */
    public List<String> chain() {
        return chain;
    }
}
