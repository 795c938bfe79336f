package org.neuralchilli.juglans.service;

import java.util.List;

/**
 * Outcome of validating a workflow graph. Errors make the workflow unusable, warnings are logged.
 */
public record ValidationReport(List<String> errors, List<String> warnings) {

    public ValidationReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
