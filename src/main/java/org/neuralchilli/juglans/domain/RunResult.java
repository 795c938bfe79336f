package org.neuralchilli.juglans.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Terminal result of a workflow run.
 * Either the values of the exit nodes or the error that stopped the run.
 */
public sealed interface RunResult {

    /**
     * Check if the run completed successfully
     */
    boolean isSuccess();

    /**
     * Primary result value (null node for failures)
     */
    JsonNode value();

    /**
     * Get error if failed
     */
    Optional<RunError> error();

    /**
     * Successful run. {@code exitValues} maps each completed exit node to its value.
     */
    record Success(Map<String, JsonNode> exitValues, JsonNode value) implements RunResult {

        public Success {
            exitValues = exitValues != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(exitValues))
                    : Map.of();
            value = value != null ? value : NullNode.getInstance();
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<RunError> error() {
            return Optional.empty();
        }
    }

    /**
     * Failed run with the error that terminated it
     */
    record Failure(RunError runError) implements RunResult {

        public Failure {
            if (runError == null) {
                throw new IllegalArgumentException("Failure requires an error");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public JsonNode value() {
            return NullNode.getInstance();
        }

        @Override
        public Optional<RunError> error() {
            return Optional.of(runError);
        }
    }

    static RunResult success(Map<String, JsonNode> exitValues, JsonNode value) {
        return new Success(exitValues, value);
    }

    static RunResult failure(RunError error) {
        return new Failure(error);
    }
}
