package org.neuralchilli.juglans.service;

import java.util.Optional;

/**
 * Result of loading one resource file (prompt, agent or tool bundle).
 * Provides type-safe success/failure handling with clear error messages.
 */
public sealed interface LoadResult {

    /**
     * Check if load was successful
     */
    boolean isSuccess();

    /**
     * Resource kind: prompt, agent or tools
     */
    String kind();

    /**
     * Slug of the loaded resource, or the file name when it failed
     */
    String name();

    /**
     * Get error message if failed
     */
    Optional<String> error();

    record Success(String kind, String name) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String kind, String name, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String kind, String name) {
        return new Success(kind, name);
    }

    static LoadResult failure(String kind, String name, Exception e) {
        return new Failure(kind, name, e.getMessage());
    }
}
