package org.neuralchilli.juglans.domain;

/**
 * Whether an edge is followed on success or on failure of its source.
 */
public enum EdgeKind {
    NORMAL,
    ON_ERROR
}
