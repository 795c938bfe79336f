package org.neuralchilli.juglans.core;

import org.neuralchilli.juglans.domain.WorkflowEvent;

/**
 * Observer channel of a run. Fire-and-forget; implementations must not throw.
 */
@FunctionalInterface
public interface EventSink {

    void emit(WorkflowEvent event);

    static EventSink noop() {
        return event -> {
        };
    }
}
