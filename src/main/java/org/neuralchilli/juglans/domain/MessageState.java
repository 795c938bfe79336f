package org.neuralchilli.juglans.domain;

import java.util.Locale;

/**
 * Visibility of a chat call's output: whether it is persisted for downstream nodes
 * and whether it is streamed to the observer.
 */
public enum MessageState {
    CONTEXT_VISIBLE(true, true),
    CONTEXT_HIDDEN(true, false),
    DISPLAY_ONLY(false, true),
    SILENT(false, false);

    private final boolean persist;
    private final boolean stream;

    MessageState(boolean persist, boolean stream) {
        this.persist = persist;
        this.stream = stream;
    }

    public boolean persist() {
        return persist;
    }

    public boolean stream() {
        return stream;
    }

    public static MessageState fromString(String value) {
        if (value == null || value.isBlank()) {
            return CONTEXT_VISIBLE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new WorkflowException(ErrorCode.VALIDATION_ERROR,
                    "Unknown message state '" + value
                            + "', expected one of context_visible, context_hidden, display_only, silent");
        }
    }

    /**
     * Resolve the flags of a call from its {@code state} and legacy {@code stateless} arguments.
     * {@code stateless=true} wins and means silent. The combined form {@code "input:output"}
     * takes persistence from the first state and streaming from the second.
     */
    public static Visibility resolve(String state, String stateless) {
        if (stateless != null && Boolean.parseBoolean(stateless.trim())) {
            return SILENT.visibility();
        }
        if (state != null && state.contains(":")) {
            String[] parts = state.split(":", 2);
            return new Visibility(fromString(parts[0]).persist, fromString(parts[1]).stream);
        }
        return fromString(state).visibility();
    }

    public Visibility visibility() {
        return new Visibility(persist, stream);
    }

    /**
     * Resolved pair of flags
     */
    public record Visibility(boolean persist, boolean stream) {

        public static Visibility visible() {
            return CONTEXT_VISIBLE.visibility();
        }
    }
}
