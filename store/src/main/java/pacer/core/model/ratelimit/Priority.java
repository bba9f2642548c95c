package pacer.core.model.ratelimit;

import java.util.Locale;

/**
 * Traffic class used by the adaptive store.
 */
public enum Priority {
    /** Interactive, latency-sensitive traffic. */
    USER("user"),
    /** Deferrable traffic. */
    BACKGROUND("background");

    private final String value;

    Priority(String value) {
        this.value = value;
    }

    /**
     * Persisted representation of this priority.
     */
    public String value() {
        return value;
    }

    /**
     * Parse a persisted priority value.
     *
     * @param value "user" or "background", case-insensitive
     * @return the priority
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Priority fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("priority must not be null");
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Priority priority : values()) {
            if (priority.value.equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }
}
