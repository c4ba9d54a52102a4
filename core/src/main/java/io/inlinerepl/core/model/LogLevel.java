package io.inlinerepl.core.model;

import java.util.Locale;

/**
 * Internal log level of a transform. Any level other than {@link #NONE} makes the
 * top-level capture pass also report assignments and declared variables.
 */
public enum LogLevel {
    NONE,
    ERROR,
    WARN,
    INFO,
    DEBUG;

    /**
     * Parses a case-insensitive level name.
     *
     * @throws IllegalArgumentException for an unknown level
     */
    public static LogLevel fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown internal log level: " + value, e);
        }
    }

    public boolean isEnabled() {
        return this != NONE;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
