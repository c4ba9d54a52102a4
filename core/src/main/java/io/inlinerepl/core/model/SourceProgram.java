package io.inlinerepl.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Raw user source plus its declared dialect. Immutable.
 *
 * @param text     the script text as typed by the user
 * @param language declared syntax dialect
 */
public record SourceProgram(String text, Language language) {

    /** Declared syntax dialect of a program. */
    public enum Language {
        JAVASCRIPT,
        TYPESCRIPT;

        /**
         * Parses a configuration value such as {@code "javascript"} or {@code "ts"}.
         *
         * @throws IllegalArgumentException for an unknown dialect
         */
        public static Language fromString(String value) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            return switch (normalized) {
                case "javascript", "js" -> JAVASCRIPT;
                case "typescript", "ts" -> TYPESCRIPT;
                default -> throw new IllegalArgumentException("Unknown language: " + value);
            };
        }

        /** Lower-case name used in cache keys and configuration. */
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public SourceProgram {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(language, "language must not be null");
    }

    public static SourceProgram javascript(String text) {
        return new SourceProgram(text, Language.JAVASCRIPT);
    }
}
