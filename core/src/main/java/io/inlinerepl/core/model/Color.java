package io.inlinerepl.core.model;

/** Display colors attached to serialized values. */
public enum Color {
    TRUE("#1f924a"),
    FALSE("#f55442"),
    NUMBER("#368aa3"),
    STRING("#c3e88d"),
    GRAY("#807b7a"),
    ERROR("#ff0000");

    private final String hex;

    Color(String hex) {
        this.hex = hex;
    }

    /** CSS hex notation, e.g. {@code #368aa3}. */
    public String hex() {
        return hex;
    }
}
