package io.inlinerepl.core.engine.value;

/**
 * Bounds on how much of an object graph is printed.
 *
 * @param maxDepth nesting depth after which containers print as {@code [Object]} / {@code [Array]}
 * @param maxItems elements or properties printed per container
 */
public record SerializerLimits(int maxDepth, int maxItems) {

    public static final SerializerLimits DEFAULTS = new SerializerLimits(32, 1000);

    public SerializerLimits {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive, got: " + maxItems);
        }
    }
}
