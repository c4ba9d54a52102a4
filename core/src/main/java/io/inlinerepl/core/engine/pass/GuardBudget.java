package io.inlinerepl.core.engine.pass;

/**
 * Limits written into guarded loops.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxIterations iterations a single loop may run before it throws "Loop limit exceeded"
 * @param checkInterval iterations between two polls of the cancellation predicate
 */
public record GuardBudget(int maxIterations, int checkInterval) {

    /** Default budget: 10000 iterations, cancellation polled every 100. */
    public static final GuardBudget DEFAULT = new GuardBudget(10_000, 100);

    public GuardBudget {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got: " + maxIterations);
        }
        if (checkInterval <= 0) {
            throw new IllegalArgumentException("checkInterval must be positive, got: " + checkInterval);
        }
    }
}
