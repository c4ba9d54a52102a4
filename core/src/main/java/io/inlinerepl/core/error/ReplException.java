package io.inlinerepl.core.error;

/**
 * Abstract base for all inline-repl exceptions. Never thrown directly; use the concrete
 * subclasses under {@link TransformFailureException} or {@link ExecutionFailureException}, or
 * {@link CacheCorruptionException}.
 */
public abstract class ReplException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        TRANSFORM,
        EXECUTION,
        PERSISTENCE
    }

    private final Phase phase;

    protected ReplException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ReplException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
