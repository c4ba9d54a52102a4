package io.inlinerepl.core.error;

import io.inlinerepl.core.model.ErrorCategory;

/**
 * Abstract parent for failures of the parse/transform/render round trip. Any of these aborts the
 * whole run with exactly one error result.
 */
public abstract class TransformFailureException extends ReplException {

    private static final long serialVersionUID = 1L;

    protected TransformFailureException(String message) {
        super(message, Phase.TRANSFORM);
    }

    protected TransformFailureException(String message, Throwable cause) {
        super(message, cause, Phase.TRANSFORM);
    }

    /** Category reported for the run this failure aborted. */
    public abstract ErrorCategory category();
}
