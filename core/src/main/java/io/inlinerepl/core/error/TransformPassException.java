package io.inlinerepl.core.error;

import io.inlinerepl.core.model.ErrorCategory;

/** Thrown when a transform pass fails on source that parsed successfully. */
public final class TransformPassException extends TransformFailureException {

    private static final long serialVersionUID = 1L;

    private final String passName;

    public TransformPassException(String message, String passName, Throwable cause) {
        super(message, cause);
        this.passName = passName;
    }

    /** Name of the failing pass. */
    public String passName() {
        return passName;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.TRANSPILATION;
    }
}
