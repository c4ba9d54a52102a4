package io.inlinerepl.core.error;

import io.inlinerepl.core.model.ErrorCategory;
import java.util.Objects;

/**
 * Abstract parent for failures raised while instrumented code runs or while its values are
 * serialized. Carries the {@link ErrorCategory} used to pick the terminal run state.
 */
public abstract class ExecutionFailureException extends ReplException {

    private static final long serialVersionUID = 1L;

    private final ErrorCategory category;

    protected ExecutionFailureException(String message, ErrorCategory category) {
        super(message, Phase.EXECUTION);
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    protected ExecutionFailureException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, Phase.EXECUTION);
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    public ErrorCategory category() {
        return category;
    }
}
