package io.inlinerepl.core.error;

import io.inlinerepl.core.model.ErrorCategory;

/**
 * An error thrown by the instrumented program, reported by the execution host. The message is
 * the program's own error message, shown to the user verbatim.
 */
public final class ScriptExecutionException extends ExecutionFailureException {

    private static final long serialVersionUID = 1L;

    public ScriptExecutionException(String message, ErrorCategory category) {
        super(message, category);
    }

    public ScriptExecutionException(String message, ErrorCategory category, Throwable cause) {
        super(message, cause, category);
    }

    /** Builds an exception whose category is derived from the thrown message. */
    public static ScriptExecutionException fromThrown(String message, Throwable cause) {
        return new ScriptExecutionException(message, ErrorCategory.classifyThrown(message), cause);
    }
}
