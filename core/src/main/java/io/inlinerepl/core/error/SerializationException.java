package io.inlinerepl.core.error;

import io.inlinerepl.core.model.ErrorCategory;

/** A single value could not be turned into a display element. Never aborts a run. */
public final class SerializationException extends ExecutionFailureException {

    private static final long serialVersionUID = 1L;

    public SerializationException(String message, Throwable cause) {
        super(message, cause, ErrorCategory.SERIALIZATION);
    }
}
