package io.inlinerepl.core.error;

import io.inlinerepl.core.model.ErrorCategory;

/**
 * Thrown when user source cannot be parsed. Carries the 1-based line and 0-based column the
 * parser reported.
 */
public final class SourceParseException extends TransformFailureException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public SourceParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.SYNTAX;
    }
}
