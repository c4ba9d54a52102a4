package io.inlinerepl.core.model;

import java.util.Objects;

/**
 * One captured value or the single top-level error of a run.
 *
 * <p>
 * Results are independently ordered events: the line number aligns a result with the editor and
 * never orders results.
 *
 * @param lineNumber source line the value was captured at, or {@code null} for errors and for
 *                   console output produced by the host itself
 * @param element    display element
 * @param kind       execution value or error
 */
public record ExecutionResult(Integer lineNumber, ColoredElement element, Kind kind) {

    /** Result kind. */
    public enum Kind {
        EXECUTION,
        ERROR
    }

    public ExecutionResult {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ExecutionResult execution(Integer lineNumber, ColoredElement element) {
        return new ExecutionResult(lineNumber, element, Kind.EXECUTION);
    }

    public static ExecutionResult error(String message) {
        return new ExecutionResult(null, ColoredElement.leaf(message, Color.ERROR), Kind.ERROR);
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EXECUTION -> "ExecutionResult[line=" + lineNumber + ", " + element.text() + "]";
            case ERROR -> "ExecutionResult[ERROR, " + element.text() + "]";
        };
    }
}
