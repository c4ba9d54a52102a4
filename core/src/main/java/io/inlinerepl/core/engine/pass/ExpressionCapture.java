package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.SinkCalls;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.ExpressionStatement;

/**
 * Wraps the value of an expression statement in a debug-sink call. Shared by the top-level capture
 * and the marker-comment capture so both wrap identically.
 *
 * <p>
 * The debug sink returns the value it was given, so wrapping a chain root in place
 * ({@code __debug(3, fetch(url)).then(...)}) leaves the chain working.
 */
final class ExpressionCapture {

    private ExpressionCapture() {
        // utility class
    }

    /**
     * Captures the statement's value at {@code line}.
     *
     * @return {@code false} if the statement already is a debug-sink call
     */
    static boolean capture(ExpressionStatement statement, int line) {
        AstNode expression = statement.getExpression();
        if (SinkCalls.isSinkCall(expression)) {
            return false;
        }
        AstNode target = PromiseChains.captureTarget(expression);
        if (SinkCalls.isSinkCall(target)) {
            return false;
        }
        SinkCalls.wrap(target, line);
        return true;
    }
}
