package io.inlinerepl.core.engine.ast;

import io.inlinerepl.core.spi.ExecutionHost;
import java.util.ArrayList;
import java.util.List;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.ElementGet;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NewExpression;
import org.mozilla.javascript.ast.NumberLiteral;
import org.mozilla.javascript.ast.PropertyGet;

/**
 * Builds and recognizes calls to the debug sink, {@code __debug(line, ...values)}.
 */
public final class SinkCalls {

    private SinkCalls() {
        // utility class
    }

    /** Whether {@code node} is a call of the debug sink produced by an earlier pass. */
    public static boolean isSinkCall(AstNode node) {
        return node instanceof FunctionCall call
                && !(node instanceof NewExpression)
                && call.getTarget() instanceof Name name
                && ExecutionHost.SINK_NAME.equals(name.getIdentifier());
    }

    /** Whether {@code node} is a {@code console.<method>(...)} or {@code console["method"](...)} call. */
    public static boolean isConsoleCall(AstNode node) {
        if (!(node instanceof FunctionCall call) || node instanceof NewExpression) {
            return false;
        }
        return isConsoleMember(call.getTarget());
    }

    /** Whether {@code node} is a member access on the {@code console} identifier. */
    public static boolean isConsoleMember(AstNode node) {
        AstNode object = null;
        if (node instanceof PropertyGet get) {
            object = get.getTarget();
        } else if (node instanceof ElementGet get) {
            object = get.getTarget();
        }
        return object instanceof Name name && "console".equals(name.getIdentifier());
    }

    /**
     * Whether {@code statement} is exactly {@code __debug(line, identifier);}, the follow-up capture
     * of a declared variable.
     */
    public static boolean isIdentifierCapture(AstNode statement, int line, String identifier) {
        if (!(statement instanceof ExpressionStatement expressionStatement)
                || !isSinkCall(expressionStatement.getExpression())) {
            return false;
        }
        List<AstNode> args = ((FunctionCall) expressionStatement.getExpression()).getArguments();
        return args.size() == 2
                && args.get(0) instanceof NumberLiteral lineArg
                && lineArg.getNumber() == line
                && args.get(1) instanceof Name name
                && identifier.equals(name.getIdentifier());
    }

    /** A new statement {@code __debug(line, identifier);}. */
    public static ExpressionStatement identifierCapture(int line, String identifier) {
        FunctionCall call = newCall(line);
        call.addArgument(new Name(0, identifier));
        return new ExpressionStatement(call);
    }

    /**
     * Replaces {@code expression} in its parent with {@code __debug(line, expression)}.
     *
     * @return the new sink call
     */
    public static FunctionCall wrap(AstNode expression, int line) {
        FunctionCall call = newCall(line);
        AstEdits.replace(expression, call);
        call.addArgument(expression);
        return call;
    }

    /**
     * Replaces a call with a sink call carrying the same arguments in the same order.
     *
     * @return the new sink call
     */
    public static FunctionCall redirect(FunctionCall original, int line) {
        FunctionCall call = newCall(line);
        AstEdits.replace(original, call);
        for (AstNode arg : new ArrayList<>(original.getArguments())) {
            call.addArgument(arg);
        }
        return call;
    }

    private static FunctionCall newCall(int line) {
        FunctionCall call = new FunctionCall();
        call.setTarget(new Name(0, ExecutionHost.SINK_NAME));
        call.addArgument(new NumberLiteral(0, Integer.toString(line), line));
        return call;
    }
}
