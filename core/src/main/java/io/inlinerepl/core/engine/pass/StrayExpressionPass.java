package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.AstEdits;
import io.inlinerepl.core.engine.ast.ParsedProgram;
import io.inlinerepl.core.engine.ast.SinkCalls;
import io.inlinerepl.core.model.TransformOptions;
import java.util.Set;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.Assignment;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.StringLiteral;
import org.mozilla.javascript.ast.VariableDeclaration;
import org.mozilla.javascript.ast.VariableInitializer;

/**
 * Captures the value of expression statements that sit directly in the program root.
 *
 * <p>
 * Directives, timer registrations, console output and existing sink calls are left alone.
 * Assignments and declared variables are reported only when the internal log level is enabled.
 */
public final class StrayExpressionPass implements TransformPass {

    static final Set<String> TIMER_FUNCTIONS = Set.of("setTimeout", "setInterval");

    @Override
    public String name() {
        return "stray-expression";
    }

    @Override
    public boolean isEnabled(TransformOptions options) {
        return options.showTopLevelResults();
    }

    @Override
    public void apply(ParsedProgram program, PassContext context) {
        boolean verbose = context.options().internalLogLevel().isEnabled();
        for (AstNode statement : AstEdits.statementsOf(program.root())) {
            if (statement instanceof ExpressionStatement expressionStatement) {
                AstNode expression = expressionStatement.getExpression();
                if (isEligible(expression, verbose)) {
                    ExpressionCapture.capture(expressionStatement, program.lineOf(expression));
                }
            } else if (verbose && statement instanceof VariableDeclaration declaration) {
                captureDeclarators(program, declaration);
            }
        }
    }

    static boolean isEligible(AstNode expression, boolean verbose) {
        if (expression instanceof StringLiteral literal && isDirective(literal.getValue())) {
            return false;
        }
        if (SinkCalls.isSinkCall(expression) || SinkCalls.isConsoleCall(expression)) {
            return false;
        }
        if (isTimerCall(expression)) {
            return false;
        }
        return verbose || !(expression instanceof Assignment);
    }

    static boolean isDirective(String value) {
        return value.equals("use strict") || value.startsWith("use ");
    }

    static boolean isTimerCall(AstNode expression) {
        return expression instanceof FunctionCall call
                && call.getTarget() instanceof Name name
                && TIMER_FUNCTIONS.contains(name.getIdentifier());
    }

    private static void captureDeclarators(ParsedProgram program, VariableDeclaration declaration) {
        AstNode anchor = declaration;
        for (VariableInitializer declarator : declaration.getVariables()) {
            if (!(declarator.getTarget() instanceof Name name)) {
                continue;
            }
            int line = program.lineOf(declarator);
            AstNode next = nextSibling(anchor);
            if (next != null && SinkCalls.isIdentifierCapture(next, line, name.getIdentifier())) {
                anchor = next;
                continue;
            }
            AstNode capture = SinkCalls.identifierCapture(line, name.getIdentifier());
            AstEdits.insertAfter(anchor, capture);
            anchor = capture;
        }
    }

    private static AstNode nextSibling(AstNode statement) {
        return (AstNode) statement.getNext();
    }
}
