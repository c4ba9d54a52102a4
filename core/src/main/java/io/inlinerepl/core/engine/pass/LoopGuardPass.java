package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.AstEdits;
import io.inlinerepl.core.engine.ast.JsFrontEnd;
import io.inlinerepl.core.engine.ast.ParsedProgram;
import io.inlinerepl.core.model.ErrorCategory;
import io.inlinerepl.core.model.TransformOptions;
import io.inlinerepl.core.spi.ExecutionHost;
import java.util.ArrayList;
import java.util.List;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.LabeledStatement;
import org.mozilla.javascript.ast.Loop;

/**
 * Bounds every loop ({@code while}, {@code do-while}, {@code for}, {@code for-in},
 * {@code for-of}) by an iteration ceiling and polls the cancellation predicate at fixed
 * checkpoints.
 *
 * <p>
 * Each loop gets its own counter, declared right before the loop (before its label, if any):
 *
 * <pre>{@code
 * let __loop0 = 0;
 * while (cond) {
 *   if (++__loop0 > 10000) throw new Error("Loop limit exceeded");
 *   if (__loop0 % 100 === 0 && __isCancelled()) throw new Error("Execution cancelled");
 *   ...
 * }
 * }</pre>
 *
 * Counter names never occur elsewhere in the program, so nested and sibling loops cannot shadow
 * each other.
 */
public final class LoopGuardPass implements TransformPass {

    static final String COUNTER_PREFIX = "__loop";

    @Override
    public String name() {
        return "loop-guard";
    }

    @Override
    public boolean isEnabled(TransformOptions options) {
        return options.loopProtection();
    }

    @Override
    public void apply(ParsedProgram program, PassContext context) {
        List<Loop> loops = new ArrayList<>();
        program.root().visit(node -> {
            if (node instanceof Loop loop) {
                loops.add(loop);
            }
            return true;
        });
        for (Loop loop : loops) {
            guard(loop, context);
        }
    }

    private static void guard(Loop loop, PassContext context) {
        String counter = context.names().next(COUNTER_PREFIX);
        AstNode body = AstEdits.ensureBlockBody(loop);
        AstEdits.prepend(body, JsFrontEnd.parseStatements(guardSource(counter, context.budget())));

        AstNode anchor = loop.getParent() instanceof LabeledStatement labeled ? labeled : loop;
        AstEdits.insertBefore(anchor, JsFrontEnd.parseStatement("let " + counter + " = 0;"));
    }

    static String guardSource(String counter, GuardBudget budget) {
        return "if (++" + counter + " > " + budget.maxIterations() + ") throw new Error(\""
                + ErrorCategory.LOOP_LIMIT_MESSAGE + "\");\n"
                + "if (" + counter + " % " + budget.checkInterval() + " === 0 && "
                + ExecutionHost.CANCEL_PREDICATE_NAME + "()) throw new Error(\""
                + ErrorCategory.CANCELLED_MESSAGE + "\");\n";
    }
}
