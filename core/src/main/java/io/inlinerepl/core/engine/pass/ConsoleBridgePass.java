package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.ParsedProgram;
import io.inlinerepl.core.engine.ast.SinkCalls;
import io.inlinerepl.core.model.TransformOptions;
import java.util.ArrayList;
import java.util.List;
import org.mozilla.javascript.ast.FunctionCall;

/**
 * Rewrites every {@code console.<method>(args...)} call into {@code __debug(line, args...)},
 * keeping argument order and count. The line is the line the call starts on.
 */
public final class ConsoleBridgePass implements TransformPass {

    @Override
    public String name() {
        return "console-bridge";
    }

    @Override
    public boolean isEnabled(TransformOptions options) {
        return true;
    }

    @Override
    public void apply(ParsedProgram program, PassContext context) {
        List<FunctionCall> calls = new ArrayList<>();
        List<Integer> lines = new ArrayList<>();
        program.root().visit(node -> {
            if (SinkCalls.isConsoleCall(node)) {
                calls.add((FunctionCall) node);
                lines.add(program.lineOf(node));
            }
            return true;
        });
        for (int i = 0; i < calls.size(); i++) {
            SinkCalls.redirect(calls.get(i), lines.get(i));
        }
    }
}
