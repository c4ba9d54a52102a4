package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.AstEdits;
import io.inlinerepl.core.engine.ast.ParsedProgram;
import io.inlinerepl.core.model.TransformOptions;
import java.util.ArrayList;
import java.util.List;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.FunctionNode;
import org.mozilla.javascript.ast.KeywordLiteral;
import org.mozilla.javascript.ast.Name;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces {@code this} outside any non-arrow function with {@code globalThis}.
 *
 * <p>
 * Arrow functions are transparent: their {@code this} is the one of the enclosing scope, so the
 * walk descends into them and stops only at ordinary functions and methods.
 */
public final class TopLevelThisPass implements TransformPass {

    private static final Logger LOG = LoggerFactory.getLogger(TopLevelThisPass.class);

    static final String GLOBAL_NAME = "globalThis";

    @Override
    public String name() {
        return "top-level-this";
    }

    @Override
    public boolean isEnabled(TransformOptions options) {
        return true;
    }

    @Override
    public void apply(ParsedProgram program, PassContext context) {
        List<AstNode> found = new ArrayList<>();
        program.root().visit(node -> {
            if (node instanceof FunctionNode fn && fn.getFunctionType() != FunctionNode.ARROW_FUNCTION) {
                return false;
            }
            if (node instanceof KeywordLiteral && node.getType() == Token.THIS) {
                found.add(node);
            }
            return true;
        });
        for (AstNode thisNode : found) {
            if (!AstEdits.tryReplace(thisNode, new Name(0, GLOBAL_NAME))) {
                LOG.debug(
                        "Left top-level this in place: parent={} line={}",
                        thisNode.getParent().getClass().getSimpleName(),
                        program.lineOf(thisNode));
            }
        }
    }
}
