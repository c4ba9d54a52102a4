package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.SinkCalls;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.NewExpression;
import org.mozilla.javascript.ast.PropertyGet;

/**
 * Static heuristics over {@code .then/.catch/.finally} chains.
 *
 * <p>
 * A chain whose handlers reference a {@code console} member (or a console call already redirected
 * to the debug sink) typically ends in {@code undefined}. For such chains the root promise, the
 * receiver of the first link, is the value worth capturing. These are source-shape heuristics,
 * not guarantees about runtime values.
 */
final class PromiseChains {

    static final Set<String> CHAIN_METHODS = Set.of("then", "catch", "finally");

    private PromiseChains() {
        // utility class
    }

    /** Whether {@code node} is a call of {@code then}, {@code catch} or {@code finally}. */
    static boolean isChainLink(AstNode node) {
        return node instanceof FunctionCall call
                && !(node instanceof NewExpression)
                && call.getTarget() instanceof PropertyGet get
                && CHAIN_METHODS.contains(get.getProperty().getIdentifier());
    }

    /**
     * Returns the node to capture for {@code expression}: the chain root when the expression is a
     * console-terminated chain, otherwise the expression itself.
     */
    static AstNode captureTarget(AstNode expression) {
        if (!isChainLink(expression)) {
            return expression;
        }
        List<AstNode> handlers = new ArrayList<>();
        AstNode current = expression;
        while (isChainLink(current)) {
            FunctionCall link = (FunctionCall) current;
            handlers.addAll(link.getArguments());
            current = ((PropertyGet) link.getTarget()).getTarget();
        }
        return handlersReferenceConsole(handlers) ? current : expression;
    }

    /** Whether any handler mentions a console member or a redirected console call. */
    static boolean handlersReferenceConsole(List<AstNode> handlers) {
        AtomicBoolean found = new AtomicBoolean();
        for (AstNode handler : handlers) {
            handler.visit(node -> {
                if (SinkCalls.isConsoleMember(node) || SinkCalls.isSinkCall(node)) {
                    found.set(true);
                }
                return !found.get();
            });
            if (found.get()) {
                return true;
            }
        }
        return false;
    }
}
