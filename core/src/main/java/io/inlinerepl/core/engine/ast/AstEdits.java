package io.inlinerepl.core.engine.ast;

import java.util.ArrayList;
import java.util.List;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.ArrayLiteral;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.Block;
import org.mozilla.javascript.ast.ConditionalExpression;
import org.mozilla.javascript.ast.DoLoop;
import org.mozilla.javascript.ast.ElementGet;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.ForInLoop;
import org.mozilla.javascript.ast.ForLoop;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.IfStatement;
import org.mozilla.javascript.ast.InfixExpression;
import org.mozilla.javascript.ast.LabeledStatement;
import org.mozilla.javascript.ast.Loop;
import org.mozilla.javascript.ast.ParenthesizedExpression;
import org.mozilla.javascript.ast.ReturnStatement;
import org.mozilla.javascript.ast.Scope;
import org.mozilla.javascript.ast.SwitchCase;
import org.mozilla.javascript.ast.SwitchStatement;
import org.mozilla.javascript.ast.TemplateLiteral;
import org.mozilla.javascript.ast.ThrowStatement;
import org.mozilla.javascript.ast.UnaryExpression;
import org.mozilla.javascript.ast.VariableInitializer;
import org.mozilla.javascript.ast.WhileLoop;
import org.mozilla.javascript.ast.WithStatement;
import org.mozilla.javascript.ast.Yield;

/**
 * Structural edits on Rhino trees: replace a node in its parent, insert statements before or
 * after a statement.
 *
 * <p>
 * Rhino stores child positions relative to the parent. Every edit keeps absolute positions of
 * moved original nodes intact, so line lookups through {@link LineMap} stay valid.
 */
public final class AstEdits {

    private AstEdits() {
        // utility class
    }

    /** Whether {@code node} holds an ordered statement list (program, block, or case clause). */
    public static boolean isStatementList(AstNode node) {
        return node instanceof AstRoot
                || node instanceof SwitchCase
                || ((node instanceof Block || node instanceof Scope) && node.getType() == Token.BLOCK);
    }

    /** Statements of a statement list, in order. */
    public static List<AstNode> statementsOf(AstNode list) {
        List<AstNode> out = new ArrayList<>();
        if (list instanceof SwitchCase switchCase) {
            if (switchCase.getStatements() != null) {
                out.addAll(switchCase.getStatements());
            }
            return out;
        }
        for (Node child : list) {
            out.add((AstNode) child);
        }
        return out;
    }

    /**
     * Replaces {@code target} with {@code replacement} in the target's parent. The replacement
     * takes over the target's absolute position and length.
     *
     * @return {@code false} if the parent kind does not support replacement of this child
     */
    public static boolean tryReplace(AstNode target, AstNode replacement) {
        AstNode parent = target.getParent();
        if (parent == null) {
            return false;
        }
        replacement.setPosition(target.getAbsolutePosition());
        replacement.setLength(target.getLength());
        return replaceChild(parent, target, replacement);
    }

    /**
     * Replaces {@code target} with {@code replacement}.
     *
     * @throws IllegalStateException if the parent kind does not support replacement
     */
    public static void replace(AstNode target, AstNode replacement) {
        if (!tryReplace(target, replacement)) {
            AstNode parent = target.getParent();
            throw new IllegalStateException("Cannot replace " + target.getClass().getSimpleName() + " inside "
                    + (parent == null ? "<detached>" : parent.getClass().getSimpleName()));
        }
    }

    /**
     * Inserts {@code inserted} immediately before {@code statement}. When the statement is not
     * part of a statement list (for example the body of an unbraced {@code if}), both are wrapped
     * in a new block that takes the statement's place.
     */
    public static void insertBefore(AstNode statement, AstNode inserted) {
        insert(statement, inserted, true);
    }

    /** Inserts {@code inserted} immediately after {@code statement}; see {@link #insertBefore}. */
    public static void insertAfter(AstNode statement, AstNode inserted) {
        insert(statement, inserted, false);
    }

    /** Inserts statements at the front of a statement list, keeping their order. */
    public static void prepend(AstNode list, List<AstNode> statements) {
        for (int i = statements.size() - 1; i >= 0; i--) {
            AstNode statement = statements.get(i);
            if (list instanceof SwitchCase switchCase) {
                List<AstNode> updated = new ArrayList<>(statementsOf(list));
                updated.add(0, statement);
                switchCase.setStatements(updated);
            } else {
                list.addChildToFront(statement);
                statement.setParent(list);
            }
        }
    }

    /**
     * Makes sure {@code loop} has a block body, moving a single-statement body into a new block.
     *
     * @return the loop body block
     */
    public static AstNode ensureBlockBody(Loop loop) {
        AstNode body = loop.getBody();
        if (isStatementList(body) && !(body instanceof AstRoot) && !(body instanceof SwitchCase)) {
            return body;
        }
        Block block = new Block();
        block.setPosition(body.getAbsolutePosition());
        block.setLength(body.getLength());
        loop.setBody(block);
        if (body.getType() != Token.EMPTY) {
            block.addStatement(body);
        }
        return block;
    }

    private static void insert(AstNode statement, AstNode inserted, boolean before) {
        AstNode parent = statement.getParent();
        if (parent == null) {
            throw new IllegalStateException("Cannot insert next to a detached " + statement.getClass().getSimpleName());
        }
        if (parent instanceof SwitchCase switchCase) {
            List<AstNode> updated = new ArrayList<>(statementsOf(switchCase));
            int idx = updated.indexOf(statement);
            updated.add(before ? idx : idx + 1, inserted);
            switchCase.setStatements(updated);
            return;
        }
        if (isStatementList(parent)) {
            if (before) {
                parent.addChildBefore(inserted, statement);
            } else {
                parent.addChildAfter(inserted, statement);
            }
            inserted.setParent(parent);
            return;
        }
        Block block = new Block();
        replace(statement, block);
        if (before) {
            block.addStatement(inserted);
            block.addStatement(statement);
        } else {
            block.addStatement(statement);
            block.addStatement(inserted);
        }
    }

    private static boolean replaceChild(AstNode parent, AstNode target, AstNode replacement) {
        if (isStatementList(parent)) {
            if (parent instanceof SwitchCase switchCase) {
                if (switchCase.getExpression() == target) {
                    switchCase.setExpression(replacement);
                    return true;
                }
                List<AstNode> updated = new ArrayList<>(statementsOf(switchCase));
                int idx = updated.indexOf(target);
                if (idx < 0) {
                    return false;
                }
                updated.set(idx, replacement);
                switchCase.setStatements(updated);
                return true;
            }
            parent.replaceChild(target, replacement);
            replacement.setParent(parent);
            return true;
        }
        if (parent instanceof ExpressionStatement statement) {
            statement.setExpression(replacement);
            return true;
        }
        if (parent instanceof FunctionCall call) {
            if (call.getTarget() == target) {
                call.setTarget(replacement);
                return true;
            }
            List<AstNode> args = new ArrayList<>(call.getArguments());
            if (!replaceInList(args, target, replacement)) {
                return false;
            }
            call.setArguments(args);
            return true;
        }
        if (parent instanceof InfixExpression infix) {
            if (infix.getLeft() == target) {
                infix.setLeft(replacement);
            } else {
                infix.setRight(replacement);
            }
            return true;
        }
        if (parent instanceof ElementGet get) {
            if (get.getTarget() == target) {
                get.setTarget(replacement);
            } else {
                get.setElement(replacement);
            }
            return true;
        }
        if (parent instanceof UnaryExpression unary) {
            unary.setOperand(replacement);
            return true;
        }
        if (parent instanceof ParenthesizedExpression paren) {
            paren.setExpression(replacement);
            return true;
        }
        if (parent instanceof ConditionalExpression cond) {
            if (cond.getTestExpression() == target) {
                cond.setTestExpression(replacement);
            } else if (cond.getTrueExpression() == target) {
                cond.setTrueExpression(replacement);
            } else {
                cond.setFalseExpression(replacement);
            }
            return true;
        }
        if (parent instanceof ArrayLiteral array) {
            List<AstNode> elements = new ArrayList<>(array.getElements());
            if (!replaceInList(elements, target, replacement)) {
                return false;
            }
            array.setElements(elements);
            return true;
        }
        if (parent instanceof TemplateLiteral template) {
            List<AstNode> elements = new ArrayList<>(template.getElements());
            if (!replaceInList(elements, target, replacement)) {
                return false;
            }
            template.setElements(elements);
            return true;
        }
        if (parent instanceof ReturnStatement ret) {
            ret.setReturnValue(replacement);
            return true;
        }
        if (parent instanceof ThrowStatement thr) {
            thr.setExpression(replacement);
            return true;
        }
        if (parent instanceof VariableInitializer init) {
            if (init.getInitializer() == target) {
                init.setInitializer(replacement);
                return true;
            }
            return false;
        }
        if (parent instanceof IfStatement ifStatement) {
            if (ifStatement.getCondition() == target) {
                ifStatement.setCondition(replacement);
            } else if (ifStatement.getThenPart() == target) {
                ifStatement.setThenPart(replacement);
            } else {
                ifStatement.setElsePart(replacement);
            }
            return true;
        }
        if (parent instanceof Loop loop && loop.getBody() == target) {
            loop.setBody(replacement);
            return true;
        }
        if (parent instanceof WhileLoop whileLoop) {
            whileLoop.setCondition(replacement);
            return true;
        }
        if (parent instanceof DoLoop doLoop) {
            doLoop.setCondition(replacement);
            return true;
        }
        if (parent instanceof ForLoop forLoop) {
            if (forLoop.getInitializer() == target) {
                forLoop.setInitializer(replacement);
            } else if (forLoop.getCondition() == target) {
                forLoop.setCondition(replacement);
            } else {
                forLoop.setIncrement(replacement);
            }
            return true;
        }
        if (parent instanceof ForInLoop forIn) {
            if (forIn.getIteratedObject() == target) {
                forIn.setIteratedObject(replacement);
                return true;
            }
            return false;
        }
        if (parent instanceof SwitchStatement switchStatement) {
            switchStatement.setExpression(replacement);
            return true;
        }
        if (parent instanceof LabeledStatement labeled) {
            labeled.setStatement(replacement);
            return true;
        }
        if (parent instanceof WithStatement with) {
            if (with.getExpression() == target) {
                with.setExpression(replacement);
            } else {
                with.setStatement(replacement);
            }
            return true;
        }
        if (parent instanceof Yield yield) {
            yield.setValue(replacement);
            return true;
        }
        return false;
    }

    private static boolean replaceInList(List<AstNode> nodes, AstNode target, AstNode replacement) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == target) {
                nodes.set(i, replacement);
                return true;
            }
        }
        return false;
    }
}
