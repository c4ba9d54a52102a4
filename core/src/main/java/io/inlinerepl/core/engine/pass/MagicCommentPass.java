package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.AstEdits;
import io.inlinerepl.core.engine.ast.ParsedProgram;
import io.inlinerepl.core.engine.ast.SinkCalls;
import io.inlinerepl.core.engine.ast.SourceComment;
import io.inlinerepl.core.model.TransformOptions;
import java.util.ArrayList;
import java.util.List;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.VariableDeclaration;
import org.mozilla.javascript.ast.VariableInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forces capture of statements trailed by a marker comment, a comment whose text starts with
 * {@code ?} such as {@code x //?}.
 *
 * <p>
 * A marker trails a statement when it starts on the line the statement ends on and only spaces,
 * tabs or semicolons separate the two. Expression statements are wrapped like top-level captures;
 * a single-declarator variable declaration gets a follow-up capture of its identifier. The marker
 * itself disappears because rendering drops comments.
 */
public final class MagicCommentPass implements TransformPass {

    private static final Logger LOG = LoggerFactory.getLogger(MagicCommentPass.class);

    @Override
    public String name() {
        return "magic-comment";
    }

    @Override
    public boolean isEnabled(TransformOptions options) {
        return options.magicComments();
    }

    @Override
    public void apply(ParsedProgram program, PassContext context) {
        List<SourceComment> markers = new ArrayList<>();
        for (SourceComment comment : program.comments()) {
            if (comment.isCaptureMarker()) {
                markers.add(comment);
            }
        }
        if (markers.isEmpty()) {
            return;
        }

        List<Candidate> candidates = new ArrayList<>();
        program.root().visit(node -> {
            if (node instanceof ExpressionStatement
                    || (node instanceof VariableDeclaration declaration && declaration.isStatement())) {
                candidates.add(new Candidate(node, program.endOf(node)));
            }
            return true;
        });

        List<Candidate> matched = new ArrayList<>();
        for (SourceComment marker : markers) {
            Candidate trailed = findTrailed(program, candidates, marker);
            if (trailed == null) {
                LOG.debug("Marker comment trails no statement: offset={}", marker.start());
            } else if (!matched.contains(trailed)) {
                matched.add(trailed);
            }
        }
        for (Candidate candidate : matched) {
            if (candidate.node() instanceof ExpressionStatement statement) {
                ExpressionCapture.capture(statement, program.lineOf(statement.getExpression()));
            } else {
                captureDeclaration(program, (VariableDeclaration) candidate.node());
            }
        }
    }

    private static Candidate findTrailed(ParsedProgram program, List<Candidate> candidates, SourceComment marker) {
        Candidate best = null;
        for (Candidate candidate : candidates) {
            if (candidate.end() > marker.start()
                    || !isTrailingGap(program.lines().slice(candidate.end(), marker.start()))) {
                continue;
            }
            if (best == null || candidate.end() > best.end()) {
                best = candidate;
            }
        }
        return best;
    }

    static boolean isTrailingGap(String gap) {
        for (int i = 0; i < gap.length(); i++) {
            char c = gap.charAt(i);
            if (c != ' ' && c != '\t' && c != ';') {
                return false;
            }
        }
        return true;
    }

    private static void captureDeclaration(ParsedProgram program, VariableDeclaration declaration) {
        List<VariableInitializer> declarators = declaration.getVariables();
        if (declarators.size() != 1 || !(declarators.get(0).getTarget() instanceof Name name)) {
            LOG.debug(
                    "Marker on a declaration without a single simple declarator ignored: line={}",
                    program.lineOf(declaration));
            return;
        }
        int line = program.lineOf(declarators.get(0));
        AstNode next = (AstNode) declaration.getNext();
        if (next != null && SinkCalls.isIdentifierCapture(next, line, name.getIdentifier())) {
            return;
        }
        AstEdits.insertAfter(declaration, SinkCalls.identifierCapture(line, name.getIdentifier()));
    }

    private record Candidate(AstNode node, int end) {}
}
