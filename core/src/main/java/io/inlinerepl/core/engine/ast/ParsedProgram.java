package io.inlinerepl.core.engine.ast;

import io.inlinerepl.core.model.SourceProgram;
import java.util.List;
import java.util.Objects;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;

/**
 * A parsed program: the mutable tree the passes rewrite, plus the line map and comments of the
 * original text. Line lookups use absolute offsets, so they stay valid for original nodes while
 * passes insert new ones.
 */
public final class ParsedProgram {

    private final SourceProgram source;
    private final AstRoot root;
    private final LineMap lines;
    private final List<SourceComment> comments;

    public ParsedProgram(SourceProgram source, AstRoot root, LineMap lines, List<SourceComment> comments) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.lines = Objects.requireNonNull(lines, "lines must not be null");
        this.comments = List.copyOf(comments);
    }

    public SourceProgram source() {
        return source;
    }

    public AstRoot root() {
        return root;
    }

    public LineMap lines() {
        return lines;
    }

    public List<SourceComment> comments() {
        return comments;
    }

    /** Line on which {@code node} starts. */
    public int lineOf(AstNode node) {
        return lines.lineOf(node.getAbsolutePosition());
    }

    /** Absolute offset just past {@code node}. */
    public int endOf(AstNode node) {
        return node.getAbsolutePosition() + node.getLength();
    }

    /** Renders the current tree back to source text. */
    public String render() {
        return root.toSource();
    }
}
