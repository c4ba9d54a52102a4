package io.inlinerepl.core.engine.ast;

import io.inlinerepl.core.error.SourceParseException;
import io.inlinerepl.core.model.SourceProgram;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ErrorReporter;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.Comment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses JavaScript into Rhino's mutable AST and renders trees back to text.
 *
 * <p>
 * The tree handed to the passes is parsed without comment recording, so rendering never emits
 * comments. Comments are collected by a second parse and exposed on {@link ParsedProgram}.
 *
 * <p>
 * Thread-safe: every call creates its own parser.
 */
public final class JsFrontEnd {

    private static final Logger LOG = LoggerFactory.getLogger(JsFrontEnd.class);

    static final String SOURCE_NAME = "input.js";

    /**
     * Parses user source.
     *
     * @throws SourceParseException if the source is malformed
     */
    public ParsedProgram parse(SourceProgram program) {
        String text = program.text();
        AstRoot root;
        try {
            root = newParser(false).parse(text, SOURCE_NAME, 1);
        } catch (RhinoException e) {
            throw new SourceParseException(e.details(), e.lineNumber(), e.columnNumber(), e);
        }
        return new ParsedProgram(program, root, new LineMap(text), readComments(text));
    }

    /**
     * Parses a snippet of statements and detaches them from their throwaway root, ready for
     * insertion into another tree.
     *
     * @throws IllegalArgumentException if the snippet is malformed
     */
    public static List<AstNode> parseStatements(String snippet) {
        AstRoot root;
        try {
            root = newParser(false).parse(snippet, "snippet.js", 1);
        } catch (RhinoException e) {
            throw new IllegalArgumentException("Invalid snippet: " + snippet, e);
        }
        List<AstNode> statements = new ArrayList<>();
        for (Node child : root) {
            statements.add((AstNode) child);
        }
        for (AstNode statement : statements) {
            root.removeChild(statement);
            statement.setParent(null);
        }
        return statements;
    }

    /** Parses a snippet holding exactly one statement. */
    public static AstNode parseStatement(String snippet) {
        List<AstNode> statements = parseStatements(snippet);
        if (statements.size() != 1) {
            throw new IllegalArgumentException("Expected one statement, got " + statements.size() + ": " + snippet);
        }
        return statements.get(0);
    }

    private List<SourceComment> readComments(String text) {
        AstRoot withComments;
        try {
            withComments = newParser(true).parse(text, SOURCE_NAME, 1);
        } catch (RhinoException e) {
            LOG.debug("Comment scan failed, treating source as comment-free: {}", e.details());
            return List.of();
        }
        SortedSet<Comment> comments = withComments.getComments();
        if (comments == null) {
            return List.of();
        }
        List<SourceComment> out = new ArrayList<>(comments.size());
        for (Comment comment : comments) {
            int start = comment.getAbsolutePosition();
            int end = commentEnd(text, start, comment.getLength());
            out.add(new SourceComment(start, end, SourceComment.bodyOf(text.substring(start, end))));
        }
        return out;
    }

    /**
     * End offset of the comment starting at {@code start}, taken from the source text. Rhino
     * reports a line comment that ends the input one character short, so line comments run to the
     * next line terminator and block comments to their closing delimiter.
     */
    static int commentEnd(String text, int start, int reportedLength) {
        if (text.startsWith("//", start)) {
            int end = start + 2;
            while (end < text.length() && !LineMap.isLineTerminator(text.charAt(end))) {
                end++;
            }
            return end;
        }
        if (text.startsWith("/*", start)) {
            int close = text.indexOf("*/", start + 2);
            return close < 0 ? text.length() : close + 2;
        }
        return Math.min(text.length(), start + reportedLength);
    }

    private static Parser newParser(boolean recordComments) {
        CompilerEnvirons env = new CompilerEnvirons();
        env.setLanguageVersion(Context.VERSION_ES6);
        env.setRecordingComments(recordComments);
        env.setRecordingLocalJsDocComments(recordComments);
        env.setGenerateDebugInfo(false);
        return new Parser(env, new ThrowingErrorReporter());
    }

    /** Fails the parse on the first syntax error instead of collecting them. */
    private static final class ThrowingErrorReporter implements ErrorReporter {

        @Override
        public void warning(String message, String sourceName, int line, String lineSource, int lineOffset) {
            LOG.trace("parse.warning line={} message={}", line, message);
        }

        @Override
        public void error(String message, String sourceName, int line, String lineSource, int lineOffset) {
            throw new EvaluatorException(message, sourceName, line, lineSource, lineOffset);
        }

        @Override
        public EvaluatorException runtimeError(
                String message, String sourceName, int line, String lineSource, int lineOffset) {
            return new EvaluatorException(message, sourceName, line, lineSource, lineOffset);
        }
    }
}
