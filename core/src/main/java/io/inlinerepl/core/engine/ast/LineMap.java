package io.inlinerepl.core.engine.ast;

import java.util.Arrays;

/**
 * Maps character offsets of a source text to 1-based line numbers. Recognizes {@code \n},
 * {@code \r\n}, lone {@code \r}, U+2028 and U+2029 as line terminators.
 */
public final class LineMap {

    private final String text;
    private final int[] lineStarts;

    public LineMap(String text) {
        this.text = text;
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean terminator = c == '\n'
                    || c == '\u2028'
                    || c == '\u2029'
                    || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'));
            if (terminator) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    /** Whether {@code c} ends a line. A {@code \r\n} pair counts once, at its {@code \r}. */
    static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
    }

    /** Line containing {@code offset}; offsets outside the text are clamped. */
    public int lineOf(int offset) {
        if (offset <= 0) {
            return 1;
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /** Text between two offsets, clamped to the source bounds. */
    public String slice(int from, int to) {
        int start = Math.max(0, Math.min(from, text.length()));
        int end = Math.max(start, Math.min(to, text.length()));
        return text.substring(start, end);
    }
}
