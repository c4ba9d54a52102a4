package io.inlinerepl.core.engine.ast;

/**
 * A comment found in the original source.
 *
 * @param start absolute offset of the comment's first character
 * @param end   absolute offset just past the comment
 * @param body  text between the comment delimiters
 */
public record SourceComment(int start, int end, String body) {

    /** Marker prefix that forces capture of the trailed statement. */
    public static final String MARKER = "?";

    public boolean isCaptureMarker() {
        return body.trim().startsWith(MARKER);
    }

    /** Strips the comment delimiters from raw comment text. */
    static String bodyOf(String raw) {
        if (raw.startsWith("//")) {
            return raw.substring(2);
        }
        if (raw.startsWith("/*")) {
            String inner = raw.substring(raw.startsWith("/**") ? 3 : 2);
            return inner.endsWith("*/") ? inner.substring(0, inner.length() - 2) : inner;
        }
        if (raw.startsWith("<!--")) {
            return raw.substring(4);
        }
        return raw;
    }
}
