package io.inlinerepl.core.engine.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.POJONode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Prints a decycled tree as a JavaScript literal: double-quoted strings, bare identifier keys,
 * two-space indentation. A container stays on one line while that line fits the inline limit.
 */
final class LiteralPrinter {

    static final int INLINE_LIMIT = 80;
    static final String INDENT = "  ";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private LiteralPrinter() {
        // utility class
    }

    static String print(JsonNode node) {
        return print(node, 0);
    }

    private static String print(JsonNode node, int level) {
        if (node.isObject()) {
            List<String> parts = new ArrayList<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> field = it.next();
                parts.add(key(field.getKey()) + ": " + print(field.getValue(), level + 1));
            }
            return container("{", "}", parts, level);
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode element : node) {
                parts.add(print(element, level + 1));
            }
            return container("[", "]", parts, level);
        }
        return scalar(node);
    }

    private static String container(String open, String close, List<String> parts, int level) {
        if (parts.isEmpty()) {
            return open + close;
        }
        String inline = open + String.join(", ", parts) + close;
        if (!inline.contains("\n") && inline.length() + level * INDENT.length() <= INLINE_LIMIT) {
            return inline;
        }
        String inner = INDENT.repeat(level + 1);
        StringBuilder sb = new StringBuilder(open).append('\n');
        for (int i = 0; i < parts.size(); i++) {
            sb.append(inner).append(parts.get(i));
            sb.append(i < parts.size() - 1 ? ",\n" : "\n");
        }
        return sb.append(INDENT.repeat(level)).append(close).toString();
    }

    private static String scalar(JsonNode node) {
        if (node instanceof POJONode pojo && pojo.getPojo() instanceof JsLiteral literal) {
            return literal.text();
        }
        if (node.isTextual()) {
            return quote(node.asText());
        }
        if (node.isNumber()) {
            return JsValues.numberText(node.numberValue());
        }
        if (node.isBoolean()) {
            return Boolean.toString(node.booleanValue());
        }
        if (node.isNull()) {
            return "null";
        }
        return node.toString();
    }

    static String key(String name) {
        if (name.equals(Decycler.REF_KEY)) {
            return quote(name);
        }
        return IDENTIFIER.matcher(name).matches() ? name : quote(name);
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
