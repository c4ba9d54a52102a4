package io.inlinerepl.core.engine.value;

import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;

/**
 * Shallow rendering of the global object. Walking it like an ordinary object would print the
 * whole runtime, so every property is summarized on one line instead.
 */
final class GlobalObjectFormatter {

    private GlobalObjectFormatter() {
        // utility class
    }

    static String format(ScriptableObject global) {
        StringBuilder sb = new StringBuilder("<ref *1> Global {\n");
        for (Object id : global.getIds()) {
            String key = String.valueOf(id);
            Object value = id instanceof Integer index ? global.get(index, global) : global.get(key, global);
            sb.append(LiteralPrinter.INDENT)
                    .append(LiteralPrinter.key(key))
                    .append(": ")
                    .append(summary(global, JsValues.unwrap(value)))
                    .append(",\n");
        }
        return sb.append('}').toString();
    }

    private static String summary(ScriptableObject global, Object value) {
        if (value == global) {
            return "[Circular *1]";
        }
        if (JsValues.isFunction(value)) {
            return "ƒ " + JsValues.functionName(value) + "()";
        }
        if (value instanceof Scriptable scriptable) {
            return "[" + scriptable.getClassName() + "]";
        }
        if (value instanceof CharSequence text) {
            return LiteralPrinter.quote(text.toString());
        }
        return JsValues.primitiveText(value);
    }
}
