package io.inlinerepl.core.engine.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.mozilla.javascript.Scriptable;

/**
 * Converts a runtime object graph into a Jackson tree, replacing every repeated reference with a
 * {@code {"$ref": path}} marker, where path locates the first occurrence from the root
 * ({@code $}, {@code $["a"]}, {@code $[0]}). Cyclic graphs therefore always terminate.
 *
 * <p>
 * Single use: one instance per decycled root.
 */
final class Decycler {

    static final String REF_KEY = "$ref";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final IdentityHashMap<Object, String> seen = new IdentityHashMap<>();
    private final SerializerLimits limits;

    Decycler(SerializerLimits limits) {
        this.limits = limits;
    }

    JsonNode decycle(Object root) {
        return walk(root, "$", 0);
    }

    private JsonNode walk(Object raw, String path, int depth) {
        Object value = JsValues.unwrap(raw);
        if (value == null) {
            return NODES.nullNode();
        }
        if (JsValues.isUndefined(value)) {
            return literal("undefined");
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof BigInteger big) {
            return literal(big + "n");
        }
        if (value instanceof Number number) {
            return NODES.numberNode(number.doubleValue());
        }
        if (value instanceof CharSequence text) {
            return NODES.textNode(text.toString());
        }
        if (JsValues.isSymbol(value)) {
            String description = JsValues.symbolDescription(value);
            return literal("Symbol(" + (description == null ? "" : description) + ")");
        }
        if (JsValues.isFunction(value)) {
            return literal(JsValues.functionLabel(value));
        }
        if (JsValues.hasClassName(value, "Error")) {
            return literal(JsValues.errorLabel((Scriptable) value));
        }
        if (JsValues.hasClassName(value, "Date")) {
            String iso = JsValues.dateText((Scriptable) value);
            return iso == null ? literal("[Date]") : NODES.textNode(iso);
        }
        boolean array = JsValues.isArrayLike(value);
        if (!array && !(value instanceof Scriptable) && !(value instanceof Map<?, ?>)) {
            return literal(String.valueOf(value));
        }

        String firstPath = seen.get(value);
        if (firstPath != null) {
            ObjectNode ref = NODES.objectNode();
            ref.put(REF_KEY, firstPath);
            return ref;
        }
        if (depth >= limits.maxDepth()) {
            return literal(array ? "[Array]" : "[Object]");
        }
        seen.put(value, path);
        return array ? walkArray(value, path, depth) : walkObject(value, path, depth);
    }

    private JsonNode walkArray(Object value, String path, int depth) {
        ArrayNode out = NODES.arrayNode();
        List<Object> elements = JsValues.elements(value);
        int shown = Math.min(elements.size(), limits.maxItems());
        for (int i = 0; i < shown; i++) {
            out.add(walk(elements.get(i), path + "[" + i + "]", depth + 1));
        }
        if (elements.size() > shown) {
            out.add(literal("... " + (elements.size() - shown) + " more items"));
        }
        return out;
    }

    private JsonNode walkObject(Object value, String path, int depth) {
        ObjectNode out = NODES.objectNode();
        int count = 0;
        Map<String, Object> properties = JsValues.properties(value);
        for (Map.Entry<String, Object> property : properties.entrySet()) {
            if (count++ >= limits.maxItems()) {
                out.set("...", literal((properties.size() - limits.maxItems()) + " more properties"));
                break;
            }
            String childPath = path + "[" + LiteralPrinter.quote(property.getKey()) + "]";
            out.set(property.getKey(), walk(property.getValue(), childPath, depth + 1));
        }
        return out;
    }

    private static JsonNode literal(String text) {
        return NODES.pojoNode(new JsLiteral(text));
    }
}
