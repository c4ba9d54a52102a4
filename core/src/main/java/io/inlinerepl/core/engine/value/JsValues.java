package io.inlinerepl.core.engine.value;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Callable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.NativeArray;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.ScriptRuntime;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Symbol;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.Wrapper;

/**
 * Inspection helpers over runtime values. Values are either script values produced by Rhino or
 * plain Java values ({@link Map}, {@link List}, arrays, {@link CompletionStage}) handed to the
 * sink directly.
 *
 * <p>
 * The capability checks here ({@link #hasCallableThen}, {@link #looksLikeHttpResponse},
 * {@link #isGlobalObject}) are duck-typing heuristics, not structural guarantees.
 */
public final class JsValues {

    private static final Pattern SYMBOL_TEXT = Pattern.compile("^Symbol\\((.*)\\)$", Pattern.DOTALL);

    private JsValues() {
        // utility class
    }

    /** Unwraps Java objects that Rhino wrapped for script access. */
    public static Object unwrap(Object value) {
        return value instanceof Wrapper wrapper ? wrapper.unwrap() : value;
    }

    public static boolean isUndefined(Object value) {
        return value instanceof Undefined;
    }

    /**
     * Heuristic: the value is promise-like. True for Java {@link CompletionStage}s and for script
     * objects with a callable {@code then} property.
     */
    public static boolean hasCallableThen(Object value) {
        if (value instanceof CompletionStage<?>) {
            return true;
        }
        if (!(value instanceof Scriptable scriptable) || value instanceof Callable) {
            return false;
        }
        return property(scriptable, "then") instanceof Callable;
    }

    /**
     * Heuristic: the value resembles a fetch {@code Response}, i.e. it has {@code status} and
     * {@code headers} properties and a callable {@code text}.
     */
    public static boolean looksLikeHttpResponse(Object value) {
        if (value instanceof Scriptable scriptable) {
            return isPresent(property(scriptable, "status"))
                    && isPresent(property(scriptable, "headers"))
                    && property(scriptable, "text") instanceof Callable;
        }
        if (value instanceof Map<?, ?> map) {
            return map.containsKey("status")
                    && map.containsKey("headers")
                    && (map.get("text") instanceof Callable || map.get("text") instanceof Supplier<?>);
        }
        return false;
    }

    /**
     * Heuristic: the value is a script global object, a top-level scope that defines the
     * standard {@code Object} constructor itself.
     */
    public static boolean isGlobalObject(Object value) {
        return value instanceof ScriptableObject scope
                && scope.getParentScope() == null
                && scope.has("Object", scope)
                && scope.get("Object", scope) instanceof Callable;
    }

    public static boolean isFunction(Object value) {
        return value instanceof Callable;
    }

    public static boolean isSymbol(Object value) {
        return value instanceof Symbol;
    }

    public static boolean isArrayLike(Object value) {
        return value instanceof NativeArray
                || (!(value instanceof Scriptable) && value instanceof Iterable<?>)
                || (value != null && value.getClass().isArray());
    }

    /** Whether the value is a script object of the given internal class, such as "Error". */
    public static boolean hasClassName(Object value, String className) {
        return value instanceof Scriptable scriptable && className.equals(scriptable.getClassName());
    }

    /** Property lookup that treats missing properties and failing getters as absent. */
    public static Object property(Scriptable object, String name) {
        try {
            Object value = ScriptableObject.getProperty(object, name);
            return value == Scriptable.NOT_FOUND ? null : value;
        } catch (RhinoException e) {
            return null;
        }
    }

    /** Text of a primitive as JavaScript's {@code String(value)} would produce it. */
    public static String primitiveText(Object value) {
        Object v = unwrap(value);
        if (v == null) {
            return "null";
        }
        if (isUndefined(v)) {
            return "undefined";
        }
        if (v instanceof java.math.BigInteger big) {
            return big + "n";
        }
        if (v instanceof Number number) {
            return numberText(number);
        }
        return v.toString();
    }

    /** JavaScript number formatting: {@code 8} rather than {@code 8.0}. */
    public static String numberText(Number number) {
        return ScriptRuntime.numberToString(number.doubleValue(), 10);
    }

    /** {@code [Function: name]}, or {@code [Function: anonymous]} for unnamed functions. */
    public static String functionLabel(Object function) {
        String name = functionName(function);
        return "[Function: " + (name.isEmpty() ? "anonymous" : name) + "]";
    }

    public static String functionName(Object function) {
        if (function instanceof BaseFunction base) {
            String name = base.getFunctionName();
            return name == null ? "" : name;
        }
        return "";
    }

    /** {@code Name: message} for script error objects. */
    public static String errorLabel(Scriptable error) {
        Object name = property(error, "name");
        Object message = property(error, "message");
        String nameText = name == null || isUndefined(name) ? "Error" : primitiveText(name);
        String messageText = message == null || isUndefined(message) ? "" : primitiveText(message);
        return messageText.isEmpty() ? nameText : nameText + ": " + messageText;
    }

    /** The message carried by a rejection reason or thrown value. */
    public static String reasonMessage(Object reason) {
        Object r = unwrap(reason);
        if (r instanceof Scriptable scriptable && !(r instanceof Callable)) {
            Object message = property(scriptable, "message");
            if (message != null && !isUndefined(message)) {
                return primitiveText(message);
            }
        }
        if (r instanceof Throwable throwable) {
            return String.valueOf(throwable.getMessage());
        }
        if (r instanceof Scriptable) {
            return "[object " + ((Scriptable) r).getClassName() + "]";
        }
        return primitiveText(r);
    }

    /** ISO text of a script {@code Date}, or {@code null} if it cannot be produced. */
    public static String dateText(Scriptable date) {
        Context cx = Context.getCurrentContext();
        if (cx == null) {
            return null;
        }
        try {
            return primitiveText(ScriptableObject.callMethod(cx, date, "toISOString", new Object[0]));
        } catch (RhinoException e) {
            return "Invalid Date";
        }
    }

    /**
     * Description of a symbol, or {@code null} for a symbol without one.
     */
    public static String symbolDescription(Object symbol) {
        String text = String.valueOf(symbol);
        Matcher matcher = SYMBOL_TEXT.matcher(text);
        String description = matcher.matches() ? matcher.group(1) : text;
        return description.isEmpty() ? null : description;
    }

    /** Elements of an array-like value, in index order. Holes read as {@code undefined}. */
    public static List<Object> elements(Object arrayLike) {
        List<Object> out = new ArrayList<>();
        if (arrayLike instanceof NativeArray array) {
            long length = array.getLength();
            for (int i = 0; i < length; i++) {
                Object element = array.get(i, array);
                out.add(element == Scriptable.NOT_FOUND ? Undefined.instance : element);
            }
        } else if (arrayLike instanceof Iterable<?> iterable) {
            for (Object element : iterable) {
                out.add(element);
            }
        } else if (arrayLike != null && arrayLike.getClass().isArray()) {
            int length = Array.getLength(arrayLike);
            for (int i = 0; i < length; i++) {
                out.add(Array.get(arrayLike, i));
            }
        }
        return out;
    }

    /** Enumerable own properties of an object, in enumeration order. */
    public static Map<String, Object> properties(Object object) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (object instanceof Scriptable scriptable) {
            for (Object id : scriptable.getIds()) {
                Object value;
                if (id instanceof Integer index) {
                    value = scriptable.get(index, scriptable);
                } else {
                    String key = String.valueOf(id);
                    value = scriptable.get(key, scriptable);
                }
                if (value != Scriptable.NOT_FOUND) {
                    out.put(String.valueOf(id), value);
                }
            }
        } else if (object instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return out;
    }

    private static boolean isPresent(Object value) {
        return value != null && !isUndefined(value);
    }
}
