package io.inlinerepl.core.engine.value;

import io.inlinerepl.core.error.SerializationException;
import io.inlinerepl.core.model.Color;
import io.inlinerepl.core.model.ColoredElement;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Callable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns runtime values into {@link ColoredElement}s.
 *
 * <p>
 * Primitives map to a single colored leaf. Arrays and objects are decycled and pretty-printed.
 * Promise-likes are awaited: the returned future completes once the promise settles, with the
 * element of the resolved value, a compact {@code Response { status: N }} summary for values that
 * look like HTTP responses, or {@code Promise { <rejected> message }} on rejection.
 *
 * <p>
 * One instance serves one run. Script promises settle while the host drains its job queue; any
 * still unsettled when the run ends are completed as {@code Promise { <pending> }} by
 * {@link #abandonPending()}.
 */
public final class ValueSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ValueSerializer.class);

    static final String UNSERIALIZABLE_OBJECT = "[Object - unable to serialize]";
    static final String UNSERIALIZABLE_ARRAY = "[Array - unable to serialize]";
    static final String PENDING = "Promise { <pending> }";

    private static final Object PENDING_MARKER = new Object();
    private static final ColoredElement.Leaf UNDEFINED = ColoredElement.leaf("undefined", Color.GRAY);

    private final SerializerLimits limits;
    private final List<CompletableFuture<Object>> outstanding = new ArrayList<>();

    public ValueSerializer() {
        this(SerializerLimits.DEFAULTS);
    }

    public ValueSerializer(SerializerLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    /**
     * Serializes {@code value}. The future completes immediately unless the value is
     * promise-like; it completes exceptionally with {@link SerializationException} when the
     * value cannot be serialized at all.
     */
    public CompletableFuture<ColoredElement> stringify(Object value) {
        try {
            Object v = JsValues.unwrap(value);
            if (JsValues.hasCallableThen(v)) {
                return await(v);
            }
            return CompletableFuture.completedFuture(stringifySettled(v));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new SerializationException("Cannot serialize " + describe(value) + ": " + e.getMessage(), e));
        }
    }

    /** Flattens an element into its leaves; see {@link ColoredElement#flatten()}. */
    public static List<ColoredElement.Leaf> flatten(ColoredElement element) {
        return element.flatten();
    }

    /** Whether {@code element} is the rendering of {@code undefined}. */
    public static boolean isUndefined(ColoredElement element) {
        return UNDEFINED.equals(element);
    }

    /** Completes every promise still awaiting settlement as pending. */
    public void abandonPending() {
        List<CompletableFuture<Object>> snapshot;
        synchronized (outstanding) {
            snapshot = new ArrayList<>(outstanding);
            outstanding.clear();
        }
        int abandoned = 0;
        for (CompletableFuture<Object> settlement : snapshot) {
            if (settlement.complete(PENDING_MARKER)) {
                abandoned++;
            }
        }
        if (abandoned > 0) {
            LOG.debug("serializer.abandoned_pending count={}", abandoned);
        }
    }

    private ColoredElement stringifySettled(Object v) {
        if (v == null) {
            return ColoredElement.leaf("null", Color.GRAY);
        }
        if (JsValues.isUndefined(v)) {
            return UNDEFINED;
        }
        if (v instanceof Boolean b) {
            return b ? ColoredElement.leaf("true", Color.TRUE) : ColoredElement.leaf("false", Color.FALSE);
        }
        if (v instanceof BigInteger big) {
            return ColoredElement.leaf(big + "n", Color.NUMBER);
        }
        if (v instanceof Number number) {
            return ColoredElement.leaf(JsValues.numberText(number), Color.NUMBER);
        }
        if (v instanceof CharSequence text) {
            return ColoredElement.leaf("\"" + text + "\"", Color.STRING);
        }
        if (JsValues.isSymbol(v)) {
            String description = JsValues.symbolDescription(v);
            Object inner = description == null ? Undefined.instance : description;
            return ColoredElement.composite(
                    null,
                    ColoredElement.leaf("Symbol(", Color.GRAY),
                    stringifySettled(inner),
                    ColoredElement.leaf(")", Color.GRAY));
        }
        if (JsValues.isGlobalObject(v)) {
            return ColoredElement.leaf(GlobalObjectFormatter.format((ScriptableObject) v), Color.GRAY);
        }
        if (JsValues.isFunction(v)) {
            return ColoredElement.leaf(JsValues.functionLabel(v), Color.GRAY);
        }
        if (JsValues.hasClassName(v, "Error")) {
            return ColoredElement.leaf(JsValues.errorLabel((Scriptable) v), Color.GRAY);
        }
        if (JsValues.isArrayLike(v)) {
            return ColoredElement.leaf(printGraph(v, UNSERIALIZABLE_ARRAY), null);
        }
        if (v instanceof Scriptable || v instanceof Map<?, ?>) {
            return ColoredElement.leaf(printGraph(v, UNSERIALIZABLE_OBJECT), Color.GRAY);
        }
        return ColoredElement.leaf(String.valueOf(v), Color.GRAY);
    }

    private String printGraph(Object v, String fallback) {
        try {
            return LiteralPrinter.print(new Decycler(limits).decycle(v));
        } catch (RuntimeException e) {
            LOG.debug("Object graph could not be printed: {}", e.getMessage());
            return fallback;
        }
    }

    // --- Promise handling ---

    private CompletableFuture<ColoredElement> await(Object promise) {
        CompletableFuture<Object> settlement = new CompletableFuture<>();
        synchronized (outstanding) {
            outstanding.add(settlement);
        }
        subscribe(promise, settlement);
        return settlement.handle((resolved, failure) -> {
                    synchronized (outstanding) {
                        outstanding.remove(settlement);
                    }
                    if (failure != null) {
                        return CompletableFuture.completedFuture(rejected(failure));
                    }
                    if (resolved == PENDING_MARKER) {
                        ColoredElement pending = ColoredElement.leaf(PENDING, Color.GRAY);
                        return CompletableFuture.completedFuture(pending);
                    }
                    Object value = JsValues.unwrap(resolved);
                    if (JsValues.looksLikeHttpResponse(value)) {
                        return CompletableFuture.completedFuture(httpSummary(value));
                    }
                    return stringify(value);
                })
                .thenCompose(f -> f);
    }

    private static void subscribe(Object promise, CompletableFuture<Object> settlement) {
        if (promise instanceof CompletionStage<?> stage) {
            stage.whenComplete((value, error) -> {
                if (error != null) {
                    settlement.completeExceptionally(new PromiseRejection(unwrapCompletion(error)));
                } else {
                    settlement.complete(value);
                }
            });
            return;
        }
        Scriptable thenable = (Scriptable) promise;
        Context cx = Context.getCurrentContext();
        if (cx == null) {
            LOG.debug("No active script context, promise left pending");
            return;
        }
        Callable then = (Callable) ScriptableObject.getProperty(thenable, "then");
        Scriptable scope = ScriptableObject.getTopLevelScope(thenable);
        then.call(cx, scope, thenable, new Object[] {
            new SettleFunction(settlement::complete),
            new SettleFunction(reason -> settlement.completeExceptionally(new PromiseRejection(reason)))
        });
    }

    private static ColoredElement rejected(Throwable failure) {
        Throwable cause = unwrapCompletion(failure);
        Object reason = cause instanceof PromiseRejection rejection ? rejection.reason() : cause;
        return ColoredElement.leaf("Promise { <rejected> " + JsValues.reasonMessage(reason) + " }", Color.ERROR);
    }

    private static ColoredElement httpSummary(Object response) {
        Object status = response instanceof Scriptable scriptable
                ? JsValues.property(scriptable, "status")
                : ((Map<?, ?>) response).get("status");
        return ColoredElement.leaf("Response { status: " + JsValues.primitiveText(status) + " }", Color.GRAY);
    }

    private static Throwable unwrapCompletion(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /** Carries a rejection reason, which may be any script value, through a future. */
    static final class PromiseRejection extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final transient Object reason;

        PromiseRejection(Object reason) {
            super(null, null, false, false);
            this.reason = reason;
        }

        Object reason() {
            return reason;
        }
    }

    /** Script-callable settlement callback passed to a promise's {@code then}. */
    private static final class SettleFunction extends BaseFunction {

        private static final long serialVersionUID = 1L;

        private final transient Consumer<Object> target;

        SettleFunction(Consumer<Object> target) {
            this.target = target;
        }

        @Override
        public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
            target.accept(args.length > 0 ? args[0] : Undefined.instance);
            return Undefined.instance;
        }
    }
}
