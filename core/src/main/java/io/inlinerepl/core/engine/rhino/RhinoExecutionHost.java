package io.inlinerepl.core.engine.rhino;

import io.inlinerepl.core.engine.value.JsValues;
import io.inlinerepl.core.error.ScriptExecutionException;
import io.inlinerepl.core.model.ErrorCategory;
import io.inlinerepl.core.spi.DebugSink;
import io.inlinerepl.core.spi.ExecutionHost;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Callable;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.EcmaError;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.JavaScriptException;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.WrappedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ExecutionHost} backed by the Rhino interpreter. Each run gets a fresh global scope with
 * the standard objects, {@code globalThis}, a {@code console} that forwards to the sink without
 * a line, and virtual-time timers.
 *
 * <p>
 * The instrumented source becomes the body of a function whose two parameters are the sink and
 * the cancellation predicate, invoked with the global object as {@code this}.
 */
public final class RhinoExecutionHost implements ExecutionHost {

    private static final Logger LOG = LoggerFactory.getLogger(RhinoExecutionHost.class);

    static final String SOURCE_NAME = "repl.js";

    /** Upper bound on timer callbacks fired per run. */
    public static final int MAX_TIMER_FIRINGS = 10_000;

    private static final List<String> CONSOLE_METHODS =
            List.of("log", "info", "warn", "error", "debug", "trace", "dir", "table");

    private final GuardedContextFactory contextFactory = new GuardedContextFactory();
    private final int maxTimerFirings;

    public RhinoExecutionHost() {
        this(MAX_TIMER_FIRINGS);
    }

    public RhinoExecutionHost(int maxTimerFirings) {
        if (maxTimerFirings < 0) {
            throw new IllegalArgumentException("maxTimerFirings must be >= 0, got: " + maxTimerFirings);
        }
        this.maxTimerFirings = maxTimerFirings;
    }

    @Override
    public void execute(String instrumentedSource, DebugSink sink, BooleanSupplier cancellationRequested) {
        Context cx = contextFactory.enterContext();
        try {
            GuardedContextFactory.installCancelProbe(cx, cancellationRequested);
            ScriptableObject scope = cx.initStandardObjects();
            if (!ScriptableObject.hasProperty(scope, "globalThis")) {
                ScriptableObject.defineProperty(scope, "globalThis", scope, ScriptableObject.DONTENUM);
            }
            installConsole(cx, scope, sink);
            TimerQueue timers = new TimerQueue(maxTimerFirings);
            installTimers(scope, timers);

            Function entry = compile(cx, scope, instrumentedSource);
            Object[] args = {bind(new SinkFunction(sink), scope), bind(new CancelPredicate(cancellationRequested), scope)};
            entry.call(cx, scope, scope, args);
            cx.processMicrotasks();
            int fired = timers.drain(cx, scope);
            LOG.debug("host.drained timers_fired={}", fired);
        } catch (GuardedContextFactory.ForcedTerminationException e) {
            throw new ScriptExecutionException(ErrorCategory.CANCELLED_MESSAGE, ErrorCategory.CANCELLED, e);
        } catch (JavaScriptException e) {
            throw ScriptExecutionException.fromThrown(JsValues.reasonMessage(e.getValue()), e);
        } catch (EcmaError e) {
            throw ScriptExecutionException.fromThrown(e.getErrorMessage(), e);
        } catch (WrappedException e) {
            Throwable wrapped = e.getWrappedException();
            throw new ScriptExecutionException(String.valueOf(wrapped.getMessage()), ErrorCategory.RUNTIME, e);
        } catch (EvaluatorException e) {
            throw new ScriptExecutionException(e.details(), ErrorCategory.RUNTIME, e);
        } finally {
            Context.exit();
        }
    }

    private static Function compile(Context cx, Scriptable scope, String source) {
        String wrapped = "function (" + SINK_NAME + ", " + CANCEL_PREDICATE_NAME + ") {\n" + source + "\n}";
        try {
            return cx.compileFunction(scope, wrapped, SOURCE_NAME, 0, null);
        } catch (EvaluatorException e) {
            throw new ScriptExecutionException(e.details(), ErrorCategory.SYNTAX, e);
        }
    }

    private static void installConsole(Context cx, ScriptableObject scope, DebugSink sink) {
        Scriptable console = cx.newObject(scope);
        for (String method : CONSOLE_METHODS) {
            ScriptableObject.putProperty(console, method, bind(new ConsoleFunction(sink), scope));
        }
        ScriptableObject.defineProperty(scope, "console", console, ScriptableObject.DONTENUM);
    }

    private static void installTimers(ScriptableObject scope, TimerQueue timers) {
        define(scope, "setTimeout", new ScheduleFunction(timers, false));
        define(scope, "setInterval", new ScheduleFunction(timers, true));
        define(scope, "clearTimeout", new ClearFunction(timers));
        define(scope, "clearInterval", new ClearFunction(timers));
    }

    private static void define(ScriptableObject scope, String name, BaseFunction function) {
        ScriptableObject.defineProperty(scope, name, bind(function, scope), ScriptableObject.DONTENUM);
    }

    private static BaseFunction bind(BaseFunction function, Scriptable scope) {
        function.setParentScope(scope);
        function.setPrototype(ScriptableObject.getFunctionPrototype(scope));
        return function;
    }

    /** {@code __debug(line, ...values)}: returns its single value, or an array of several. */
    private static final class SinkFunction extends BaseFunction {

        private static final long serialVersionUID = 1L;

        private final transient DebugSink sink;

        SinkFunction(DebugSink sink) {
            this.sink = sink;
        }

        @Override
        public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
            Integer line = args.length > 0 && args[0] instanceof Number n ? n.intValue() : null;
            Object[] values = args.length > 1 ? Arrays.copyOfRange(args, 1, args.length) : new Object[0];
            sink.capture(line, new ArrayList<>(Arrays.asList(values)));
            if (values.length == 0) {
                return Undefined.instance;
            }
            return values.length == 1 ? values[0] : cx.newArray(scope, values);
        }

        @Override
        public String getFunctionName() {
            return SINK_NAME;
        }
    }

    private static final class ConsoleFunction extends BaseFunction {

        private static final long serialVersionUID = 1L;

        private final transient DebugSink sink;

        ConsoleFunction(DebugSink sink) {
            this.sink = sink;
        }

        @Override
        public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
            sink.capture(null, new ArrayList<>(Arrays.asList(args)));
            return Undefined.instance;
        }
    }

    private static final class CancelPredicate extends BaseFunction {

        private static final long serialVersionUID = 1L;

        private final transient BooleanSupplier cancelled;

        CancelPredicate(BooleanSupplier cancelled) {
            this.cancelled = cancelled;
        }

        @Override
        public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
            return cancelled.getAsBoolean();
        }
    }

    private static final class ScheduleFunction extends BaseFunction {

        private static final long serialVersionUID = 1L;

        private final transient TimerQueue timers;
        private final boolean repeat;

        ScheduleFunction(TimerQueue timers, boolean repeat) {
            this.timers = timers;
            this.repeat = repeat;
        }

        @Override
        public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
            if (args.length == 0 || !(args[0] instanceof Callable callback)) {
                return 0;
            }
            long delay = args.length > 1 ? (long) Context.toNumber(args[1]) : 0L;
            Object[] rest = args.length > 2 ? Arrays.copyOfRange(args, 2, args.length) : new Object[0];
            return timers.schedule(callback, delay, rest, repeat);
        }
    }

    private static final class ClearFunction extends BaseFunction {

        private static final long serialVersionUID = 1L;

        private final transient TimerQueue timers;

        ClearFunction(TimerQueue timers) {
            this.timers = timers;
        }

        @Override
        public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
            if (args.length > 0 && args[0] instanceof Number id) {
                timers.clear(id.intValue());
            }
            return Undefined.instance;
        }
    }
}
