package io.inlinerepl.core.engine;

import io.inlinerepl.core.engine.cache.CacheKeys;
import io.inlinerepl.core.engine.cache.CacheSettings;
import io.inlinerepl.core.engine.cache.TranspileCache;
import io.inlinerepl.core.engine.rhino.RhinoExecutionHost;
import io.inlinerepl.core.engine.value.SerializerLimits;
import io.inlinerepl.core.error.TransformFailureException;
import io.inlinerepl.core.model.CacheStats;
import io.inlinerepl.core.model.ErrorCategory;
import io.inlinerepl.core.model.ExecutionResult;
import io.inlinerepl.core.model.RunOptions;
import io.inlinerepl.core.model.RunOutcome;
import io.inlinerepl.core.model.RunState;
import io.inlinerepl.core.model.SourceProgram;
import io.inlinerepl.core.model.TransformOptions;
import io.inlinerepl.core.spi.ExecutionHost;
import io.inlinerepl.core.spi.TelemetryListener;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point of the REPL core: transforms source (through the transpile cache) and runs the
 * instrumented result, streaming {@link ExecutionResult}s to a consumer.
 *
 * <p>
 * Thread safety: the engine may be shared. Each run owns its serializer, state and
 * cancellation flag; the cache synchronizes internally.
 */
public final class ReplEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ReplEngine.class);

    /** MDC key holding the current run id. */
    public static final String MDC_RUN_ID = "runId";

    private final Transpiler transpiler;
    private final TranspileCache cache;
    private final boolean ownsCache;
    private final ExecutionBridge bridge;
    private final TelemetryListener telemetryListener;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final AtomicLong runSequence = new AtomicLong();

    private ReplEngine(Builder builder) {
        this.transpiler = builder.transpiler != null ? builder.transpiler : new Transpiler();
        this.ownsCache = builder.cache == null;
        this.cache = builder.cache != null
                ? builder.cache
                : new TranspileCache(CacheSettings.DEFAULTS, null, Clock.systemUTC(), null, builder.telemetryListener);
        ExecutionHost host = builder.host != null ? builder.host : new RhinoExecutionHost();
        this.bridge = new ExecutionBridge(host, builder.limits);
        this.telemetryListener = builder.telemetryListener; // nullable
        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null
                ? builder.executor
                : Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "repl-run");
                    t.setDaemon(true);
                    return t;
                });
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Transforms JavaScript source; see {@link #transform(SourceProgram, TransformOptions)}. */
    public String transform(String source, TransformOptions options) {
        return transform(SourceProgram.javascript(source), options);
    }

    /**
     * Returns the instrumented form of {@code source}, from the cache when an entry for the same
     * source and output-affecting options exists.
     *
     * @throws io.inlinerepl.core.error.SourceParseException   if the source does not parse
     * @throws io.inlinerepl.core.error.TransformPassException if a pass fails
     */
    public String transform(SourceProgram source, TransformOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        long start = System.nanoTime();
        String hash = CacheKeys.keyOf(source, options);
        Optional<String> cached = cache.get(source, options);
        if (cached.isPresent()) {
            long durationMs = elapsedMs(start);
            LOG.debug("transform.completed hash={} cache_hit=true duration_ms={}", hash, durationMs);
            notifyTransformCompleted(hash, true, durationMs);
            return cached.get();
        }
        String output;
        try {
            output = transpiler.transpile(source, options);
        } catch (TransformFailureException e) {
            long durationMs = elapsedMs(start);
            LOG.info("transform.failed category={} detail={}", e.category(), e.getMessage());
            notifyTransformFailed(e.getMessage(), durationMs);
            throw e;
        }
        cache.set(source, options, output);
        long durationMs = elapsedMs(start);
        LOG.debug("transform.completed hash={} cache_hit=false duration_ms={}", hash, durationMs);
        notifyTransformCompleted(hash, false, durationMs);
        return output;
    }

    /**
     * Transforms and runs {@code source} on the calling thread. A transform failure ends the run
     * in {@link RunState#FAILED} with a single error result.
     */
    public RunOutcome evaluate(SourceProgram source, TransformOptions options, Consumer<ExecutionResult> onResult) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(onResult, "onResult must not be null");
        RunHandle run = newRun();
        return withRunContext(run, () -> evaluateInternal(run, source, options, onResult));
    }

    /** Runs already instrumented code on the calling thread. */
    public RunOutcome run(String instrumented, Consumer<ExecutionResult> onResult, RunOptions options) {
        Objects.requireNonNull(instrumented, "instrumented must not be null");
        Objects.requireNonNull(onResult, "onResult must not be null");
        Objects.requireNonNull(options, "options must not be null");
        RunHandle run = newRun();
        return withRunContext(run, () -> executeInternal(run, instrumented, options, onResult, System.nanoTime()));
    }

    /**
     * Transforms and runs {@code source} on the engine's executor.
     *
     * @return a handle to cancel the run and to await its outcome
     */
    public RunHandle submit(SourceProgram source, TransformOptions options, Consumer<ExecutionResult> onResult) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(onResult, "onResult must not be null");
        RunHandle run = newRun();
        CompletableFuture.runAsync(
                () -> {
                    try {
                        run.complete(withRunContext(run, () -> evaluateInternal(run, source, options, onResult)));
                    } catch (RuntimeException e) {
                        LOG.error("run.crashed run_id={}", run.runId(), e);
                        run.completeExceptionally(e);
                    }
                },
                executor);
        return run;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public TranspileCache cache() {
        return cache;
    }

    /** Closes the cache and executor when this engine created them. */
    @Override
    public void close() {
        if (ownsCache) {
            cache.close();
        }
        if (ownsExecutor) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private RunHandle newRun() {
        return new RunHandle("run-" + runSequence.incrementAndGet());
    }

    private RunOutcome withRunContext(RunHandle run, Supplier<RunOutcome> body) {
        MDC.put(MDC_RUN_ID, run.runId());
        try {
            return body.get();
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private RunOutcome evaluateInternal(
            RunHandle run, SourceProgram source, TransformOptions options, Consumer<ExecutionResult> onResult) {
        long start = System.nanoTime();
        run.transition(RunState.TRANSFORMING);
        String instrumented;
        try {
            instrumented = transform(source, options);
        } catch (TransformFailureException e) {
            deliver(onResult, ExecutionResult.error(e.getMessage()));
            return finish(run, RunState.FAILED, 1, e.category(), start);
        }
        return executeInternal(run, instrumented, options.runOptions(), onResult, start);
    }

    private RunOutcome executeInternal(
            RunHandle run, String instrumented, RunOptions options, Consumer<ExecutionResult> onResult, long start) {
        run.transition(RunState.EXECUTING);
        if (run.isCancelRequested()) {
            deliver(onResult, ExecutionResult.error(ErrorCategory.CANCELLED_MESSAGE));
            return finish(run, RunState.CANCELLED, 1, ErrorCategory.CANCELLED, start);
        }
        ExecutionBridge.Report report = bridge.execute(instrumented, options, onResult, run::isCancelRequested);
        RunState terminal = report.failed() ? report.errorCategory().terminalState() : RunState.COMPLETED;
        return finish(run, terminal, report.resultCount(), report.errorCategory(), start);
    }

    private RunOutcome finish(RunHandle run, RunState state, int resultCount, ErrorCategory category, long start) {
        run.transition(state);
        long durationMs = elapsedMs(start);
        LOG.info(
                "run.completed run_id={} state={} results={} error_category={} duration_ms={}",
                run.runId(),
                state,
                resultCount,
                category,
                durationMs);
        notifyRunCompleted(run.runId(), state, resultCount, durationMs);
        return new RunOutcome(run.runId(), state, resultCount, category, durationMs);
    }

    private static void deliver(Consumer<ExecutionResult> onResult, ExecutionResult result) {
        try {
            onResult.accept(result);
        } catch (RuntimeException e) {
            LOG.warn("Result consumer failed", e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    // --- Telemetry notification helpers ---
    // Listener exceptions are caught and logged; they never affect a run.

    private void notifyTransformCompleted(String hash, boolean cacheHit, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onTransformCompleted(
                    new TelemetryListener.TransformCompletedEvent(hash, cacheHit, durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onTransformCompleted failed", e);
        }
    }

    private void notifyTransformFailed(String errorDetail, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onTransformFailed(new TelemetryListener.TransformFailedEvent(errorDetail, durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onTransformFailed failed", e);
        }
    }

    private void notifyRunCompleted(String runId, RunState state, int resultCount, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onRunCompleted(
                    new TelemetryListener.RunCompletedEvent(runId, state, resultCount, durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onRunCompleted failed", e);
        }
    }

    /** Builder for {@link ReplEngine}. Every collaborator is optional. */
    public static final class Builder {

        private Transpiler transpiler;
        private TranspileCache cache;
        private ExecutionHost host;
        private SerializerLimits limits = SerializerLimits.DEFAULTS;
        private TelemetryListener telemetryListener;
        private ExecutorService executor;

        private Builder() {}

        public Builder transpiler(Transpiler transpiler) {
            this.transpiler = transpiler;
            return this;
        }

        /** A cache supplied here is not closed by the engine. Default: a private in-memory cache. */
        public Builder cache(TranspileCache cache) {
            this.cache = cache;
            return this;
        }

        /** Default: {@link RhinoExecutionHost}. */
        public Builder host(ExecutionHost host) {
            this.host = host;
            return this;
        }

        public Builder serializerLimits(SerializerLimits limits) {
            this.limits = Objects.requireNonNull(limits, "limits must not be null");
            return this;
        }

        public Builder telemetryListener(TelemetryListener telemetryListener) {
            this.telemetryListener = telemetryListener;
            return this;
        }

        /** Executor for {@link ReplEngine#submit}. A supplied executor is not shut down. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public ReplEngine build() {
            return new ReplEngine(this);
        }
    }
}
