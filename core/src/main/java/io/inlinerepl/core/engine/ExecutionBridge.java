package io.inlinerepl.core.engine;

import io.inlinerepl.core.engine.value.JsValues;
import io.inlinerepl.core.engine.value.SerializerLimits;
import io.inlinerepl.core.engine.value.ValueSerializer;
import io.inlinerepl.core.error.ScriptExecutionException;
import io.inlinerepl.core.model.ErrorCategory;
import io.inlinerepl.core.model.ExecutionResult;
import io.inlinerepl.core.model.RunOptions;
import io.inlinerepl.core.spi.DebugSink;
import io.inlinerepl.core.spi.ExecutionHost;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects an {@link ExecutionHost} to a result consumer. Every sink invocation is serialized and
 * delivered as an {@link ExecutionResult} in settlement order; a thrown error ends the run with
 * exactly one error result, after which nothing else is delivered.
 */
public final class ExecutionBridge {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionBridge.class);

    private final ExecutionHost host;
    private final SerializerLimits limits;

    public ExecutionBridge(ExecutionHost host) {
        this(host, SerializerLimits.DEFAULTS);
    }

    public ExecutionBridge(ExecutionHost host, SerializerLimits limits) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    /**
     * Executes instrumented code and streams its results to {@code onResult}.
     *
     * @return delivered result count and the terminating error category ({@code null} on
     *         success)
     */
    public Report execute(
            String instrumentedSource,
            RunOptions options,
            Consumer<ExecutionResult> onResult,
            BooleanSupplier cancellationRequested) {
        Objects.requireNonNull(instrumentedSource, "instrumentedSource must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(onResult, "onResult must not be null");
        ValueSerializer serializer = new ValueSerializer(limits);
        ResultStream stream = new ResultStream(serializer, options, onResult);
        try {
            host.execute(instrumentedSource, stream, cancellationRequested);
            serializer.abandonPending();
            stream.close();
            return new Report(stream.delivered(), null);
        } catch (ScriptExecutionException e) {
            LOG.debug("bridge.script_error category={} message={}", e.category(), e.getMessage());
            return new Report(stream.fail(e.getMessage()), e.category());
        } catch (RuntimeException e) {
            LOG.warn("bridge.host_failure message={}", e.getMessage(), e);
            return new Report(stream.fail(String.valueOf(e.getMessage())), ErrorCategory.RUNTIME);
        }
    }

    /**
     * Outcome of one execution.
     *
     * @param resultCount   results delivered, including the error result
     * @param errorCategory category of the error that ended the run, or {@code null}
     */
    public record Report(int resultCount, ErrorCategory errorCategory) {

        public boolean failed() {
            return errorCategory != null;
        }
    }

    private static final class ResultStream implements DebugSink {

        private final ValueSerializer serializer;
        private final RunOptions options;
        private final Consumer<ExecutionResult> onResult;
        private boolean closed;
        private int delivered;

        ResultStream(ValueSerializer serializer, RunOptions options, Consumer<ExecutionResult> onResult) {
            this.serializer = serializer;
            this.options = options;
            this.onResult = onResult;
        }

        @Override
        public void capture(Integer line, List<Object> values) {
            Object value;
            if (values.isEmpty()) {
                value = Undefined.instance;
            } else {
                value = values.size() == 1 ? values.get(0) : new ArrayList<>(values);
            }
            if (!options.showUndefined() && JsValues.isUndefined(value)) {
                return;
            }
            serializer.stringify(value).whenComplete((element, error) -> {
                if (error != null) {
                    LOG.debug("bridge.dropped line={} reason={}", line, error.getMessage());
                    return;
                }
                // a promise settling to undefined follows the same rule as a bare undefined
                if (!options.showUndefined() && ValueSerializer.isUndefined(element)) {
                    return;
                }
                deliver(ExecutionResult.execution(line, element));
            });
        }

        synchronized int delivered() {
            return delivered;
        }

        synchronized void close() {
            closed = true;
        }

        synchronized int fail(String message) {
            closed = true;
            send(ExecutionResult.error(message));
            return delivered;
        }

        private synchronized void deliver(ExecutionResult result) {
            if (closed) {
                return;
            }
            send(result);
        }

        private void send(ExecutionResult result) {
            delivered++;
            try {
                onResult.accept(result);
            } catch (RuntimeException e) {
                LOG.warn("Result consumer failed", e);
            }
        }
    }
}
