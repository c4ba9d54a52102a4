package io.inlinerepl.core.spi;

import io.inlinerepl.core.error.ScriptExecutionException;
import java.util.function.BooleanSupplier;

/**
 * Runs instrumented source. The host binds exactly two names for the program: the debug sink
 * ({@code __debug}) and the cancellation predicate ({@code __isCancelled}). Nothing else is
 * reported back except a single thrown error.
 *
 * <p>
 * Implementations must drain all work the program scheduled (promise jobs, timers) before
 * returning, so that every sink invocation has happened by then.
 */
public interface ExecutionHost {

    /** Identifier of the debug sink inside instrumented code. */
    String SINK_NAME = "__debug";

    /** Identifier of the cancellation predicate inside instrumented code. */
    String CANCEL_PREDICATE_NAME = "__isCancelled";

    /**
     * Executes the program to completion.
     *
     * @param instrumentedSource    output of the transform pipeline
     * @param sink                  receives every debug-sink invocation
     * @param cancellationRequested polled by guarded loops and by the host's forced-termination
     *                              fallback
     * @throws ScriptExecutionException when the program throws; the message is the program's
     *                                  error message
     */
    void execute(String instrumentedSource, DebugSink sink, BooleanSupplier cancellationRequested);
}
