package io.inlinerepl.core.spi;

import java.util.List;

/**
 * The single callback through which instrumented code reports values. Every redirected console
 * call and every captured expression arrives here, tagged with its source line.
 */
@FunctionalInterface
public interface DebugSink {

    /**
     * Receives one sink invocation.
     *
     * @param line   1-based source line, or {@code null} when the host reports output that did not
     *               pass through instrumentation
     * @param values the invocation's values in argument order, never {@code null}
     */
    void capture(Integer line, List<Object> values);
}
