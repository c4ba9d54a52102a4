package io.inlinerepl.core.model;

/**
 * Options consulted while executing instrumented code.
 *
 * @param showUndefined emit a result for a lone {@code undefined} value
 */
public record RunOptions(boolean showUndefined) {

    public static final RunOptions DEFAULTS = new RunOptions(false);
}
