package io.inlinerepl.core.engine.pass;

import io.inlinerepl.core.engine.ast.ParsedProgram;
import io.inlinerepl.core.model.TransformOptions;

/**
 * One rewriting step of the transform pipeline. Passes mutate the program tree in place and must
 * leave debug-sink calls produced by earlier passes alone.
 */
public interface TransformPass {

    /** Short name used in logs and failure reports. */
    String name();

    /** Whether the pass runs for the given options. */
    boolean isEnabled(TransformOptions options);

    /** Rewrites {@code program} in place. */
    void apply(ParsedProgram program, PassContext context);
}
