package io.inlinerepl.core.engine;

import io.inlinerepl.core.engine.ast.JsFrontEnd;
import io.inlinerepl.core.engine.ast.ParsedProgram;
import io.inlinerepl.core.error.SourceParseException;
import io.inlinerepl.core.error.TransformPassException;
import io.inlinerepl.core.model.SourceProgram;
import io.inlinerepl.core.model.TransformOptions;
import java.util.Objects;

/**
 * The uncached round trip: parse, run the pipeline, render.
 */
public final class Transpiler {

    private final JsFrontEnd frontEnd;
    private final TransformPipeline pipeline;

    public Transpiler() {
        this(new JsFrontEnd(), new TransformPipeline());
    }

    public Transpiler(JsFrontEnd frontEnd, TransformPipeline pipeline) {
        this.frontEnd = Objects.requireNonNull(frontEnd, "frontEnd must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    /**
     * Produces instrumented source.
     *
     * @throws SourceParseException   if the source is malformed
     * @throws TransformPassException if a pass fails
     */
    public String transpile(SourceProgram source, TransformOptions options) {
        ParsedProgram program = frontEnd.parse(source);
        pipeline.apply(program, options);
        return program.render();
    }

    public TransformPipeline pipeline() {
        return pipeline;
    }
}
