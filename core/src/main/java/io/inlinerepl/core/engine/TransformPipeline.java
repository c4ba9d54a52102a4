package io.inlinerepl.core.engine;

import io.inlinerepl.core.engine.ast.NameAllocator;
import io.inlinerepl.core.engine.ast.ParsedProgram;
import io.inlinerepl.core.engine.pass.ConsoleBridgePass;
import io.inlinerepl.core.engine.pass.GuardBudget;
import io.inlinerepl.core.engine.pass.LoopGuardPass;
import io.inlinerepl.core.engine.pass.MagicCommentPass;
import io.inlinerepl.core.engine.pass.PassContext;
import io.inlinerepl.core.engine.pass.StrayExpressionPass;
import io.inlinerepl.core.engine.pass.TopLevelThisPass;
import io.inlinerepl.core.engine.pass.TransformPass;
import io.inlinerepl.core.error.TransformPassException;
import io.inlinerepl.core.model.TransformOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the enabled passes over one program in a fixed order: top-level {@code this} rewrite,
 * console bridge, marker-comment capture, top-level capture, loop guard.
 *
 * <p>
 * Later passes see the sink calls created by earlier ones and skip them, which is what keeps a
 * value from being wrapped twice.
 */
public final class TransformPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TransformPipeline.class);

    private final List<TransformPass> passes;
    private final GuardBudget budget;

    public TransformPipeline() {
        this(GuardBudget.DEFAULT);
    }

    public TransformPipeline(GuardBudget budget) {
        this(
                budget,
                List.of(
                        new TopLevelThisPass(),
                        new ConsoleBridgePass(),
                        new MagicCommentPass(),
                        new StrayExpressionPass(),
                        new LoopGuardPass()));
    }

    TransformPipeline(GuardBudget budget, List<TransformPass> passes) {
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.passes = List.copyOf(passes);
    }

    /** Names of the passes that run for {@code options}, in execution order. */
    public List<String> enabledPasses(TransformOptions options) {
        List<String> names = new ArrayList<>();
        for (TransformPass pass : passes) {
            if (pass.isEnabled(options)) {
                names.add(pass.name());
            }
        }
        return names;
    }

    /**
     * Rewrites {@code program} in place.
     *
     * @throws TransformPassException if a pass fails
     */
    public void apply(ParsedProgram program, TransformOptions options) {
        PassContext context = new PassContext(options, budget, new NameAllocator(program.root()));
        for (TransformPass pass : passes) {
            if (!pass.isEnabled(options)) {
                continue;
            }
            long start = System.nanoTime();
            try {
                pass.apply(program, context);
            } catch (RuntimeException e) {
                throw new TransformPassException(
                        "Transform pass '" + pass.name() + "' failed: " + e.getMessage(), pass.name(), e);
            }
            LOG.trace("pass.applied pass={} duration_us={}", pass.name(), (System.nanoTime() - start) / 1_000);
        }
    }
}
