package io.inlinerepl.core.engine.rhino;

import java.util.function.BooleanSupplier;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;

/**
 * Context factory for user code: interpreted ES6 with a bounded interpreter stack and an
 * instruction observer that terminates the script once cancellation was requested. The observer
 * is the fallback for code the loop guard cannot reach, such as long straight-line code or
 * unguarded loops.
 */
final class GuardedContextFactory extends ContextFactory {

    /** Instructions between two cancellation checks of the observer. */
    static final int OBSERVER_THRESHOLD = 10_000;

    static final int MAX_STACK_DEPTH = 4_000;

    private static final Object CANCEL_CHECK_KEY = new Object();

    @Override
    protected Context makeContext() {
        Context cx = super.makeContext();
        cx.setLanguageVersion(Context.VERSION_ES6);
        cx.setOptimizationLevel(-1);
        cx.setInstructionObserverThreshold(OBSERVER_THRESHOLD);
        cx.setMaximumInterpreterStackDepth(MAX_STACK_DEPTH);
        return cx;
    }

    @Override
    protected void observeInstructionCount(Context cx, int instructionCount) {
        Object check = cx.getThreadLocal(CANCEL_CHECK_KEY);
        if (check instanceof BooleanSupplier cancelled && cancelled.getAsBoolean()) {
            throw new ForcedTerminationException();
        }
    }

    static void installCancelProbe(Context cx, BooleanSupplier cancelled) {
        cx.putThreadLocal(CANCEL_CHECK_KEY, cancelled);
    }

    /**
     * Unwinds a cancelled script. Script {@code catch} clauses cannot intercept it; only the host
     * does.
     */
    static final class ForcedTerminationException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        ForcedTerminationException() {
            super("Execution cancelled", null, false, false);
        }
    }
}
