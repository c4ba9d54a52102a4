package io.inlinerepl.core.engine;

import io.inlinerepl.core.model.RunOutcome;
import io.inlinerepl.core.model.RunState;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A run submitted to a {@link ReplEngine}. Tracks the run's state, carries its cancellation
 * flag and exposes the eventual outcome.
 */
public final class RunHandle {

    private final String runId;
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CompletableFuture<RunOutcome> outcome = new CompletableFuture<>();

    RunHandle(String runId) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
    }

    public String runId() {
        return runId;
    }

    public RunState state() {
        return state.get();
    }

    /**
     * Requests cancellation. Guarded loops observe it at their next check; other code is stopped
     * by the host at its next instruction-count checkpoint. Has no effect once the run ended.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public CompletableFuture<RunOutcome> outcome() {
        return outcome;
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    void transition(RunState next) {
        RunState current = state.get();
        if (!current.canTransitionTo(next) || !state.compareAndSet(current, next)) {
            throw new IllegalStateException(
                    "Invalid run state transition for " + runId + ": " + current + " -> " + next);
        }
    }

    void complete(RunOutcome result) {
        outcome.complete(result);
    }

    void completeExceptionally(Throwable error) {
        outcome.completeExceptionally(error);
    }
}
