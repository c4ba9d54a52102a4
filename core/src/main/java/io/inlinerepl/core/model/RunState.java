package io.inlinerepl.core.model;

/**
 * Run state machine: {@code IDLE -> TRANSFORMING -> EXECUTING -> COMPLETED | FAILED | CANCELLED}.
 * A transform failure goes straight from {@code TRANSFORMING} to {@code FAILED}.
 */
public enum RunState {
    IDLE,
    TRANSFORMING,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(RunState next) {
        return switch (this) {
            case IDLE -> next == TRANSFORMING || next == EXECUTING;
            case TRANSFORMING -> next == EXECUTING || next == FAILED || next == CANCELLED;
            case EXECUTING -> next.isTerminal();
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
