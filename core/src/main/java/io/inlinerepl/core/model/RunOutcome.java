package io.inlinerepl.core.model;

/**
 * Summary of a finished run.
 *
 * @param runId         identifier used in logs and telemetry
 * @param state         terminal state
 * @param resultCount   number of results delivered, including the error result
 * @param errorCategory category of the terminating error, {@code null} when completed
 * @param durationMs    wall-clock duration
 */
public record RunOutcome(String runId, RunState state, int resultCount, ErrorCategory errorCategory, long durationMs) {

    public boolean completed() {
        return state == RunState.COMPLETED;
    }
}
