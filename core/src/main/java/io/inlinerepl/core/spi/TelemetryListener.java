package io.inlinerepl.core.spi;

import io.inlinerepl.core.model.RunState;

/**
 * SPI for observability hooks.
 *
 * <p>
 * Adapters bridge these events to their metrics system of choice; the core has no telemetry
 * dependency. All methods receive immutable event objects. Implementations must be thread-safe
 * and non-blocking. Exceptions thrown by listeners are caught by the engine and logged; they do
 * not affect transforms or runs.
 */
public interface TelemetryListener {

    /**
     * Called when a transform finished, from cache or by running the pipeline.
     *
     * @param event contains hash, cacheHit, durationMs
     */
    void onTransformCompleted(TransformCompletedEvent event);

    /**
     * Called when parsing or a pass failed.
     *
     * @param event contains errorDetail, durationMs
     */
    void onTransformFailed(TransformFailedEvent event);

    /**
     * Called when a run reached a terminal state.
     *
     * @param event contains runId, state, resultCount, durationMs
     */
    void onRunCompleted(RunCompletedEvent event);

    /**
     * Called when the cache evicted an entry to make room.
     *
     * @param event contains hash, score
     */
    void onCacheEvicted(CacheEvictedEvent event);

    // --- Event records ---

    /** Event emitted when a transform completes. */
    record TransformCompletedEvent(String hash, boolean cacheHit, long durationMs) {}

    /** Event emitted when a transform fails. */
    record TransformFailedEvent(String errorDetail, long durationMs) {}

    /** Event emitted when a run ends. */
    record RunCompletedEvent(String runId, RunState state, int resultCount, long durationMs) {}

    /** Event emitted on capacity eviction. */
    record CacheEvictedEvent(String hash, double score) {}
}
