package io.inlinerepl.core.model;

/**
 * Snapshot of transpile cache statistics.
 *
 * @param size        live entries
 * @param hits        lookups served from the cache
 * @param misses      lookups that were absent or expired
 * @param hitRate     rounded hit percentage, 0 to 100
 * @param memoryBytes rough footprint estimate of the stored entries
 */
public record CacheStats(int size, long hits, long misses, int hitRate, long memoryBytes) {}
