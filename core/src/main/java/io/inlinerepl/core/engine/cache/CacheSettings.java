package io.inlinerepl.core.engine.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Transpile cache tuning.
 *
 * @param maxSize         entries kept before an insert evicts one
 * @param ttl             age after which an entry is treated as absent
 * @param saveDebounce    quiet period before a scheduled snapshot write
 * @param cleanupInterval period of the background expiry sweep; zero disables it
 */
public record CacheSettings(int maxSize, Duration ttl, Duration saveDebounce, Duration cleanupInterval) {

    /** 100 entries, 24 hour TTL, 1 second save debounce, 10 minute cleanup. */
    public static final CacheSettings DEFAULTS =
            new CacheSettings(100, Duration.ofHours(24), Duration.ofSeconds(1), Duration.ofMinutes(10));

    public CacheSettings {
        Objects.requireNonNull(ttl, "ttl must not be null");
        Objects.requireNonNull(saveDebounce, "saveDebounce must not be null");
        Objects.requireNonNull(cleanupInterval, "cleanupInterval must not be null");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        if (saveDebounce.isNegative()) {
            throw new IllegalArgumentException("saveDebounce must not be negative, got: " + saveDebounce);
        }
        if (cleanupInterval.isNegative()) {
            throw new IllegalArgumentException("cleanupInterval must not be negative, got: " + cleanupInterval);
        }
    }

    public CacheSettings withMaxSize(int maxSize) {
        return new CacheSettings(maxSize, ttl, saveDebounce, cleanupInterval);
    }
}
