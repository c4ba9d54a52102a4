package io.inlinerepl.core.error;

/**
 * The persisted transpile cache snapshot is unreadable. The cache recovers by discarding it, so
 * this exception never escapes the cache.
 */
public final class CacheCorruptionException extends ReplException {

    private static final long serialVersionUID = 1L;

    public CacheCorruptionException(String message) {
        super(message, Phase.PERSISTENCE);
    }

    public CacheCorruptionException(String message, Throwable cause) {
        super(message, cause, Phase.PERSISTENCE);
    }
}
