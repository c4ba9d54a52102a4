package io.inlinerepl.core.spi;

/**
 * Persistent string store used by the transpile cache. Implementations report I/O failures as
 * {@link java.io.UncheckedIOException}.
 */
public interface KeyValueStore {

    /** Returns the stored value, or {@code null} when the key is absent. */
    String get(String key);

    void set(String key, String value);

    void remove(String key);
}
