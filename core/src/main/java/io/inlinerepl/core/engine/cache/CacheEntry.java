package io.inlinerepl.core.engine.cache;

import java.util.Map;

/**
 * A cached transform output.
 *
 * @param hash      content-addressed key
 * @param output    instrumented source
 * @param options   output-affecting options the entry was produced with
 * @param timestamp creation time, epoch milliseconds
 * @param hitCount  number of lookups served by this entry
 */
public record CacheEntry(String hash, String output, Map<String, Object> options, long timestamp, long hitCount) {

    public CacheEntry {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    CacheEntry withHit() {
        return new CacheEntry(hash, output, options, timestamp, hitCount + 1);
    }

    long ageMillis(long now) {
        return now - timestamp;
    }
}
