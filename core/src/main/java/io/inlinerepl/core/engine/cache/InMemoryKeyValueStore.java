package io.inlinerepl.core.engine.cache;

import io.inlinerepl.core.spi.KeyValueStore;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** {@link KeyValueStore} kept in a map; contents last as long as the instance. */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public String get(String key) {
        return entries.get(key);
    }

    @Override
    public void set(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }
}
