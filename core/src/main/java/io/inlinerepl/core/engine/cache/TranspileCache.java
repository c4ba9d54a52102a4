package io.inlinerepl.core.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.inlinerepl.core.error.CacheCorruptionException;
import io.inlinerepl.core.model.CacheStats;
import io.inlinerepl.core.model.SourceProgram;
import io.inlinerepl.core.model.TransformOptions;
import io.inlinerepl.core.spi.KeyValueStore;
import io.inlinerepl.core.spi.TelemetryListener;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Content-addressed cache of transform outputs with optional persistence.
 *
 * <p>
 * Entries expire after the configured TTL. When full, an insert evicts the entry with the lowest
 * score {@code hitCount - age / ttl}; ties go to the entry inserted first. The score can go
 * negative for old, unused entries.
 *
 * <p>
 * Persistence: every mutation schedules a snapshot write of
 * {@code {version: 1, entries: [[hash, entry], ...], stats: {hits, misses}}} to the
 * {@link KeyValueStore}, debounced so a burst of inserts produces one write. Construction restores
 * the previous snapshot; an unreadable snapshot or one with another version is discarded. Storage
 * failures are logged and never propagate.
 *
 * <p>
 * Thread safety: all public methods are synchronized. Saves and the periodic expiry sweep run on
 * the scheduler thread.
 */
public final class TranspileCache implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TranspileCache.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    /** Version written into, and required from, persisted snapshots. */
    public static final int SNAPSHOT_VERSION = 1;

    /** Store key of the persisted snapshot. */
    public static final String STORAGE_KEY = "inline-repl-transpile-cache";

    /** Fixed per-entry overhead added to the memory estimate. */
    static final int ENTRY_OVERHEAD_BYTES = 100;

    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final CacheSettings settings;
    private final KeyValueStore store;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final TelemetryListener telemetryListener;

    private ScheduledFuture<?> pendingSave;
    private ScheduledFuture<?> cleanupTask;
    private long hits;
    private long misses;
    private boolean closed;

    /**
     * Creates a cache that persists to {@code store} (may be {@code null} for a memory-only
     * cache) and restores any previous snapshot from it.
     */
    public TranspileCache(CacheSettings settings, KeyValueStore store) {
        this(settings, store, Clock.systemUTC(), null, null);
    }

    /**
     * Full constructor.
     *
     * @param settings          size, TTL and timing
     * @param store             snapshot store, or {@code null} for no persistence
     * @param clock             time source for ages and timestamps
     * @param scheduler         runs debounced saves and the expiry sweep; {@code null} creates a
     *                          private daemon scheduler that {@link #close()} shuts down
     * @param telemetryListener receives eviction events, may be {@code null}
     */
    public TranspileCache(
            CacheSettings settings,
            KeyValueStore store,
            Clock clock,
            ScheduledExecutorService scheduler,
            TelemetryListener telemetryListener) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.store = store;
        this.telemetryListener = telemetryListener;
        if (scheduler == null) {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "transpile-cache");
                t.setDaemon(true);
                return t;
            });
            this.ownsScheduler = true;
        } else {
            this.scheduler = scheduler;
            this.ownsScheduler = false;
        }
        load();
        startCleanup();
    }

    /** A memory-only cache with default settings, for tests and one-shot use. */
    public static TranspileCache inMemory() {
        return new TranspileCache(CacheSettings.DEFAULTS, null);
    }

    /**
     * Looks up the output for {@code source} under {@code options}. A hit increments the entry's
     * hit count; an absent or expired entry counts as a miss (expired entries are removed).
     */
    public synchronized Optional<String> get(SourceProgram source, TransformOptions options) {
        String hash = CacheKeys.keyOf(source, options);
        CacheEntry entry = entries.get(hash);
        if (entry == null || isExpired(entry, clock.millis())) {
            if (entry != null) {
                entries.remove(hash);
            }
            misses++;
            return Optional.empty();
        }
        entries.put(hash, entry.withHit());
        hits++;
        return Optional.of(entry.output());
    }

    /**
     * Stores {@code output}. Inserting a new key into a full cache first evicts the entry with
     * the lowest score; replacing an existing key never evicts.
     */
    public synchronized void set(SourceProgram source, TransformOptions options, String output) {
        String hash = CacheKeys.keyOf(source, options);
        if (!entries.containsKey(hash) && entries.size() >= settings.maxSize()) {
            evictLowestScore();
        }
        entries.put(
                hash,
                new CacheEntry(hash, output, CacheKeys.outputOptions(source, options), clock.millis(), 0));
        scheduleSave();
    }

    /** Whether a live entry exists. Expired entries are removed; hit counters are untouched. */
    public synchronized boolean has(SourceProgram source, TransformOptions options) {
        String hash = CacheKeys.keyOf(source, options);
        CacheEntry entry = entries.get(hash);
        if (entry == null) {
            return false;
        }
        if (isExpired(entry, clock.millis())) {
            entries.remove(hash);
            return false;
        }
        return true;
    }

    /**
     * Removes the entry for {@code source} under {@code options}.
     *
     * @return whether a live entry was removed; an expired entry is dropped but reported as
     *         absent, the same as {@link #has}
     */
    public synchronized boolean invalidate(SourceProgram source, TransformOptions options) {
        CacheEntry removed = entries.remove(CacheKeys.keyOf(source, options));
        if (removed == null) {
            return false;
        }
        scheduleSave();
        return !isExpired(removed, clock.millis());
    }

    /** Removes every entry and resets the statistics. */
    public synchronized void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
        scheduleSave();
    }

    /**
     * Removes expired entries.
     *
     * @return number of entries removed
     */
    public synchronized int cleanup() {
        long now = clock.millis();
        int removed = 0;
        for (Iterator<CacheEntry> it = entries.values().iterator(); it.hasNext(); ) {
            if (isExpired(it.next(), now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("cache.cleanup removed={} size={}", removed, entries.size());
            scheduleSave();
        }
        return removed;
    }

    /** Current statistics. */
    public synchronized CacheStats stats() {
        long total = hits + misses;
        int hitRate = total == 0 ? 0 : (int) Math.round(hits * 100.0 / total);
        long memoryBytes = 0;
        for (CacheEntry entry : entries.values()) {
            memoryBytes += entry.hash().length() * 2L + entry.output().length() * 2L + ENTRY_OVERHEAD_BYTES;
        }
        return new CacheStats(entries.size(), hits, misses, hitRate, memoryBytes);
    }

    /** The entry stored under {@code hash}, without touching counters or expiry. */
    public synchronized Optional<CacheEntry> peek(String hash) {
        return Optional.ofNullable(entries.get(hash));
    }

    public synchronized int size() {
        return entries.size();
    }

    /** Writes the snapshot now, cancelling any pending debounced write. */
    public void flush() {
        synchronized (this) {
            if (pendingSave != null) {
                pendingSave.cancel(false);
                pendingSave = null;
            }
        }
        save();
    }

    /** Stops background work and writes a final snapshot. */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (cleanupTask != null) {
                cleanupTask.cancel(false);
            }
        }
        flush();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    // --- Eviction ---

    private void evictLowestScore() {
        long now = clock.millis();
        double ttlMillis = settings.ttl().toMillis();
        String victim = null;
        double lowest = Double.POSITIVE_INFINITY;
        for (CacheEntry entry : entries.values()) {
            double score = entry.hitCount() - entry.ageMillis(now) / ttlMillis;
            if (score < lowest) {
                lowest = score;
                victim = entry.hash();
            }
        }
        if (victim == null) {
            return;
        }
        entries.remove(victim);
        LOG.debug("cache.evicted hash={} score={}", victim, lowest);
        notifyEvicted(victim, lowest);
    }

    private boolean isExpired(CacheEntry entry, long now) {
        return entry.ageMillis(now) > settings.ttl().toMillis();
    }

    private void notifyEvicted(String hash, double score) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onCacheEvicted(new TelemetryListener.CacheEvictedEvent(hash, score));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onCacheEvicted failed", e);
        }
    }

    // --- Persistence ---

    private synchronized void scheduleSave() {
        if (store == null) {
            return;
        }
        if (pendingSave != null && !pendingSave.isDone()) {
            pendingSave.cancel(false);
        }
        if (closed || scheduler.isShutdown()) {
            pendingSave = null;
            return;
        }
        pendingSave = scheduler.schedule(this::save, settings.saveDebounce().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void save() {
        if (store == null) {
            return;
        }
        String payload;
        synchronized (this) {
            payload = snapshot();
        }
        try {
            store.set(STORAGE_KEY, payload);
            LOG.debug("cache.saved bytes={}", payload.length());
        } catch (RuntimeException e) {
            LOG.warn("cache.save_failed reason={}", e.getMessage(), e);
        }
    }

    private String snapshot() {
        ObjectNode root = JSON.createObjectNode();
        root.put("version", SNAPSHOT_VERSION);
        ArrayNode list = root.putArray("entries");
        for (CacheEntry entry : entries.values()) {
            ArrayNode pair = list.addArray();
            pair.add(entry.hash());
            pair.add(JSON.valueToTree(entry));
        }
        ObjectNode stats = root.putObject("stats");
        stats.put("hits", hits);
        stats.put("misses", misses);
        try {
            return JSON.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize cache snapshot", e);
        }
    }

    private synchronized void load() {
        if (store == null) {
            return;
        }
        String raw;
        try {
            raw = store.get(STORAGE_KEY);
        } catch (RuntimeException e) {
            LOG.warn("cache.load_failed reason={}", e.getMessage());
            return;
        }
        if (raw == null) {
            return;
        }
        try {
            restore(raw);
            LOG.debug("cache.loaded entries={} hits={} misses={}", entries.size(), hits, misses);
        } catch (CacheCorruptionException e) {
            LOG.warn("cache.snapshot_discarded reason={}", e.getMessage());
            entries.clear();
            hits = 0;
            misses = 0;
            try {
                store.remove(STORAGE_KEY);
            } catch (RuntimeException removeFailure) {
                LOG.warn("cache.snapshot_remove_failed reason={}", removeFailure.getMessage());
            }
            return;
        }
        cleanup();
    }

    private void restore(String raw) {
        JsonNode root;
        try {
            root = JSON.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new CacheCorruptionException("Snapshot is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CacheCorruptionException("Snapshot is not a JSON object");
        }
        int version = root.path("version").asInt(-1);
        if (version != SNAPSHOT_VERSION) {
            throw new CacheCorruptionException(
                    "Snapshot version mismatch: expected " + SNAPSHOT_VERSION + ", got " + root.path("version"));
        }
        JsonNode list = root.path("entries");
        if (!list.isArray()) {
            throw new CacheCorruptionException("Snapshot entries must be an array");
        }
        Map<String, CacheEntry> restored = new LinkedHashMap<>();
        for (JsonNode pair : list) {
            if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isTextual()) {
                throw new CacheCorruptionException("Snapshot entry must be a [hash, entry] pair");
            }
            try {
                CacheEntry entry = JSON.treeToValue(pair.get(1), CacheEntry.class);
                if (entry == null || entry.output() == null) {
                    throw new CacheCorruptionException("Snapshot entry without output");
                }
                restored.put(pair.get(0).asText(), entry);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CacheCorruptionException("Unreadable snapshot entry: " + e.getMessage(), e);
            }
        }
        JsonNode stats = root.path("stats");
        entries.clear();
        entries.putAll(restored);
        hits = stats.path("hits").asLong(0);
        misses = stats.path("misses").asLong(0);
    }

    private void startCleanup() {
        long period = settings.cleanupInterval().toMillis();
        if (period <= 0) {
            return;
        }
        cleanupTask = scheduler.scheduleAtFixedRate(
                () -> {
                    try {
                        cleanup();
                    } catch (RuntimeException e) {
                        LOG.warn("cache.cleanup_failed reason={}", e.getMessage(), e);
                    }
                },
                period,
                period,
                TimeUnit.MILLISECONDS);
    }
}
