package com.autofix.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-to-live cache of tag/label lookups keyed by project.
 * <p>
 * Entries are immutable once stored, so reads need no locking. Any tag creation
 * invalidates the whole entry for that project instead of patching it.
 */
public class TagCache {

    private static final Logger log = LoggerFactory.getLogger(TagCache.class);

    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public TagCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public TagCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Tags cached for the key, keyed by lower-cased name; empty when absent or expired.
     */
    public Optional<Map<String, String>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.tags());
    }

    public void put(String key, Map<String, String> tags) {
        entries.put(key, new Entry(Map.copyOf(tags), clock.instant().plus(ttl)));
    }

    public void invalidate(String key) {
        if (entries.remove(key) != null) {
            log.debug("Invalidated tag cache for {}", key);
        }
    }

    /**
     * Drops every entry. Used between runs and by tests.
     */
    public void reset() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private record Entry(Map<String, String> tags, Instant expiresAt) {}
}
