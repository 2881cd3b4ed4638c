package com.autofix.core.cache;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TagCacheTest {

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-05-01T10:00:00Z"));

    private final Clock clock = new Clock() {
        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    };

    private final TagCache cache = new TagCache(Duration.ofMinutes(5), clock);

    @Test
    void entriesExpireAfterTheTtl() {
        cache.put("acme/app", Map.of("bug", "Bug"));

        now.set(now.get().plus(Duration.ofMinutes(4)));
        assertEquals(Map.of("bug", "Bug"), cache.get("acme/app").orElseThrow());

        now.set(now.get().plus(Duration.ofMinutes(1)));
        assertTrue(cache.get("acme/app").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void invalidateAndResetDropEntries() {
        cache.put("a", Map.of());
        cache.put("b", Map.of());

        cache.invalidate("a");
        assertTrue(cache.get("a").isEmpty());
        assertEquals(1, cache.size());

        cache.reset();
        assertEquals(0, cache.size());
    }

    @Test
    void storedMapsAreImmutableCopies() {
        var tags = new java.util.HashMap<String, String>();
        tags.put("bug", "Bug");
        cache.put("a", tags);
        tags.put("extra", "Extra");

        Map<String, String> cached = cache.get("a").orElseThrow();
        assertEquals(1, cached.size());
        assertThrows(UnsupportedOperationException.class, () -> cached.put("x", "y"));
    }
}
