package io.xrelay.gateway;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

final class ResponseCacheTest {

    @Test
    void entriesExpireAfterTtl() {
        AtomicLong now = new AtomicLong(0L);
        ResponseCache<String> cache = new ResponseCache<>(1_000L, 10, now::get);
        cache.put("get", "https://a.example/", "A");

        Assertions.assertEquals("A", cache.get("GET", "https://a.example/").orElseThrow());
        Assertions.assertTrue(cache.get("POST", "https://a.example/").isEmpty());

        now.set(1_001L);
        Assertions.assertTrue(cache.get("GET", "https://a.example/").isEmpty());
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    void oldestEntryIsEvictedAtCapacity() {
        ResponseCache<String> cache = new ResponseCache<>(60_000L, 2, () -> 0L);
        cache.put("GET", "https://a.example/", "A");
        cache.put("GET", "https://b.example/", "B");
        cache.put("GET", "https://c.example/", "C");

        Assertions.assertEquals(2, cache.size());
        Assertions.assertTrue(cache.get("GET", "https://a.example/").isEmpty());
        Assertions.assertEquals("C", cache.get("GET", "https://c.example/").orElseThrow());
    }

    @Test
    void cleanupDropsOnlyExpiredEntries() {
        AtomicLong now = new AtomicLong(0L);
        ResponseCache<String> cache = new ResponseCache<>(1_000L, 10, now::get);
        cache.put("GET", "https://a.example/", "A");
        now.set(800L);
        cache.put("GET", "https://b.example/", "B");
        now.set(1_500L);

        Assertions.assertEquals(1, cache.cleanupExpired());
        Assertions.assertEquals("B", cache.get("GET", "https://b.example/").orElseThrow());
        Assertions.assertEquals("GET:https://b.example/", ResponseCache.key(null, "https://b.example/"));
    }
}
