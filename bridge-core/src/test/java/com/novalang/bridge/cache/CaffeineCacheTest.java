package com.novalang.bridge.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Caffeine 缓存功能测试
 */
public class CaffeineCacheTest {

    @Test
    public void testComputeIfAbsent() {
        BoundedCache<String, Integer> cache = new CaffeineCache<>(100);

        Integer value = cache.computeIfAbsent("b", k -> 2);
        assertEquals(Integer.valueOf(2), value);
        assertEquals(Integer.valueOf(2), cache.get("b"));

        // 已缓存的值不会重新计算
        assertEquals(Integer.valueOf(2), cache.computeIfAbsent("b", k -> 3));
        assertEquals(1L, cache.size());
    }

    @Test
    public void testStats() {
        BoundedCache<Integer, Integer> cache = new CaffeineCache<>(100);

        cache.computeIfAbsent(1, k -> k * 10);  // miss
        cache.computeIfAbsent(1, k -> k * 20);  // hit
        cache.get(2);                           // miss

        assertEquals(1L, cache.hitCount());
        assertEquals(2L, cache.missCount());
    }

    @Test
    public void testClear() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);

        cache.computeIfAbsent("a", k -> "A");
        cache.computeIfAbsent("b", k -> "B");
        assertEquals(2L, cache.size());

        cache.clear();
        assertEquals(0L, cache.size());
        assertNull(cache.get("a"));
    }

    @Test
    public void testNullHandling() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);

        assertNull(cache.get("missing"));

        // Caffeine 不缓存 null
        assertNull(cache.computeIfAbsent("key", k -> null));
        assertNull(cache.get("key"));
    }

    @Test
    public void testWeakKeysCompareByIdentity() {
        BoundedCache<String, Integer> cache = CaffeineCache.weakKeys(16);
        String key = "Point";
        cache.computeIfAbsent(key, k -> 1);

        assertEquals(Integer.valueOf(1), cache.get(key));
        assertNull(cache.get(new String("Point")));
    }

    @Test
    public void testRejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineCache<String, String>(0));
    }
}
