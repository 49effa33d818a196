package com.novalang.bridge.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.function.Function;

/**
 * 基于 Caffeine 的缓存实现
 *
 * <p>键为 {@link Class} 时应使用 {@link #weakKeys(long)}，使被卸载的类加载器可以回收，
 * 此时键按引用相等比较。</p>
 */
public final class CaffeineCache<K, V> implements BoundedCache<K, V> {

    private final Cache<K, V> cache;

    public CaffeineCache(long maximumSize) {
        this(maximumSize, false);
    }

    private CaffeineCache(long maximumSize, boolean weakKeys) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats();
        if (weakKeys) {
            builder.weakKeys();
        }
        this.cache = builder.build();
    }

    /** 弱引用键的缓存 */
    public static <K, V> CaffeineCache<K, V> weakKeys(long maximumSize) {
        return new CaffeineCache<>(maximumSize, true);
    }

    @Override
    public V get(K key) {
        return cache.getIfPresent(key);
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        return cache.get(key, mappingFunction);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public long hitCount() {
        return cache.stats().hitCount();
    }

    @Override
    public long missCount() {
        return cache.stats().missCount();
    }
}
