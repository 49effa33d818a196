package com.novalang.bridge.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 *
 * <p>绑定生成期按类缓存扫描结果（声明顺序、类文件摘要），避免对同一个类反复读取字节码。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 如果不存在则计算并缓存；计算函数返回 null 时不缓存
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    long size();

    void clear();

    long hitCount();

    long missCount();
}
