package com.novalang.bridge.runtime;

import com.novalang.bridge.bind.NativeWrapper;

/**
 * 属性访问桩：一个字段的 getter 与 setter。
 */
public interface PropertyThunk<V> {

    String name();

    boolean isReadOnly();

    V get(NativeWrapper self);

    void set(NativeWrapper self, V value);
}
