package com.novalang.bridge.runtime;

import com.novalang.bridge.bind.NativeWrapper;

import java.util.List;

/**
 * 方法调用桩。
 */
public interface MethodThunk<V> {

    /** 脚本可见名（重载时为改写后的名称） */
    String name();

    int arity();

    /**
     * @param self 实例方法的接收者；静态方法为 null
     * @param args 脚本实参
     * @return 返回值；void 方法返回运行时的缺省值
     */
    V invoke(NativeWrapper self, List<V> args);
}
