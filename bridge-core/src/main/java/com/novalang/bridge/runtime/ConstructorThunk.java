package com.novalang.bridge.runtime;

import java.util.List;

/**
 * 构造桩。脚本侧调用类型时进入 {@link #construct}。
 */
public interface ConstructorThunk<V> {

    /** 是否可以零实参构造 */
    boolean hasDefault();

    /**
     * 按实参数量解析构造器并创建拥有原生对象的脚本对象。
     */
    V construct(List<V> args);

    /**
     * 把宿主已有的对象暴露给脚本，原生对象仍归宿主所有。
     */
    V adopt(Object instance);
}
