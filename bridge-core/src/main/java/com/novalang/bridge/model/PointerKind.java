package com.novalang.bridge.model;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 所有权容器种类。从脚本值转换时按字段声明的种类重新分配容器。
 */
public enum PointerKind {

    /** {@link Optional}：独占、不可变的值盒 */
    UNIQUE(Optional.class),

    /** {@link AtomicReference}：可共享、可变的引用盒 */
    SHARED(AtomicReference.class);

    private final Class<?> boxType;

    PointerKind(Class<?> boxType) {
        this.boxType = boxType;
    }

    public Class<?> getBoxType() {
        return boxType;
    }

    /** 取出容器内元素；空容器或 null 返回 null */
    public Object unwrap(Object box) {
        if (box == null) return null;
        if (this == UNIQUE) {
            return ((Optional<?>) box).orElse(null);
        }
        return ((AtomicReference<?>) box).get();
    }

    /** 分配新的容器；element 为 null 时得到空容器 */
    public Object wrap(Object element) {
        if (this == UNIQUE) {
            return Optional.ofNullable(element);
        }
        return new AtomicReference<Object>(element);
    }

    public static PointerKind forType(Class<?> raw) {
        if (raw == Optional.class) return UNIQUE;
        if (raw == AtomicReference.class) return SHARED;
        return null;
    }
}
