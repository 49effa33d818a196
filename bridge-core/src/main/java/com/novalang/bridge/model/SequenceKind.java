package com.novalang.bridge.model;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NavigableSet;
import java.util.Queue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 序列容器种类，决定从脚本数组重建原生容器时分配什么实现。
 */
public enum SequenceKind {
    ARRAY,
    LIST,
    SET,
    SORTED_SET,
    QUEUE,
    /** 具体集合类（如 LinkedList），通过其无参构造器分配 */
    CONCRETE;

    /**
     * 判定集合原始类型对应的种类；不是可分配的集合类型时返回 null。
     */
    public static SequenceKind forCollection(Class<?> raw) {
        if (!Collection.class.isAssignableFrom(raw)) return null;
        if (raw == List.class || raw == Collection.class) return LIST;
        if (raw == Set.class) return SET;
        if (raw == SortedSet.class || raw == NavigableSet.class) return SORTED_SET;
        if (raw == Queue.class || raw == Deque.class) return QUEUE;
        if (raw.isInterface() || Modifier.isAbstract(raw.getModifiers())) return null;
        try {
            raw.getConstructor();
            return CONCRETE;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    /**
     * 分配空容器。数组由调用方按元素个数单独分配，见 {@link #newArray}。
     */
    @SuppressWarnings("unchecked")
    public Collection<Object> newCollection(Class<?> raw, int expectedSize) {
        switch (this) {
            case LIST:
                return new ArrayList<>(expectedSize);
            case SET:
                return new LinkedHashSet<>();
            case SORTED_SET:
                return new TreeSet<>();
            case QUEUE:
                return new ArrayDeque<>(Math.max(expectedSize, 1));
            case CONCRETE:
                try {
                    Constructor<?> ctor = raw.getConstructor();
                    return (Collection<Object>) ctor.newInstance();
                } catch (ReflectiveOperationException e) {
                    throw new IllegalStateException("Cannot instantiate " + raw.getName(), e);
                }
            default:
                throw new IllegalStateException("Not a collection kind: " + this);
        }
    }

    /** TreeSet 与 ArrayDeque 不接受 null 元素 */
    public boolean acceptsNull() {
        return this != SORTED_SET && this != QUEUE;
    }

    public static Object newArray(Class<?> componentType, int length) {
        return Array.newInstance(componentType, length);
    }
}
