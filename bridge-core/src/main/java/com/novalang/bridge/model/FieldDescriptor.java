package com.novalang.bridge.model;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Field;

/**
 * 字段描述：名称、类型分类与访问句柄。
 *
 * <p>句柄已统一为 {@code (Object)Object} 的 getter 与 {@code (Object,Object)void} 的 setter。
 * final 字段没有 setter（对脚本只读），但仍可能带有 initializer，供记录类型按值重建时写入。</p>
 */
public final class FieldDescriptor {

    private final String name;
    private final TypeShape type;
    private final Field field;
    private final MethodHandle getter;
    private final MethodHandle setter;
    private final MethodHandle initializer;

    public FieldDescriptor(String name, TypeShape type, Field field,
                           MethodHandle getter, MethodHandle setter, MethodHandle initializer) {
        this.name = name;
        this.type = type;
        this.field = field;
        this.getter = getter;
        this.setter = setter;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public TypeShape getType() {
        return type;
    }

    public Field getField() {
        return field;
    }

    public boolean isReadOnly() {
        return setter == null;
    }

    /** 是否可以在记录重建时写入 */
    public boolean canInitialize() {
        return initializer != null || setter != null;
    }

    public Object read(Object target) throws Throwable {
        return (Object) getter.invokeExact(target);
    }

    public void write(Object target, Object value) throws Throwable {
        if (setter == null) {
            throw new IllegalStateException("Field '" + name + "' is read-only");
        }
        setter.invokeExact(target, value);
    }

    /** 构造期写入，允许 final 字段 */
    public void initialize(Object target, Object value) throws Throwable {
        MethodHandle mh = initializer != null ? initializer : setter;
        if (mh == null) {
            throw new IllegalStateException("Field '" + name + "' cannot be initialized");
        }
        mh.invokeExact(target, value);
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
