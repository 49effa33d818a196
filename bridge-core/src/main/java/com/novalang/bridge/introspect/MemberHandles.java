package com.novalang.bridge.introspect;

import com.novalang.bridge.BindingBuildException;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

/**
 * 成员句柄工厂
 *
 * <p>把反射成员转换为类型已擦除为 Object 的 MethodHandle，调用桩不再需要关心原始签名。
 * 方法与构造器句柄的参数被展开为一个 {@code Object[]}。</p>
 */
public final class MemberHandles {

    private static final MethodType GETTER = MethodType.methodType(Object.class, Object.class);
    private static final MethodType SETTER = MethodType.methodType(void.class, Object.class, Object.class);

    private final MethodHandles.Lookup lookup = MethodHandles.lookup();
    private final boolean allowSetAccessible;

    public MemberHandles(boolean allowSetAccessible) {
        this.allowSetAccessible = allowSetAccessible;
    }

    /**
     * 受选项守卫的 setAccessible 调用。
     * 不允许或失败时跳过，随后的 unreflect 若因访问权限失败会报告为构建错误。
     */
    private boolean trySetAccessible(AccessibleObject ao) {
        return allowSetAccessible && ao.trySetAccessible();
    }

    /** 成员本身与声明类都是 public 时 lookup 才能直接访问 */
    private static boolean isPublicMember(Field field) {
        return Modifier.isPublic(field.getModifiers())
                && Modifier.isPublic(field.getDeclaringClass().getModifiers());
    }

    // ============ 字段 ============

    public MethodHandle getter(Field field) {
        if (!isPublicMember(field)) {
            trySetAccessible(field);
        }
        try {
            return lookup.unreflectGetter(field).asType(GETTER);
        } catch (IllegalAccessException e) {
            throw new BindingBuildException("Cannot read field '" + field.getName() + "'",
                    field.getDeclaringClass(), field.getName(), e);
        }
    }

    /**
     * @return final 字段返回 null
     */
    public MethodHandle setter(Field field) {
        if (Modifier.isFinal(field.getModifiers())) {
            return null;
        }
        if (!isPublicMember(field)) {
            trySetAccessible(field);
        }
        try {
            return lookup.unreflectSetter(field).asType(SETTER);
        } catch (IllegalAccessException e) {
            throw new BindingBuildException("Cannot write field '" + field.getName() + "'",
                    field.getDeclaringClass(), field.getName(), e);
        }
    }

    /**
     * 构造期写入句柄：非 final 字段即 setter；final 字段需要 setAccessible，不允许时返回 null。
     */
    public MethodHandle initializer(Field field) {
        if (!Modifier.isFinal(field.getModifiers())) {
            return setter(field);
        }
        if (!trySetAccessible(field)) {
            return null;
        }
        try {
            return lookup.unreflectSetter(field).asType(SETTER);
        } catch (IllegalAccessException e) {
            return null;
        }
    }

    // ============ 方法与构造器 ============

    /**
     * 实例方法得到 {@code (Object,Object[])Object}，静态方法得到 {@code (Object[])Object}；
     * void 方法返回 null。
     */
    public MethodHandle method(Method method) {
        if (!Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            trySetAccessible(method);
        }
        MethodHandle mh;
        try {
            mh = lookup.unreflect(method);
        } catch (IllegalAccessException e) {
            throw new BindingBuildException("Cannot access method '" + method.getName() + "'",
                    method.getDeclaringClass(), method.getName(), e);
        }
        int arity = method.getParameterCount();
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        mh = mh.asType(MethodType.genericMethodType(isStatic ? arity : arity + 1));
        return mh.asSpreader(Object[].class, arity);
    }

    /** {@code (Object[])Object} */
    public MethodHandle constructor(Constructor<?> constructor) {
        if (!Modifier.isPublic(constructor.getDeclaringClass().getModifiers())) {
            trySetAccessible(constructor);
        }
        try {
            int arity = constructor.getParameterCount();
            return lookup.unreflectConstructor(constructor)
                    .asType(MethodType.genericMethodType(arity))
                    .asSpreader(Object[].class, arity);
        } catch (IllegalAccessException e) {
            throw new BindingBuildException("Cannot access constructor of " + constructor.getDeclaringClass().getName(),
                    constructor.getDeclaringClass(), "<init>", e);
        }
    }

    /** 无参构造器句柄 {@code ()Object}；不存在或不可访问时返回 null */
    public MethodHandle factory(Class<?> type) {
        try {
            Constructor<?> ctor = type.getDeclaredConstructor();
            if (!Modifier.isPublic(ctor.getModifiers()) || !Modifier.isPublic(type.getModifiers())) {
                trySetAccessible(ctor);
            }
            return lookup.unreflectConstructor(ctor).asType(MethodType.methodType(Object.class));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            return null;
        }
    }
}
