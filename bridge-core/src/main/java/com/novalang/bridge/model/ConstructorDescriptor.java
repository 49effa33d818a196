package com.novalang.bridge.model;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Constructor;
import java.util.Collections;
import java.util.List;

/**
 * 构造器描述。无参构造器即默认构造器，不参与按实参数量的解析。
 */
public final class ConstructorDescriptor {

    private final List<TypeShape> parameterTypes;
    private final Constructor<?> constructor;
    private final MethodHandle invoker;

    /**
     * @param invoker 展开后的构造句柄 {@code (Object[])Object}
     */
    public ConstructorDescriptor(List<TypeShape> parameterTypes, Constructor<?> constructor, MethodHandle invoker) {
        this.parameterTypes = Collections.unmodifiableList(parameterTypes);
        this.constructor = constructor;
        this.invoker = invoker;
    }

    public List<TypeShape> getParameterTypes() {
        return parameterTypes;
    }

    public int getArity() {
        return parameterTypes.size();
    }

    public boolean isDefault() {
        return parameterTypes.isEmpty();
    }

    public Constructor<?> getConstructor() {
        return constructor;
    }

    public Object newInstance(Object[] args) throws Throwable {
        return (Object) invoker.invokeExact(args);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<init>(");
        for (int i = 0; i < parameterTypes.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(parameterTypes.get(i).getToken());
        }
        return sb.append(')').toString();
    }
}
