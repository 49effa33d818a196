package com.novalang.bridge.model;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Method;
import java.util.Collections;
import java.util.List;

/**
 * 方法描述。
 *
 * <p>同名方法共享同一个重载组标识（即方法名）；组内成员由
 * {@link com.novalang.bridge.bind.OverloadNaming} 分配互不相同的脚本名。</p>
 */
public final class MethodDescriptor {

    private final String name;
    private final List<TypeShape> parameterTypes;
    private final TypeShape returnType;
    private final boolean isStatic;
    private final Method method;
    private final MethodHandle invoker;

    /**
     * @param returnType 返回类型形状，void 方法为 null
     * @param invoker    展开后的调用句柄：实例方法 {@code (Object,Object[])Object}，
     *                   静态方法 {@code (Object[])Object}
     */
    public MethodDescriptor(String name, List<TypeShape> parameterTypes, TypeShape returnType,
                            boolean isStatic, Method method, MethodHandle invoker) {
        this.name = name;
        this.parameterTypes = Collections.unmodifiableList(parameterTypes);
        this.returnType = returnType;
        this.isStatic = isStatic;
        this.method = method;
        this.invoker = invoker;
    }

    public String getName() {
        return name;
    }

    /** 重载组标识 */
    public String getOverloadGroup() {
        return name;
    }

    public List<TypeShape> getParameterTypes() {
        return parameterTypes;
    }

    public int getArity() {
        return parameterTypes.size();
    }

    public TypeShape getReturnType() {
        return returnType;
    }

    public boolean returnsValue() {
        return returnType != null;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public Method getMethod() {
        return method;
    }

    public Object invoke(Object target, Object[] args) throws Throwable {
        if (isStatic) {
            return (Object) invoker.invokeExact(args);
        }
        return (Object) invoker.invokeExact(target, args);
    }

    /** 形如 {@code name(int,String)} 的描述，用于日志与带类型签名 */
    public String describe() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < parameterTypes.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(parameterTypes.get(i).getToken());
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
