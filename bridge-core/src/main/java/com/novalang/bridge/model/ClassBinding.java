package com.novalang.bridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个已绑定原生类的完整描述。
 *
 * <p>每个生成器对每个类只创建一次，此后除脚本类型句柄（只能设置一次）外不再变化。</p>
 */
public final class ClassBinding {

    private final Class<?> nativeType;
    private final String foreignName;
    private final List<FieldDescriptor> fields;
    private final Map<String, MethodDescriptor> methods;
    private final Map<String, MethodDescriptor> staticMethods;
    private final List<ConstructorDescriptor> constructors;
    private final String signature;

    private Object foreignType;

    /**
     * @param methods       脚本名 → 实例方法，按声明顺序
     * @param staticMethods 脚本名 → 静态方法，按声明顺序
     */
    public ClassBinding(Class<?> nativeType, String foreignName, List<FieldDescriptor> fields,
                        Map<String, MethodDescriptor> methods, Map<String, MethodDescriptor> staticMethods,
                        List<ConstructorDescriptor> constructors, String signature) {
        this.nativeType = nativeType;
        this.foreignName = foreignName;
        this.fields = Collections.unmodifiableList(fields);
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
        this.staticMethods = Collections.unmodifiableMap(new LinkedHashMap<>(staticMethods));
        this.constructors = Collections.unmodifiableList(constructors);
        this.signature = signature;
    }

    public Class<?> getNativeType() {
        return nativeType;
    }

    public String getForeignName() {
        return foreignName;
    }

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    public FieldDescriptor getField(String name) {
        for (FieldDescriptor f : fields) {
            if (f.getName().equals(name)) return f;
        }
        return null;
    }

    public Map<String, MethodDescriptor> getMethods() {
        return methods;
    }

    public Map<String, MethodDescriptor> getStaticMethods() {
        return staticMethods;
    }

    public List<ConstructorDescriptor> getConstructors() {
        return constructors;
    }

    public ConstructorDescriptor getDefaultConstructor() {
        for (ConstructorDescriptor c : constructors) {
            if (c.isDefault()) return c;
        }
        return null;
    }

    public String getSignature() {
        return signature;
    }

    public Object getForeignType() {
        return foreignType;
    }

    public boolean isRegistered() {
        return foreignType != null;
    }

    public void attachForeignType(Object handle) {
        if (handle == null) {
            throw new IllegalArgumentException("Foreign type handle must not be null");
        }
        if (foreignType != null) {
            throw new IllegalStateException("Foreign type of " + foreignName + " is already set");
        }
        this.foreignType = handle;
    }

    @Override
    public String toString() {
        return "ClassBinding[" + foreignName + " -> " + nativeType.getName() + "]";
    }
}
