package com.novalang.bridge.nova.interop;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.model.ClassBinding;
import com.novalang.bridge.nova.NovaCallable;
import com.novalang.bridge.nova.NovaValue;
import com.novalang.bridge.runtime.ConstructorThunk;
import com.novalang.bridge.runtime.MethodThunk;
import com.novalang.bridge.runtime.PropertyThunk;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 绑定类在脚本中的类型对象
 *
 * <p>调用它即构造实例；静态方法作为它的成员访问。</p>
 */
public final class NovaBridgeClass extends NovaValue implements NovaCallable {

    private final ClassBinding binding;
    private final ConstructorThunk<NovaValue> constructor;
    private final Map<String, PropertyThunk<NovaValue>> properties = new LinkedHashMap<>();
    private final Map<String, MethodThunk<NovaValue>> methods = new LinkedHashMap<>();
    private final Map<String, MethodThunk<NovaValue>> staticMethods = new LinkedHashMap<>();

    NovaBridgeClass(ClassBinding binding, ConstructorThunk<NovaValue> constructor,
                    List<PropertyThunk<NovaValue>> properties, List<MethodThunk<NovaValue>> methods,
                    List<MethodThunk<NovaValue>> staticMethods) {
        this.binding = binding;
        this.constructor = constructor;
        for (PropertyThunk<NovaValue> p : properties) {
            this.properties.put(p.name(), p);
        }
        for (MethodThunk<NovaValue> m : methods) {
            this.methods.put(m.name(), m);
        }
        for (MethodThunk<NovaValue> m : staticMethods) {
            this.staticMethods.put(m.name(), m);
        }
    }

    public ClassBinding getBinding() {
        return binding;
    }

    @Override
    public String getName() {
        return binding.getForeignName();
    }

    @Override
    public int getArity() {
        return -1;
    }

    /** 构造实例 */
    @Override
    public NovaValue call(List<NovaValue> args) {
        return constructor.construct(args);
    }

    public NovaValue call(NovaValue... args) {
        return call(Arrays.asList(args));
    }

    /** 零实参构造是否可用 */
    public boolean hasDefaultConstructor() {
        return constructor.hasDefault();
    }

    /**
     * 把宿主对象暴露给脚本，所有权仍归宿主。
     */
    public NovaValue wrap(Object instance) {
        return constructor.adopt(instance);
    }

    // ============ 静态成员 ============

    public NovaValue invokeStatic(String name, List<NovaValue> args) {
        return staticMethod(name).invoke(null, args);
    }

    public NovaValue invokeStatic(String name, NovaValue... args) {
        return invokeStatic(name, Arrays.asList(args));
    }

    /** 静态方法作为一等函数值 */
    public NovaNativeFunction getStaticMember(String name) {
        MethodThunk<NovaValue> thunk = staticMethod(name);
        return new NovaNativeFunction(getName() + "." + name, thunk.arity(), args -> thunk.invoke(null, args));
    }

    public Set<String> staticMethodNames() {
        return Collections.unmodifiableSet(staticMethods.keySet());
    }

    private MethodThunk<NovaValue> staticMethod(String name) {
        MethodThunk<NovaValue> thunk = staticMethods.get(name);
        if (thunk == null) {
            throw new NovaRuntimeException(ErrorKind.UNKNOWN_MEMBER,
                    getName() + " has no static method '" + name + "'");
        }
        return thunk;
    }

    // ============ 实例成员表 ============

    PropertyThunk<NovaValue> property(String name) {
        return properties.get(name);
    }

    MethodThunk<NovaValue> method(String name) {
        return methods.get(name);
    }

    Set<String> propertyNames() {
        return Collections.unmodifiableSet(properties.keySet());
    }

    Set<String> methodNames() {
        return Collections.unmodifiableSet(methods.keySet());
    }

    @Override
    public String getTypeName() {
        return "Class";
    }

    @Override
    public Object toJavaValue() {
        return binding.getNativeType();
    }

    @Override
    public boolean isCallable() {
        return true;
    }

    @Override
    public String toString() {
        return "<class " + getName() + ">";
    }
}
