package com.novalang.bridge.nova.interop;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.bind.NativeWrapper;
import com.novalang.bridge.nova.NovaValue;
import com.novalang.bridge.runtime.MethodThunk;
import com.novalang.bridge.runtime.PropertyThunk;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * 绑定类实例在脚本中的对象句柄
 *
 * <p>句柄持有包装对象；包装对象不引用句柄，句柄被回收后由生命周期管理器结束包装。</p>
 */
public final class NovaBridgeObject extends NovaValue {

    private final NovaBridgeClass type;
    private final NativeWrapper wrapper;

    NovaBridgeObject(NovaBridgeClass type, NativeWrapper wrapper) {
        this.type = type;
        this.wrapper = wrapper;
    }

    public NovaBridgeClass getType() {
        return type;
    }

    public NativeWrapper getWrapper() {
        return wrapper;
    }

    // ============ 属性 ============

    /**
     * 读取属性；名称是方法时返回绑定到本对象的函数值。
     */
    public NovaValue getProperty(String name) {
        PropertyThunk<NovaValue> property = type.property(name);
        if (property != null) {
            return property.get(wrapper);
        }
        MethodThunk<NovaValue> method = type.method(name);
        if (method != null) {
            return new NovaNativeFunction(type.getName() + "." + name, method.arity(),
                    args -> method.invoke(wrapper, args));
        }
        throw unknownMember(name);
    }

    public void setProperty(String name, NovaValue value) {
        PropertyThunk<NovaValue> property = type.property(name);
        if (property == null) {
            throw unknownMember(name);
        }
        property.set(wrapper, value);
    }

    public boolean hasProperty(String name) {
        return type.property(name) != null;
    }

    // ============ 方法 ============

    public NovaValue invokeMethod(String name, List<NovaValue> args) {
        MethodThunk<NovaValue> method = type.method(name);
        if (method == null) {
            throw unknownMember(name);
        }
        return method.invoke(wrapper, args);
    }

    public NovaValue invokeMethod(String name, NovaValue... args) {
        return invokeMethod(name, Arrays.asList(args));
    }

    public boolean hasMethod(String name) {
        return type.method(name) != null;
    }

    /** 属性名，按字段声明顺序 */
    public Set<String> propertyNames() {
        return type.propertyNames();
    }

    /** 脚本可见的方法名（重载已改写） */
    public Set<String> methodNames() {
        return type.methodNames();
    }

    private NovaRuntimeException unknownMember(String name) {
        return new NovaRuntimeException(ErrorKind.UNKNOWN_MEMBER, type.getName() + " has no member '" + name + "'");
    }

    @Override
    public String getTypeName() {
        return type.getName();
    }

    /** 原生对象；包装已结束时为 null */
    @Override
    public Object toJavaValue() {
        return wrapper.get();
    }

    @Override
    public boolean equals(NovaValue other) {
        return other == this;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "<" + type.getName() + (wrapper.isValid() ? "" : " (invalid)") + ">";
    }
}
