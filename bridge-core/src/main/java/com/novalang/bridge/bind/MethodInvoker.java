package com.novalang.bridge.bind;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.convert.ConversionException;
import com.novalang.bridge.convert.ValueConverter;
import com.novalang.bridge.model.ClassBinding;
import com.novalang.bridge.model.MethodDescriptor;
import com.novalang.bridge.model.TypeShape;
import com.novalang.bridge.runtime.MethodThunk;

import java.util.List;

/**
 * 方法调用桩
 *
 * <p>调用顺序固定：检查接收者、检查实参数量、从左到右转换实参（首个失败即中止，原生方法不会被调用）、
 * 调用原生方法、转换返回值。void 方法返回脚本的缺省值。</p>
 */
public final class MethodInvoker<V> extends AbstractThunk<V> implements MethodThunk<V> {

    private final String foreignName;
    private final MethodDescriptor method;

    public MethodInvoker(ClassBinding owner, String foreignName, MethodDescriptor method, ValueConverter<V> converter) {
        super(owner, converter);
        this.foreignName = foreignName;
        this.method = method;
    }

    @Override
    public String name() {
        return foreignName;
    }

    @Override
    public int arity() {
        return method.getArity();
    }

    public MethodDescriptor getMethod() {
        return method;
    }

    @Override
    public V invoke(NativeWrapper self, List<V> args) {
        Object target = method.isStatic() ? null : requireLive(self, foreignName);

        if (args.size() != method.getArity()) {
            throw error(ErrorKind.ARITY, qualifiedName() + " expects " + method.getArity()
                    + " argument(s) but got " + args.size(), null);
        }

        List<TypeShape> params = method.getParameterTypes();
        Object[] nativeArgs = new Object[params.size()];
        for (int i = 0; i < nativeArgs.length; i++) {
            try {
                nativeArgs[i] = converter.fromForeign(params.get(i), args.get(i));
            } catch (ConversionException e) {
                throw error(ErrorKind.CONVERSION, qualifiedName() + " argument " + (i + 1) + ": "
                        + e.getMessage(), e);
            }
        }

        Object result;
        try {
            result = method.invoke(target, nativeArgs);
        } catch (Throwable t) {
            throw error(ErrorKind.NATIVE_FAILURE, qualifiedName() + " failed: " + describe(t), t);
        }

        if (!method.returnsValue()) {
            return runtime.absent();
        }
        try {
            return converter.toForeign(method.getReturnType(), result);
        } catch (ConversionException e) {
            throw error(ErrorKind.CONVERSION, qualifiedName() + " result: " + e.getMessage(), e);
        }
    }

    private String qualifiedName() {
        return owner.getForeignName() + "." + foreignName;
    }
}
