package com.novalang.bridge.nova.interop;

import com.novalang.bridge.nova.NovaCallable;
import com.novalang.bridge.nova.NovaValue;

import java.util.Arrays;
import java.util.List;

/**
 * 原生（Java）函数
 *
 * <p>绑定对象的方法以及绑定类的静态方法在脚本中作为一等值取出时都是该类型。</p>
 */
public final class NovaNativeFunction extends NovaValue implements NovaCallable {

    /**
     * 原生函数接口
     */
    @FunctionalInterface
    public interface NativeFunc {
        NovaValue apply(List<NovaValue> args);
    }

    private final String name;
    private final int arity;
    private final NativeFunc function;

    public NovaNativeFunction(String name, int arity, NativeFunc function) {
        this.name = name;
        this.arity = arity;
        this.function = function;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return arity;
    }

    @Override
    public String getTypeName() {
        return "NativeFunction";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public boolean isCallable() {
        return true;
    }

    @Override
    public NovaValue call(List<NovaValue> args) {
        return function.apply(args);
    }

    public NovaValue call(NovaValue... args) {
        return function.apply(Arrays.asList(args));
    }

    @Override
    public String toString() {
        return "<native fun " + name + ">";
    }
}
