package com.novalang.bridge.bind;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.convert.ValueConverter;
import com.novalang.bridge.model.ClassBinding;
import com.novalang.bridge.runtime.ForeignRuntime;

/**
 * 调用桩公共部分：所属类型、转换器与错误构造。
 */
abstract class AbstractThunk<V> {

    protected final ClassBinding owner;
    protected final ValueConverter<V> converter;
    protected final ForeignRuntime<V> runtime;

    AbstractThunk(ClassBinding owner, ValueConverter<V> converter) {
        this.owner = owner;
        this.converter = converter;
        this.runtime = converter.runtime();
    }

    /**
     * 取出存活的原生对象，包装已失效时抛出 INVALID_OBJECT。
     */
    protected Object requireLive(NativeWrapper self, String member) {
        Object target = self != null ? self.get() : null;
        if (target == null) {
            throw error(ErrorKind.INVALID_OBJECT,
                    "Invalid " + owner.getForeignName() + " object: cannot access '" + member + "'", null);
        }
        return target;
    }

    protected RuntimeException error(ErrorKind kind, String message, Throwable cause) {
        return runtime.raiseError(kind, message, cause);
    }

    /** 原生异常的展示消息 */
    protected static String describe(Throwable t) {
        return t.getMessage() != null ? t.getClass().getSimpleName() + ": " + t.getMessage()
                : t.getClass().getSimpleName();
    }
}
