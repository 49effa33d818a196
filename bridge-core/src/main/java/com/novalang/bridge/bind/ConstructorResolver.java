package com.novalang.bridge.bind;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.convert.ConversionException;
import com.novalang.bridge.convert.ValueConverter;
import com.novalang.bridge.model.ClassBinding;
import com.novalang.bridge.model.ConstructorDescriptor;
import com.novalang.bridge.model.TypeShape;
import com.novalang.bridge.runtime.ConstructorThunk;

import java.util.List;

/**
 * 构造器解析
 *
 * <p>零实参使用默认构造器；否则按声明顺序取第一个形参数量相同的构造器（同数量的多个构造器之间
 * 先声明者优先），转换全部实参后调用。任何失败都不会留下半构造的脚本对象。</p>
 */
public final class ConstructorResolver<V> extends AbstractThunk<V> implements ConstructorThunk<V> {

    private final LifetimeManager lifetime;
    private V type;

    public ConstructorResolver(ClassBinding owner, ValueConverter<V> converter, LifetimeManager lifetime) {
        super(owner, converter);
        this.lifetime = lifetime;
    }

    /** 脚本类型定义完成后回填类型句柄，只能调用一次 */
    public void attachType(V type) {
        if (this.type != null) {
            throw new IllegalStateException("Type handle of " + owner.getForeignName() + " is already attached");
        }
        this.type = type;
    }

    @Override
    public boolean hasDefault() {
        return owner.getDefaultConstructor() != null;
    }

    @Override
    public V construct(List<V> args) {
        ConstructorDescriptor ctor = resolve(args.size());
        Object[] nativeArgs = convertArguments(ctor, args);

        Object instance;
        try {
            instance = ctor.newInstance(nativeArgs);
        } catch (Throwable t) {
            throw error(ErrorKind.NATIVE_FAILURE, "Constructor " + owner.getForeignName() + ctor
                    + " failed: " + describe(t), t);
        }
        NativeWrapper wrapper = lifetime.allocate();
        wrapper.construct(instance, true);
        return publish(wrapper);
    }

    @Override
    public V adopt(Object instance) {
        if (!owner.getNativeType().isInstance(instance)) {
            throw new IllegalArgumentException("Expected an instance of " + owner.getNativeType().getName()
                    + " but got " + (instance == null ? "null" : instance.getClass().getName()));
        }
        return publish(lifetime.adopt(instance));
    }

    private ConstructorDescriptor resolve(int argc) {
        if (argc == 0) {
            ConstructorDescriptor ctor = owner.getDefaultConstructor();
            if (ctor == null) {
                throw error(ErrorKind.CONSTRUCTOR_RESOLUTION,
                        owner.getForeignName() + " has no default constructor", null);
            }
            return ctor;
        }
        for (ConstructorDescriptor ctor : owner.getConstructors()) {
            if (!ctor.isDefault() && ctor.getArity() == argc) {
                return ctor;
            }
        }
        throw error(ErrorKind.CONSTRUCTOR_RESOLUTION,
                "No constructor of " + owner.getForeignName() + " accepts " + argc + " argument(s)", null);
    }

    private Object[] convertArguments(ConstructorDescriptor ctor, List<V> args) {
        List<TypeShape> params = ctor.getParameterTypes();
        Object[] nativeArgs = new Object[params.size()];
        for (int i = 0; i < nativeArgs.length; i++) {
            try {
                nativeArgs[i] = converter.fromForeign(params.get(i), args.get(i));
            } catch (ConversionException e) {
                throw error(ErrorKind.CONSTRUCTOR_RESOLUTION, "No constructor of " + owner.getForeignName()
                        + " matches the arguments: argument " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return nativeArgs;
    }

    private V publish(NativeWrapper wrapper) {
        if (type == null) {
            throw new IllegalStateException("Type " + owner.getForeignName() + " is not defined yet");
        }
        V handle = runtime.wrapNative(type, wrapper);
        lifetime.attach(handle, wrapper);
        return handle;
    }
}
