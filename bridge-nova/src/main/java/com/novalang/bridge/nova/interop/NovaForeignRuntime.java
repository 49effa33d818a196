package com.novalang.bridge.nova.interop;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.bind.NativeWrapper;
import com.novalang.bridge.model.ClassBinding;
import com.novalang.bridge.nova.NovaBoolean;
import com.novalang.bridge.nova.NovaDouble;
import com.novalang.bridge.nova.NovaInt;
import com.novalang.bridge.nova.NovaList;
import com.novalang.bridge.nova.NovaLong;
import com.novalang.bridge.nova.NovaMap;
import com.novalang.bridge.nova.NovaNull;
import com.novalang.bridge.nova.NovaString;
import com.novalang.bridge.nova.NovaValue;
import com.novalang.bridge.runtime.ConstructorThunk;
import com.novalang.bridge.runtime.ForeignRuntime;
import com.novalang.bridge.runtime.MethodThunk;
import com.novalang.bridge.runtime.PropertyThunk;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Nova 值模型上的脚本运行时实现
 *
 * <ul>
 *   <li>整数：Int 范围内为 {@link NovaInt}，否则为 {@link NovaLong}</li>
 *   <li>结构化值：以 {@link NovaString} 为键的 {@link NovaMap}</li>
 *   <li>缺省值为 {@link NovaNull#UNIT}，空值为 {@link NovaNull#NULL}</li>
 *   <li>类型为 {@link NovaBridgeClass}，对象为 {@link NovaBridgeObject}，模块为 {@link NovaLibrary}</li>
 * </ul>
 */
public final class NovaForeignRuntime implements ForeignRuntime<NovaValue> {

    private static final Logger LOG = Logger.getLogger(NovaForeignRuntime.class.getName());

    // ============ 值构造 ============

    @Override
    public NovaValue integer(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return NovaInt.of((int) value);
        }
        return NovaLong.of(value);
    }

    @Override
    public NovaValue floating(double value) {
        return NovaDouble.of(value);
    }

    @Override
    public NovaValue bool(boolean value) {
        return NovaBoolean.of(value);
    }

    @Override
    public NovaValue string(String value) {
        return NovaString.of(value);
    }

    @Override
    public NovaValue array(List<NovaValue> elements) {
        return new NovaList(elements);
    }

    @Override
    public NovaValue structure(Map<String, NovaValue> members) {
        NovaMap map = new NovaMap();
        for (Map.Entry<String, NovaValue> e : members.entrySet()) {
            map.put(e.getKey(), e.getValue());
        }
        return map;
    }

    @Override
    public NovaValue absent() {
        return NovaNull.UNIT;
    }

    @Override
    public NovaValue nullValue() {
        return NovaNull.NULL;
    }

    // ============ 值检查与提取 ============

    @Override
    public boolean isNull(NovaValue value) {
        return value == null || value.isNull();
    }

    @Override
    public boolean isNumber(NovaValue value) {
        return value.isNumber();
    }

    @Override
    public boolean isInteger(NovaValue value) {
        return value.isInteger();
    }

    @Override
    public long toLong(NovaValue value) {
        return value.asLong();
    }

    @Override
    public double toDouble(NovaValue value) {
        return value.asDouble();
    }

    @Override
    public boolean isBoolean(NovaValue value) {
        return value.isBoolean();
    }

    @Override
    public boolean toBoolean(NovaValue value) {
        return value.asBoolean();
    }

    @Override
    public boolean isString(NovaValue value) {
        return value.isString();
    }

    @Override
    public String toJavaString(NovaValue value) {
        return value.asString();
    }

    @Override
    public boolean isArray(NovaValue value) {
        return value.isList();
    }

    @Override
    public List<NovaValue> elements(NovaValue value) {
        return ((NovaList) value).getElements();
    }

    @Override
    public boolean isStructure(NovaValue value) {
        return value.isMap();
    }

    @Override
    public boolean hasMember(NovaValue value, String name) {
        return ((NovaMap) value).containsKey(name);
    }

    @Override
    public NovaValue member(NovaValue value, String name) {
        return ((NovaMap) value).get(name);
    }

    @Override
    public String describe(NovaValue value) {
        return value == null ? "Null" : value.getTypeName();
    }

    // ============ 对象系统 ============

    @Override
    public NovaValue defineClass(ClassBinding binding, ConstructorThunk<NovaValue> constructor,
                                 List<PropertyThunk<NovaValue>> properties, List<MethodThunk<NovaValue>> methods,
                                 List<MethodThunk<NovaValue>> staticMethods) {
        LOG.fine("Defining Nova class " + binding.getForeignName());
        return new NovaBridgeClass(binding, constructor, properties, methods, staticMethods);
    }

    @Override
    public NovaValue wrapNative(NovaValue type, NativeWrapper wrapper) {
        return new NovaBridgeObject((NovaBridgeClass) type, wrapper);
    }

    @Override
    public void export(NovaValue module, String name, NovaValue type) {
        if (!(module instanceof NovaLibrary)) {
            throw new IllegalArgumentException("Module must be a NovaLibrary but got " + describe(module));
        }
        NovaLibrary library = (NovaLibrary) module;
        NovaBridgeClass replaced = library.export(name, (NovaBridgeClass) type);
        if (replaced != null && replaced != type) {
            LOG.info("Replaced member '" + name + "' of library " + library.getName());
        }
    }

    @Override
    public RuntimeException raiseError(ErrorKind kind, String message, Throwable cause) {
        return new NovaRuntimeException(kind, message, cause);
    }
}
