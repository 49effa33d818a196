package com.novalang.bridge.bind;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.convert.ConversionException;
import com.novalang.bridge.convert.ValueConverter;
import com.novalang.bridge.model.ClassBinding;
import com.novalang.bridge.model.FieldDescriptor;
import com.novalang.bridge.runtime.PropertyThunk;

/**
 * 字段的 getter/setter 桩。
 */
public final class FieldAccessor<V> extends AbstractThunk<V> implements PropertyThunk<V> {

    private final FieldDescriptor field;

    public FieldAccessor(ClassBinding owner, FieldDescriptor field, ValueConverter<V> converter) {
        super(owner, converter);
        this.field = field;
    }

    @Override
    public String name() {
        return field.getName();
    }

    @Override
    public boolean isReadOnly() {
        return field.isReadOnly();
    }

    @Override
    public V get(NativeWrapper self) {
        Object target = requireLive(self, field.getName());
        Object value;
        try {
            value = field.read(target);
        } catch (Throwable t) {
            throw error(ErrorKind.NATIVE_FAILURE, "Reading " + qualifiedName() + " failed: " + describe(t), t);
        }
        try {
            return converter.toForeign(field.getType(), value);
        } catch (ConversionException e) {
            throw error(ErrorKind.CONVERSION, qualifiedName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void set(NativeWrapper self, V value) {
        if (field.isReadOnly()) {
            throw error(ErrorKind.READ_ONLY, "Property " + qualifiedName() + " is read-only", null);
        }
        Object target = requireLive(self, field.getName());
        Object converted;
        try {
            converted = converter.fromForeign(field.getType(), value);
        } catch (ConversionException e) {
            throw error(ErrorKind.CONVERSION, qualifiedName() + ": " + e.getMessage(), e);
        }
        try {
            field.write(target, converted);
        } catch (Throwable t) {
            throw error(ErrorKind.NATIVE_FAILURE, "Writing " + qualifiedName() + " failed: " + describe(t), t);
        }
    }

    private String qualifiedName() {
        return owner.getForeignName() + "." + field.getName();
    }
}
