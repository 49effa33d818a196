package com.novalang.bridge.convert;

import com.novalang.bridge.model.TypeShape;

/**
 * 枚举在脚本侧以序号表示。
 */
final class EnumerationConverter implements KindConverter {

    @Override
    public <V> V toForeign(ValueConverter<V> converter, TypeShape shape, Object value) {
        return converter.runtime().integer(((Enum<?>) value).ordinal());
    }

    @Override
    public <V> Object fromForeign(ValueConverter<V> converter, TypeShape shape, V value) throws ConversionException {
        if (!converter.runtime().isInteger(value)) {
            throw converter.mismatch(shape, value);
        }
        long ordinal = converter.runtime().toLong(value);
        Object[] constants = shape.getEnumConstants();
        if (ordinal < 0 || ordinal >= constants.length) {
            throw new ConversionException("Ordinal " + ordinal + " is out of range for " + shape.getToken()
                    + " (" + constants.length + " constants)");
        }
        return constants[(int) ordinal];
    }
}
