package com.novalang.bridge.convert;

import com.novalang.bridge.model.TypeShape;

/**
 * 文本。StringBuilder 与 CharSequence 目标总是从脚本字符串的副本填充。
 */
final class TextConverter implements KindConverter {

    @Override
    public <V> V toForeign(ValueConverter<V> converter, TypeShape shape, Object value) {
        return converter.runtime().string(value.toString());
    }

    @Override
    public <V> Object fromForeign(ValueConverter<V> converter, TypeShape shape, V value) throws ConversionException {
        if (!converter.runtime().isString(value)) {
            throw converter.mismatch(shape, value);
        }
        String s = converter.runtime().toJavaString(value);
        if (shape.getRawType() == StringBuilder.class) {
            return new StringBuilder(s);
        }
        if (shape.getRawType() == CharSequence.class) {
            return new String(s.toCharArray());
        }
        return s;
    }
}
