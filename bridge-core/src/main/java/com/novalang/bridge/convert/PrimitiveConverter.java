package com.novalang.bridge.convert;

import com.novalang.bridge.model.TypeShape;
import com.novalang.bridge.runtime.ForeignRuntime;

/**
 * 数值、布尔与字符。
 *
 * <p>整数类目标只接受脚本整数且检查取值范围；浮点类目标接受任意脚本数值。
 * char 在脚本侧是长度为 1 的字符串。</p>
 */
final class PrimitiveConverter implements KindConverter {

    @Override
    public <V> V toForeign(ValueConverter<V> converter, TypeShape shape, Object value) {
        ForeignRuntime<V> rt = converter.runtime();
        if (value instanceof Boolean) {
            return rt.bool((Boolean) value);
        }
        if (value instanceof Character) {
            return rt.string(String.valueOf((char) (Character) value));
        }
        if (value instanceof Double || value instanceof Float) {
            return rt.floating(((Number) value).doubleValue());
        }
        return rt.integer(((Number) value).longValue());
    }

    @Override
    public <V> Object fromForeign(ValueConverter<V> converter, TypeShape shape, V value) throws ConversionException {
        ForeignRuntime<V> rt = converter.runtime();
        Class<?> t = shape.getRawType();
        if (t == boolean.class || t == Boolean.class) {
            if (!rt.isBoolean(value)) throw converter.mismatch(shape, value);
            return rt.toBoolean(value);
        }
        if (t == char.class || t == Character.class) {
            if (!rt.isString(value)) throw converter.mismatch(shape, value);
            String s = rt.toJavaString(value);
            if (s.length() != 1) {
                throw new ConversionException("Expected a single character but got a string of length " + s.length());
            }
            return s.charAt(0);
        }
        if (t == double.class || t == Double.class) {
            if (!rt.isNumber(value)) throw converter.mismatch(shape, value);
            return rt.toDouble(value);
        }
        if (t == float.class || t == Float.class) {
            if (!rt.isNumber(value)) throw converter.mismatch(shape, value);
            double d = rt.toDouble(value);
            if (Double.isFinite(d) && Math.abs(d) > Float.MAX_VALUE) {
                throw new ConversionException("Value " + d + " is out of range for float");
            }
            return (float) d;
        }
        if (!rt.isInteger(value)) throw converter.mismatch(shape, value);
        long l = rt.toLong(value);
        if (t == long.class || t == Long.class) {
            return l;
        }
        if (t == int.class || t == Integer.class) {
            checkRange(l, Integer.MIN_VALUE, Integer.MAX_VALUE, "int");
            return (int) l;
        }
        if (t == short.class || t == Short.class) {
            checkRange(l, Short.MIN_VALUE, Short.MAX_VALUE, "short");
            return (short) l;
        }
        if (t == byte.class || t == Byte.class) {
            checkRange(l, Byte.MIN_VALUE, Byte.MAX_VALUE, "byte");
            return (byte) l;
        }
        throw new IllegalStateException("Not a primitive type: " + t.getName());
    }

    private static void checkRange(long value, long min, long max, String typeName) throws ConversionException {
        if (value < min || value > max) {
            throw new ConversionException("Value " + value + " is out of range for " + typeName);
        }
    }
}
