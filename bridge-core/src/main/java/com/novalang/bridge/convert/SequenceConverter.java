package com.novalang.bridge.convert;

import com.novalang.bridge.model.SequenceKind;
import com.novalang.bridge.model.TypeShape;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 数组与集合，按迭代顺序逐元素递归转换。任一元素失败则整个容器转换失败。
 */
final class SequenceConverter implements KindConverter {

    @Override
    public <V> V toForeign(ValueConverter<V> converter, TypeShape shape, Object value) throws ConversionException {
        TypeShape element = shape.getElement();
        List<V> out;
        if (shape.getSequenceKind() == SequenceKind.ARRAY) {
            int length = Array.getLength(value);
            out = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                out.add(convertElement(converter, element, Array.get(value, i), i));
            }
        } else {
            Collection<?> items = (Collection<?>) value;
            out = new ArrayList<>(items.size());
            int i = 0;
            for (Object item : items) {
                out.add(convertElement(converter, element, item, i++));
            }
        }
        return converter.runtime().array(out);
    }

    private static <V> V convertElement(ValueConverter<V> converter, TypeShape element, Object item, int index)
            throws ConversionException {
        try {
            return converter.toForeign(element, item);
        } catch (ConversionException e) {
            throw e.at("element [" + index + "]");
        }
    }

    @Override
    public <V> Object fromForeign(ValueConverter<V> converter, TypeShape shape, V value) throws ConversionException {
        if (!converter.runtime().isArray(value)) {
            throw converter.mismatch(shape, value);
        }
        List<V> items = converter.runtime().elements(value);
        TypeShape element = shape.getElement();
        SequenceKind kind = shape.getSequenceKind();
        if (kind == SequenceKind.ARRAY) {
            Object array = SequenceKind.newArray(element.getRawType(), items.size());
            for (int i = 0; i < items.size(); i++) {
                Array.set(array, i, readElement(converter, element, items.get(i), i));
            }
            return array;
        }
        Collection<Object> target = kind.newCollection(shape.getRawType(), items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = readElement(converter, element, items.get(i), i);
            if (item == null && !kind.acceptsNull()) {
                throw new ConversionException("element [" + i + "]: null is not allowed in " + shape.getToken());
            }
            try {
                target.add(item);
            } catch (ClassCastException | IllegalArgumentException | NullPointerException e) {
                throw new ConversionException("element [" + i + "]: rejected by " + shape.getToken(), e);
            }
        }
        return target;
    }

    private static <V> Object readElement(ValueConverter<V> converter, TypeShape element, V item, int index)
            throws ConversionException {
        try {
            return converter.fromForeign(element, item);
        } catch (ConversionException e) {
            throw e.at("element [" + index + "]");
        }
    }
}
