package com.novalang.bridge.convert;

import com.novalang.bridge.model.TypeShape;

/**
 * Optional 与 AtomicReference。容器本身在脚本侧不可见，只转换其中的元素。
 */
final class PointerConverter implements KindConverter {

    @Override
    public <V> V toForeign(ValueConverter<V> converter, TypeShape shape, Object value) throws ConversionException {
        return converter.toForeign(shape.getElement(), shape.getPointerKind().unwrap(value));
    }

    @Override
    public <V> Object fromForeign(ValueConverter<V> converter, TypeShape shape, V value) throws ConversionException {
        Object element = converter.fromForeign(shape.getElement(), value);
        return shape.getPointerKind().wrap(element);
    }
}
