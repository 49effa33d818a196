package com.novalang.bridge.convert;

import com.novalang.bridge.model.TypeShape;

/**
 * 单一类别的双向转换。null 值已由 {@link ValueConverter} 统一处理，实现只会看到非空值。
 */
interface KindConverter {

    <V> V toForeign(ValueConverter<V> converter, TypeShape shape, Object value) throws ConversionException;

    <V> Object fromForeign(ValueConverter<V> converter, TypeShape shape, V value) throws ConversionException;
}
