package com.novalang.bridge.convert;

import com.novalang.bridge.model.FieldDescriptor;
import com.novalang.bridge.model.TypeShape;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 嵌套记录按值转换：脚本侧得到逐字段的结构化值副本，而不是对象句柄。
 */
final class RecordConverter implements KindConverter {

    @Override
    public <V> V toForeign(ValueConverter<V> converter, TypeShape shape, Object value) throws ConversionException {
        Map<String, V> members = new LinkedHashMap<>();
        for (FieldDescriptor field : shape.getRecordFields()) {
            Object fieldValue;
            try {
                fieldValue = field.read(value);
            } catch (Throwable t) {
                throw new ConversionException("Cannot read field '" + field.getName() + "'", t);
            }
            try {
                members.put(field.getName(), converter.toForeign(field.getType(), fieldValue));
            } catch (ConversionException e) {
                throw e.at("field '" + field.getName() + "'");
            }
        }
        return converter.runtime().structure(members);
    }

    @Override
    public <V> Object fromForeign(ValueConverter<V> converter, TypeShape shape, V value) throws ConversionException {
        if (!converter.runtime().isStructure(value)) {
            throw converter.mismatch(shape, value);
        }
        Object instance;
        try {
            instance = shape.newRecordInstance();
        } catch (Throwable t) {
            throw new ConversionException("Cannot instantiate " + shape.getToken(), t);
        }
        for (FieldDescriptor field : shape.getRecordFields()) {
            if (!converter.runtime().hasMember(value, field.getName())) {
                throw new ConversionException("Missing field '" + field.getName() + "' for " + shape.getToken());
            }
            Object fieldValue;
            try {
                fieldValue = converter.fromForeign(field.getType(), converter.runtime().member(value, field.getName()));
            } catch (ConversionException e) {
                throw e.at("field '" + field.getName() + "'");
            }
            try {
                field.initialize(instance, fieldValue);
            } catch (Throwable t) {
                throw new ConversionException("Cannot assign field '" + field.getName() + "'", t);
            }
        }
        return instance;
    }
}
