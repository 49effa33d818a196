package com.novalang.bridge.convert;

import com.novalang.bridge.model.TypeKind;
import com.novalang.bridge.model.TypeShape;
import com.novalang.bridge.runtime.ForeignRuntime;

import java.util.EnumMap;
import java.util.Map;

/**
 * 值转换层入口
 *
 * <p>按 {@link TypeShape} 的类别分派到各类别转换器；序列、所有权容器与记录会递归回到这里。</p>
 *
 * <p>null 规则：Java null 转为脚本空值；脚本空值（含缺省值）转为 Java null，
 * 目标是 Java 基本类型时失败，目标是所有权容器时得到空容器。</p>
 *
 * <p>记录转换不检测对象图中的环，带环的对象图转为脚本值会无限递归。</p>
 */
public final class ValueConverter<V> {

    private static final Map<TypeKind, KindConverter> CONVERTERS = new EnumMap<>(TypeKind.class);

    static {
        CONVERTERS.put(TypeKind.PRIMITIVE, new PrimitiveConverter());
        CONVERTERS.put(TypeKind.TEXT, new TextConverter());
        CONVERTERS.put(TypeKind.ENUMERATION, new EnumerationConverter());
        CONVERTERS.put(TypeKind.SEQUENCE, new SequenceConverter());
        CONVERTERS.put(TypeKind.OWNERSHIP_POINTER, new PointerConverter());
        CONVERTERS.put(TypeKind.RECORD, new RecordConverter());
    }

    private final ForeignRuntime<V> runtime;

    public ValueConverter(ForeignRuntime<V> runtime) {
        this.runtime = runtime;
    }

    public ForeignRuntime<V> runtime() {
        return runtime;
    }

    public V toForeign(TypeShape shape, Object value) throws ConversionException {
        if (value == null) {
            return runtime.nullValue();
        }
        return CONVERTERS.get(shape.getKind()).toForeign(this, shape, value);
    }

    public Object fromForeign(TypeShape shape, V value) throws ConversionException {
        if (value == null || runtime.isNull(value)) {
            if (shape.getKind() == TypeKind.OWNERSHIP_POINTER) {
                return shape.getPointerKind().wrap(null);
            }
            if (!shape.isNullable()) {
                throw new ConversionException("null is not a valid " + shape.getToken());
            }
            return null;
        }
        return CONVERTERS.get(shape.getKind()).fromForeign(this, shape, value);
    }

    ConversionException mismatch(TypeShape shape, V value) {
        return new ConversionException("Expected " + shape.getToken() + " but got " + runtime.describe(value));
    }
}
