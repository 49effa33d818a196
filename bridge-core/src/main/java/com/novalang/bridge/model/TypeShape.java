package com.novalang.bridge.model;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.List;

/**
 * 一个原生类型的分类结果。
 *
 * <p>由 {@link com.novalang.bridge.classify.TypeClassifier} 创建并按类型缓存。
 * RECORD 形状先以空字段表登记，再由 {@link #completeRecord} 补全，
 * 因此自引用的记录类型（如链表节点）会解析到同一个形状实例。</p>
 */
public final class TypeShape {

    private final TypeKind kind;
    private final Type javaType;
    private final Class<?> rawType;
    private final String token;

    // SEQUENCE / OWNERSHIP_POINTER
    private final TypeShape element;
    private final SequenceKind sequenceKind;
    private final PointerKind pointerKind;

    // ENUMERATION
    private final Object[] enumConstants;

    // RECORD（补全后不再变化）
    private List<FieldDescriptor> recordFields;
    private MethodHandle recordFactory;

    private TypeShape(TypeKind kind, Type javaType, Class<?> rawType, TypeShape element,
                      SequenceKind sequenceKind, PointerKind pointerKind, Object[] enumConstants) {
        this.kind = kind;
        this.javaType = javaType;
        this.rawType = rawType;
        this.token = TypeNames.token(javaType);
        this.element = element;
        this.sequenceKind = sequenceKind;
        this.pointerKind = pointerKind;
        this.enumConstants = enumConstants;
    }

    // ============ 工厂方法 ============

    public static TypeShape primitive(Class<?> type) {
        return new TypeShape(TypeKind.PRIMITIVE, type, type, null, null, null, null);
    }

    public static TypeShape text(Class<?> type) {
        return new TypeShape(TypeKind.TEXT, type, type, null, null, null, null);
    }

    public static TypeShape enumeration(Class<?> type) {
        return new TypeShape(TypeKind.ENUMERATION, type, type, null, null, null, type.getEnumConstants());
    }

    public static TypeShape sequence(Type type, Class<?> raw, SequenceKind sequenceKind, TypeShape element) {
        return new TypeShape(TypeKind.SEQUENCE, type, raw, element, sequenceKind, null, null);
    }

    public static TypeShape pointer(Type type, Class<?> raw, PointerKind pointerKind, TypeShape element) {
        return new TypeShape(TypeKind.OWNERSHIP_POINTER, type, raw, element, null, pointerKind, null);
    }

    /** 创建尚未补全字段的记录形状 */
    public static TypeShape record(Class<?> type) {
        return new TypeShape(TypeKind.RECORD, type, type, null, null, null, null);
    }

    /**
     * 补全记录形状，只允许调用一次。
     *
     * @param fields  按声明顺序排列的字段
     * @param factory 无参构造器句柄，类型为 {@code ()Object}
     */
    public void completeRecord(List<FieldDescriptor> fields, MethodHandle factory) {
        if (kind != TypeKind.RECORD) {
            throw new IllegalStateException("Not a record shape: " + token);
        }
        if (recordFields != null) {
            throw new IllegalStateException("Record shape already completed: " + token);
        }
        this.recordFields = Collections.unmodifiableList(fields);
        this.recordFactory = factory;
    }

    // ============ 访问器 ============

    public TypeKind getKind() {
        return kind;
    }

    public Type getJavaType() {
        return javaType;
    }

    public Class<?> getRawType() {
        return rawType;
    }

    /** 简化类型记号，用于重载名与结构签名 */
    public String getToken() {
        return token;
    }

    /** 序列元素或所有权容器内元素的形状 */
    public TypeShape getElement() {
        return element;
    }

    public SequenceKind getSequenceKind() {
        return sequenceKind;
    }

    public PointerKind getPointerKind() {
        return pointerKind;
    }

    public Object[] getEnumConstants() {
        return enumConstants;
    }

    public List<FieldDescriptor> getRecordFields() {
        if (recordFields == null) {
            throw new IllegalStateException("Record shape not completed: " + token);
        }
        return recordFields;
    }

    public Object newRecordInstance() throws Throwable {
        if (recordFactory == null) {
            throw new IllegalStateException("Record shape not completed: " + token);
        }
        return recordFactory.invoke();
    }

    /** 原生 Java 基本类型（int/double 等）不接受 null */
    public boolean isNullable() {
        return !rawType.isPrimitive();
    }

    @Override
    public String toString() {
        return kind + "(" + token + ")";
    }
}
