package com.novalang.bridge.model;

/**
 * 原生类型分类。每个出现在字段、参数或返回值位置的类型必须恰好归入其中一类。
 */
public enum TypeKind {
    /** 数值、布尔、字符及其包装类 */
    PRIMITIVE,
    /** 字符序列：String / CharSequence / StringBuilder */
    TEXT,
    /** 枚举，脚本侧表示为序号整数 */
    ENUMERATION,
    /** 数组与集合 */
    SEQUENCE,
    /** 单元素所有权容器：Optional / AtomicReference */
    OWNERSHIP_POINTER,
    /** 可按字段展开的嵌套对象，按值转换 */
    RECORD
}
