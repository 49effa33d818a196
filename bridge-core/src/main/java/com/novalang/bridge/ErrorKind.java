package com.novalang.bridge;

/**
 * 调用期错误分类。所有调用期错误都可由脚本调用方捕获，不会使进程失败。
 */
public enum ErrorKind {

    /** 方法调用实参数量与形参数量不一致，在任何参数转换之前报告 */
    ARITY,

    /** 实参或字段值的脚本表示与期望类型不匹配（含容器元素、记录字段缺失） */
    CONVERSION,

    /** 没有构造器接受该实参数量，或匹配构造器的实参转换失败 */
    CONSTRUCTOR_RESOLUTION,

    /** 包装对象已失效（原生引用为空，例如已被回收） */
    INVALID_OBJECT,

    /** 访问不存在的属性或方法 */
    UNKNOWN_MEMBER,

    /** 写入只读（final）字段 */
    READ_ONLY,

    /** 被绑定的 Java 代码自身抛出异常 */
    NATIVE_FAILURE
}
