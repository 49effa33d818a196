package com.novalang.bridge.runtime;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.bind.NativeWrapper;
import com.novalang.bridge.model.ClassBinding;

import java.util.List;
import java.util.Map;

/**
 * 脚本运行时契约
 *
 * <p>绑定引擎只通过该接口接触脚本值，一次编写即可用于任意脚本引擎。{@code V} 是运行时的值类型。</p>
 *
 * <p>"缺省值"（absent）表示无返回值，"空值"（null）表示显式的空；{@link #isNull} 对两者都返回 true。</p>
 */
public interface ForeignRuntime<V> {

    // ============ 值构造 ============

    V integer(long value);

    V floating(double value);

    V bool(boolean value);

    V string(String value);

    V array(List<V> elements);

    /** 以字符串为键的结构化值，保持条目顺序 */
    V structure(Map<String, V> members);

    V absent();

    V nullValue();

    // ============ 值检查与提取 ============

    boolean isNull(V value);

    boolean isNumber(V value);

    /** 整数类型的值（不含值恰好为整数的浮点数） */
    boolean isInteger(V value);

    long toLong(V value);

    double toDouble(V value);

    boolean isBoolean(V value);

    boolean toBoolean(V value);

    boolean isString(V value);

    String toJavaString(V value);

    boolean isArray(V value);

    List<V> elements(V value);

    boolean isStructure(V value);

    boolean hasMember(V value, String name);

    V member(V value, String name);

    /** 值的简短描述（类型名），用于错误消息 */
    String describe(V value);

    // ============ 对象系统 ============

    /**
     * 定义脚本类型。
     *
     * @return 脚本类型句柄
     */
    V defineClass(ClassBinding binding, ConstructorThunk<V> constructor, List<PropertyThunk<V>> properties,
                  List<MethodThunk<V>> methods, List<MethodThunk<V>> staticMethods);

    /**
     * 创建持有包装对象的脚本对象句柄。句柄被回收时，生命周期管理器会结束该包装对象。
     */
    V wrapNative(V type, NativeWrapper wrapper);

    /** 在模块/命名空间中以给定名称导出类型 */
    void export(V module, String name, V type);

    /**
     * 构造运行时自身的异常，由调用方抛出。
     */
    RuntimeException raiseError(ErrorKind kind, String message, Throwable cause);
}
