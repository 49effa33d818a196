package com.novalang.bridge.introspect;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;

/**
 * 类结构查询。
 *
 * <p>所有查询都是纯函数：对同一个类总是返回相同成员、相同顺序，只在绑定生成期调用。
 * 返回的成员已按暴露规则过滤，并按声明顺序排列。</p>
 */
public interface Introspector {

    /** 实例字段，父类字段在前 */
    List<Field> fieldsOf(Class<?> type);

    /** 实例方法 */
    List<Method> methodsOf(Class<?> type);

    /** 静态方法 */
    List<Method> staticMethodsOf(Class<?> type);

    /** 公开构造器 */
    List<Constructor<?>> constructorsOf(Class<?> type);
}
