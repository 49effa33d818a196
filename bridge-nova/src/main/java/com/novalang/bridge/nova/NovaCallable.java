package com.novalang.bridge.nova;

import java.util.List;

/**
 * Nova 可调用对象接口
 *
 * <p>实现类：</p>
 * <ul>
 *   <li>{@code NovaNativeFunction} - 原生 Java 函数、绑定后的方法</li>
 *   <li>{@code NovaBridgeClass} - 绑定类（作为构造器）</li>
 * </ul>
 */
public interface NovaCallable {

    String getName();

    /**
     * @return 参数数量，-1 表示可变参数
     */
    int getArity();

    NovaValue call(List<NovaValue> args);
}
