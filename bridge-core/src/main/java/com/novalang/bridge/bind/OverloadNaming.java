package com.novalang.bridge.bind;

import com.novalang.bridge.model.MethodDescriptor;

import java.util.List;

/**
 * 重载名分配策略。
 *
 * <p>脚本运行时没有原生的方法重载，同名方法需要各自得到一个脚本可见名。
 * 实现必须是确定性的：相同的参数类型列表在任意次生成中得到相同名称。</p>
 */
public interface OverloadNaming {

    /**
     * 为一个重载组分配脚本名。
     *
     * @param baseName 方法名
     * @param group    同名方法，按声明顺序
     * @return 与 group 等长且一一对应的脚本名
     */
    List<String> assignNames(String baseName, List<MethodDescriptor> group);
}
