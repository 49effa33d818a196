package com.novalang.bridge.bind;

import com.novalang.bridge.model.MethodDescriptor;
import com.novalang.bridge.model.TypeShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按参数类型追加后缀的重载命名。
 *
 * <p>组内只有一个方法时保留原名；否则每个成员命名为
 * {@code 方法名_参数记号_参数记号...}，例如 {@code print(int)} 与 {@code print(double)}
 * 分别得到 {@code print_int} 与 {@code print_double}。</p>
 */
public final class TypeSuffixNaming implements OverloadNaming {

    public static final TypeSuffixNaming INSTANCE = new TypeSuffixNaming();

    @Override
    public List<String> assignNames(String baseName, List<MethodDescriptor> group) {
        if (group.size() == 1) {
            return Collections.singletonList(baseName);
        }
        List<String> names = new ArrayList<>(group.size());
        for (MethodDescriptor method : group) {
            names.add(mangle(baseName, method.getParameterTypes()));
        }
        return names;
    }

    static String mangle(String baseName, List<TypeShape> parameterTypes) {
        StringBuilder sb = new StringBuilder(baseName);
        for (TypeShape param : parameterTypes) {
            sb.append('_').append(param.getToken());
        }
        return sb.toString();
    }
}
