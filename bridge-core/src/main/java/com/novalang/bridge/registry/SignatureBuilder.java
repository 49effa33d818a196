package com.novalang.bridge.registry;

import com.novalang.bridge.model.FieldDescriptor;
import com.novalang.bridge.model.MethodDescriptor;
import com.novalang.bridge.model.TypeNames;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 结构签名
 *
 * <pre>
 * [hash:&lt;内容摘要&gt;|]class:&lt;简单类名&gt;|members:&lt;字段名&gt;:&lt;类型&gt;,...|methods:&lt;方法名&gt;,...
 * </pre>
 *
 * <p>方法默认按名称去重、保持声明顺序；带类型模式下每个重载单独列出 {@code name(int,String)}。
 * 签名只反映结构，方法体的改动需要借助内容摘要才能发现。</p>
 */
public final class SignatureBuilder {

    private SignatureBuilder() {}

    public static String build(Class<?> type, List<FieldDescriptor> fields, List<MethodDescriptor> methods,
                               boolean typedMethods, String contentHash) {
        StringBuilder sig = new StringBuilder();
        if (contentHash != null) {
            sig.append("hash:").append(contentHash).append('|');
        }
        sig.append("class:").append(type.getSimpleName());

        sig.append("|members:");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sig.append(',');
            FieldDescriptor f = fields.get(i);
            sig.append(f.getName()).append(':').append(TypeNames.render(f.getType().getJavaType()));
        }

        sig.append("|methods:");
        Set<String> entries = new LinkedHashSet<>();
        for (MethodDescriptor m : methods) {
            entries.add(typedMethods ? m.describe() : m.getName());
        }
        sig.append(String.join(",", entries));
        return sig.toString();
    }
}
