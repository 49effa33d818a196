package com.novalang.bridge.bind;

import com.novalang.bridge.model.ClassBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一组要导出到同一脚本模块的类。
 *
 * <pre>
 * BridgeModule geometry = BridgeModule.builder("geometry")
 *     .bind(Point.class)
 *     .bind("Rect", Rectangle.class)
 *     .build();
 * geometry.registerInto(generator, moduleHandle);
 * </pre>
 *
 * <p>类按列出顺序绑定。嵌套记录按值转换，不需要先绑定；其余相互引用的类应按依赖顺序列出。</p>
 */
public final class BridgeModule {

    private final String name;
    private final Map<String, Class<?>> classes;

    private BridgeModule(String name, Map<String, Class<?>> classes) {
        this.name = name;
        this.classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /** 脚本名 → 类，按绑定顺序 */
    public Map<String, Class<?>> getClasses() {
        return classes;
    }

    public <V> List<ClassBinding> registerInto(BindingGenerator<V> generator, V module) {
        List<ClassBinding> bound = new ArrayList<>(classes.size());
        for (Map.Entry<String, Class<?>> e : classes.entrySet()) {
            bound.add(generator.bindInto(module, e.getKey(), e.getValue()));
        }
        return bound;
    }

    public static final class Builder {
        private final String name;
        private final Map<String, Class<?>> classes = new LinkedHashMap<>();

        Builder(String name) {
            this.name = name;
        }

        public Builder bind(Class<?> type) {
            return bind(type.getSimpleName(), type);
        }

        public Builder bind(String foreignName, Class<?> type) {
            if (classes.containsKey(foreignName)) {
                throw new IllegalArgumentException("Duplicate name '" + foreignName + "' in module " + name);
            }
            classes.put(foreignName, type);
            return this;
        }

        public BridgeModule build() {
            return new BridgeModule(name, classes);
        }
    }
}
