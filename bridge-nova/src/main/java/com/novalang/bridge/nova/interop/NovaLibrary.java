package com.novalang.bridge.nova.interop;

import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.nova.NovaValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 绑定模块在脚本中的命名空间，成员是导出的 {@link NovaBridgeClass}。
 *
 * <pre>
 * NovaLibrary geometry = bridge.defineLibrary(BridgeModule.builder("geometry").bind(Point.class).build());
 *
 * // Nova 脚本
 * val p = geometry.Point(3.0, 4.0)
 * </pre>
 */
public final class NovaLibrary extends NovaValue {

    private final String name;
    private final Map<String, NovaBridgeClass> classes = new LinkedHashMap<>();

    public NovaLibrary(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * 登记导出的类，同名时覆盖。
     *
     * @return 被覆盖的类，没有则为 null
     */
    NovaBridgeClass export(String className, NovaBridgeClass type) {
        return classes.put(className, type);
    }

    /**
     * 脚本侧的 {@code lib.Name} 访问。
     *
     * @throws NovaRuntimeException UNKNOWN_MEMBER
     */
    public NovaBridgeClass member(String className) {
        NovaBridgeClass type = classes.get(className);
        if (type == null) {
            throw new NovaRuntimeException(ErrorKind.UNKNOWN_MEMBER,
                    "Library " + name + " has no member '" + className + "'");
        }
        return type;
    }

    public boolean hasMember(String className) {
        return classes.containsKey(className);
    }

    /** 按导出顺序 */
    public Map<String, NovaBridgeClass> getClasses() {
        return Collections.unmodifiableMap(classes);
    }

    @Override
    public String getTypeName() {
        return "Library";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public String toString() {
        return "<library " + name + " " + classes.keySet() + ">";
    }
}
