package com.novalang.bridge.introspect;

import com.novalang.bridge.BridgeOptions;
import com.novalang.bridge.cache.BoundedCache;
import com.novalang.bridge.cache.CaffeineCache;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 基于反射的结构查询，声明顺序取自类文件。
 *
 * <ul>
 *   <li>字段：非 static、非 synthetic、非 transient；默认只取 public 字段。
 *       子类字段与父类同名时覆盖父类字段，位置保持父类中的位置</li>
 *   <li>方法：public、非 static、非 synthetic、非桥接方法；可选包含父类（不含 Object）声明的方法，
 *       被子类重写的方法只出现一次</li>
 *   <li>静态方法：本类声明的 public static 方法</li>
 *   <li>构造器：public 构造器</li>
 * </ul>
 */
public final class ReflectiveIntrospector implements Introspector {

    private static final Logger LOG = Logger.getLogger(ReflectiveIntrospector.class.getName());

    private final BridgeOptions options;

    /** 类 → 声明顺序 */
    private final BoundedCache<Class<?>, DeclarationOrder> orders = CaffeineCache.weakKeys(1024);

    public ReflectiveIntrospector(BridgeOptions options) {
        this.options = options;
    }

    // ============ 字段 ============

    @Override
    public List<Field> fieldsOf(Class<?> type) {
        Map<String, Field> byName = new LinkedHashMap<>();
        for (Class<?> c : hierarchy(type)) {
            List<Field> declared = new ArrayList<>();
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (Modifier.isStatic(mod) || Modifier.isTransient(mod) || f.isSynthetic()) continue;
                if (!Modifier.isPublic(mod) && !options.isIncludeNonPublicFields()) continue;
                if (options.isMemberExcluded(type, f.getName())) continue;
                declared.add(f);
            }
            DeclarationOrder order = orderOf(c);
            declared.sort(Comparator.<Field>comparingInt(order::indexOf).thenComparing(Field::getName));
            for (Field f : declared) {
                byName.put(f.getName(), f);
            }
        }
        return new ArrayList<>(byName.values());
    }

    // ============ 方法 ============

    @Override
    public List<Method> methodsOf(Class<?> type) {
        Map<String, Method> byKey = new LinkedHashMap<>();
        for (Class<?> c : hierarchy(type)) {
            List<Method> declared = new ArrayList<>();
            for (Method m : c.getDeclaredMethods()) {
                int mod = m.getModifiers();
                if (!Modifier.isPublic(mod) || Modifier.isStatic(mod)) continue;
                if (m.isSynthetic() || m.isBridge()) continue;
                if (options.isMemberExcluded(type, m.getName())) continue;
                declared.add(m);
            }
            for (Method m : sortMethods(c, declared)) {
                byKey.put(m.getName() + Arrays.toString(m.getParameterTypes()), m);
            }
        }
        return new ArrayList<>(byKey.values());
    }

    @Override
    public List<Method> staticMethodsOf(Class<?> type) {
        List<Method> declared = new ArrayList<>();
        for (Method m : type.getDeclaredMethods()) {
            int mod = m.getModifiers();
            if (!Modifier.isPublic(mod) || !Modifier.isStatic(mod) || m.isSynthetic()) continue;
            if (options.isMemberExcluded(type, m.getName())) continue;
            declared.add(m);
        }
        return sortMethods(type, declared);
    }

    private List<Method> sortMethods(Class<?> owner, List<Method> methods) {
        DeclarationOrder order = orderOf(owner);
        methods.sort(Comparator.<Method>comparingInt(order::indexOf)
                .thenComparing(Method::getName)
                .thenComparing(m -> org.objectweb.asm.Type.getMethodDescriptor(m)));
        return methods;
    }

    // ============ 构造器 ============

    @Override
    public List<Constructor<?>> constructorsOf(Class<?> type) {
        List<Constructor<?>> ctors = new ArrayList<>(Arrays.asList(type.getConstructors()));
        DeclarationOrder order = orderOf(type);
        ctors.sort(Comparator.<Constructor<?>>comparingInt(order::indexOf)
                .thenComparingInt(Constructor::getParameterCount)
                .thenComparing(c -> org.objectweb.asm.Type.getConstructorDescriptor(c)));
        return ctors;
    }

    // ============ 内部 ============

    /** 从最顶层父类（不含 Object）到 type 本身 */
    private List<Class<?>> hierarchy(Class<?> type) {
        List<Class<?>> chain = new ArrayList<>();
        if (options.isIncludeInheritedMembers()) {
            for (Class<?> c = type.getSuperclass(); c != null && c != Object.class; c = c.getSuperclass()) {
                chain.add(0, c);
            }
        }
        chain.add(type);
        return chain;
    }

    DeclarationOrder orderOf(Class<?> type) {
        return orders.computeIfAbsent(type, c -> {
            byte[] bytes = ClassBytes.read(c);
            if (bytes == null) {
                LOG.warning("Class file of " + c.getName() + " is unavailable, ordering members by name");
                return DeclarationOrder.UNKNOWN;
            }
            return DeclarationOrder.read(bytes);
        });
    }
}
