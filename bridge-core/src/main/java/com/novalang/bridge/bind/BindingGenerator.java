package com.novalang.bridge.bind;

import com.novalang.bridge.BindingBuildException;
import com.novalang.bridge.BridgeOptions;
import com.novalang.bridge.classify.TypeClassifier;
import com.novalang.bridge.convert.ValueConverter;
import com.novalang.bridge.introspect.Introspector;
import com.novalang.bridge.introspect.MemberHandles;
import com.novalang.bridge.introspect.ReflectiveIntrospector;
import com.novalang.bridge.model.ClassBinding;
import com.novalang.bridge.model.ConstructorDescriptor;
import com.novalang.bridge.model.FieldDescriptor;
import com.novalang.bridge.model.MethodDescriptor;
import com.novalang.bridge.registry.ContentHasher;
import com.novalang.bridge.registry.SignatureBuilder;
import com.novalang.bridge.registry.SignatureRegistry;
import com.novalang.bridge.runtime.ForeignRuntime;
import com.novalang.bridge.runtime.MethodThunk;
import com.novalang.bridge.runtime.PropertyThunk;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 绑定生成器
 *
 * <p>对一个 Java 类：查询结构、分类全部成员类型、生成属性/方法/构造桩、在脚本运行时中定义类型，
 * 并登记到签名注册表。每个类在一个生成器中只绑定一次。</p>
 *
 * <pre>
 * BindingGenerator&lt;NovaValue&gt; generator = new BindingGenerator&lt;&gt;(new NovaForeignRuntime());
 * generator.bind(Point.class);
 * NovaValue point = generator.typeOf(Point.class);
 * </pre>
 *
 * <p>绑定只应在单线程的模块初始化期间进行。</p>
 */
public final class BindingGenerator<V> {

    private static final Logger LOG = Logger.getLogger(BindingGenerator.class.getName());

    private final ForeignRuntime<V> runtime;
    private final SignatureRegistry registry;
    private final BridgeOptions options;
    private final Introspector introspector;
    private final TypeClassifier classifier;
    private final ValueConverter<V> converter;
    private final LifetimeManager lifetime = new LifetimeManager();

    private final Map<Class<?>, ClassBinding> bindings = new LinkedHashMap<>();
    private final Map<Class<?>, ConstructorResolver<V>> resolvers = new LinkedHashMap<>();

    public BindingGenerator(ForeignRuntime<V> runtime) {
        this(runtime, new SignatureRegistry(), BridgeOptions.defaults());
    }

    public BindingGenerator(ForeignRuntime<V> runtime, BridgeOptions options) {
        this(runtime, new SignatureRegistry(), options);
    }

    public BindingGenerator(ForeignRuntime<V> runtime, SignatureRegistry registry, BridgeOptions options) {
        this(runtime, registry, options, new ReflectiveIntrospector(options));
    }

    public BindingGenerator(ForeignRuntime<V> runtime, SignatureRegistry registry, BridgeOptions options,
                            Introspector introspector) {
        this.runtime = runtime;
        this.registry = registry;
        this.options = options;
        this.introspector = introspector;
        this.classifier = new TypeClassifier(introspector, new MemberHandles(options.isAllowSetAccessible()));
        this.converter = new ValueConverter<>(runtime);
    }

    // ============ 绑定 ============

    /** 以类的简单名绑定 */
    public ClassBinding bind(Class<?> type) {
        return bind(type.getSimpleName(), type);
    }

    /**
     * 绑定一个类。已绑定过的类直接返回原有绑定。
     *
     * @throws BindingBuildException 类或其成员无法绑定
     */
    public ClassBinding bind(String foreignName, Class<?> type) {
        ClassBinding existing = bindings.get(type);
        if (existing != null) {
            if (!existing.getForeignName().equals(foreignName)) {
                LOG.fine(type.getName() + " is already bound as " + existing.getForeignName()
                        + ", ignoring name " + foreignName);
            }
            return existing;
        }
        checkBindable(type);

        List<FieldDescriptor> fields = new ArrayList<>();
        for (Field f : introspector.fieldsOf(type)) {
            fields.add(classifier.describeField(type, f));
        }
        List<MethodDescriptor> methods = describeMethods(type, introspector.methodsOf(type));
        List<MethodDescriptor> statics = options.isBindStaticMethods()
                ? describeMethods(type, introspector.staticMethodsOf(type))
                : Collections.<MethodDescriptor>emptyList();
        List<ConstructorDescriptor> constructors = new ArrayList<>();
        for (Constructor<?> c : introspector.constructorsOf(type)) {
            constructors.add(classifier.describeConstructor(type, c));
        }
        if (options.isRequireDefaultConstructor() && constructors.stream().noneMatch(ConstructorDescriptor::isDefault)) {
            throw new BindingBuildException("No default constructor in " + type.getName(), type, "<init>", null);
        }

        Set<String> usedNames = new HashSet<>();
        for (FieldDescriptor f : fields) {
            usedNames.add(f.getName());
        }
        Map<String, MethodDescriptor> methodNames = assignNames(type, methods, usedNames);
        Map<String, MethodDescriptor> staticNames = assignNames(type, statics, new HashSet<>());

        String contentHash = options.isContentHashing() ? ContentHasher.sha256Of(type) : null;
        String signature = SignatureBuilder.build(type, fields, methods, options.isTypedMethodSignatures(), contentHash);

        ClassBinding binding = new ClassBinding(type, foreignName, fields, methodNames, staticNames,
                constructors, signature);
        define(binding);
        LOG.info("Bound " + type.getName() + " as " + foreignName + " (" + fields.size() + " properties, "
                + methodNames.size() + " methods, " + constructors.size() + " constructors)");
        return binding;
    }

    /**
     * 绑定并以给定名称导出到脚本模块。
     */
    public ClassBinding bindInto(V module, String foreignName, Class<?> type) {
        ClassBinding binding = bind(foreignName, type);
        runtime.export(module, foreignName, typeOf(type));
        return binding;
    }

    private static void checkBindable(Class<?> type) {
        if (type.isInterface() || type.isPrimitive() || type.isArray() || type.isEnum()
                || type.isAnnotation() || Modifier.isAbstract(type.getModifiers())) {
            throw new BindingBuildException(type.getName() + " is not a concrete class", type, null, null);
        }
    }

    private List<MethodDescriptor> describeMethods(Class<?> type, List<Method> methods) {
        List<MethodDescriptor> described = new ArrayList<>(methods.size());
        for (Method m : methods) {
            described.add(classifier.describeMethod(type, m));
        }
        return described;
    }

    /**
     * 按重载组分配脚本名，保持声明顺序。名称与已占用名称冲突时是构建错误。
     */
    private Map<String, MethodDescriptor> assignNames(Class<?> type, List<MethodDescriptor> methods,
                                                      Set<String> usedNames) {
        Map<String, List<MethodDescriptor>> groups = new LinkedHashMap<>();
        for (MethodDescriptor m : methods) {
            groups.computeIfAbsent(m.getOverloadGroup(), k -> new ArrayList<>()).add(m);
        }
        Map<String, MethodDescriptor> named = new LinkedHashMap<>();
        for (Map.Entry<String, List<MethodDescriptor>> group : groups.entrySet()) {
            List<String> names = options.getOverloadNaming().assignNames(group.getKey(), group.getValue());
            if (names.size() != group.getValue().size()) {
                throw new BindingBuildException("Overload naming returned " + names.size() + " names for "
                        + group.getValue().size() + " methods", type, group.getKey(), null);
            }
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                if (!usedNames.add(name)) {
                    throw new BindingBuildException("Name '" + name + "' of " + group.getValue().get(i)
                            + " collides with another member of " + type.getName(), type, name, null);
                }
                named.put(name, group.getValue().get(i));
            }
        }
        return named;
    }

    private void define(ClassBinding binding) {
        List<PropertyThunk<V>> properties = new ArrayList<>();
        for (FieldDescriptor f : binding.getFields()) {
            properties.add(new FieldAccessor<>(binding, f, converter));
        }
        List<MethodThunk<V>> methods = invokers(binding, binding.getMethods());
        List<MethodThunk<V>> statics = invokers(binding, binding.getStaticMethods());
        ConstructorResolver<V> resolver = new ConstructorResolver<>(binding, converter, lifetime);

        V type = runtime.defineClass(binding, resolver, properties, methods, statics);
        resolver.attachType(type);
        binding.attachForeignType(type);

        if (registry.needsRegeneration(binding.getForeignName(), binding.getSignature())) {
            LOG.fine("Registering signature of " + binding.getForeignName() + ": " + binding.getSignature());
        }
        registry.register(binding.getForeignName(), binding.getSignature(), type);
        bindings.put(binding.getNativeType(), binding);
        resolvers.put(binding.getNativeType(), resolver);
    }

    private List<MethodThunk<V>> invokers(ClassBinding binding, Map<String, MethodDescriptor> methods) {
        List<MethodThunk<V>> thunks = new ArrayList<>(methods.size());
        for (Map.Entry<String, MethodDescriptor> e : methods.entrySet()) {
            thunks.add(new MethodInvoker<>(binding, e.getKey(), e.getValue(), converter));
        }
        return thunks;
    }

    // ============ 宿主对象 ============

    /**
     * 把宿主已有的对象暴露给脚本，不转移所有权。按实例类型向上查找最近的已绑定类。
     */
    public V wrap(Object instance) {
        for (Class<?> c = instance.getClass(); c != null; c = c.getSuperclass()) {
            ConstructorResolver<V> resolver = resolvers.get(c);
            if (resolver != null) {
                return resolver.adopt(instance);
            }
        }
        throw new IllegalArgumentException("No binding for " + instance.getClass().getName());
    }

    // ============ 查询 ============

    public ClassBinding getBinding(Class<?> type) {
        return bindings.get(type);
    }

    @SuppressWarnings("unchecked")
    public V typeOf(Class<?> type) {
        ClassBinding binding = bindings.get(type);
        if (binding == null) {
            throw new IllegalArgumentException(type.getName() + " is not bound");
        }
        return (V) binding.getForeignType();
    }

    public List<ClassBinding> getBindings() {
        return Collections.unmodifiableList(new ArrayList<>(bindings.values()));
    }

    public SignatureRegistry getRegistry() {
        return registry;
    }

    public LifetimeManager getLifetimeManager() {
        return lifetime;
    }

    public ValueConverter<V> getConverter() {
        return converter;
    }

    public TypeClassifier getClassifier() {
        return classifier;
    }

    public BridgeOptions getOptions() {
        return options;
    }

    public ForeignRuntime<V> getRuntime() {
        return runtime;
    }
}
