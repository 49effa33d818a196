package com.novalang.bridge.classify;

import com.novalang.bridge.BindingBuildException;
import com.novalang.bridge.introspect.Introspector;
import com.novalang.bridge.introspect.MemberHandles;
import com.novalang.bridge.model.ConstructorDescriptor;
import com.novalang.bridge.model.FieldDescriptor;
import com.novalang.bridge.model.MethodDescriptor;
import com.novalang.bridge.model.PointerKind;
import com.novalang.bridge.model.SequenceKind;
import com.novalang.bridge.model.TypeNames;
import com.novalang.bridge.model.TypeShape;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 类型分类器
 *
 * <p>把字段、参数与返回值的 Java 类型归入六种类别之一，并据此生成成员描述。
 * 分类是全函数且互斥的：无法归类的类型抛出 {@link BindingBuildException}。
 * 结果按 {@link Type} 缓存，只在绑定生成期使用。</p>
 */
public final class TypeClassifier {

    private static final Logger LOG = Logger.getLogger(TypeClassifier.class.getName());

    private static final Set<Class<?>> PRIMITIVES = Set.of(
            boolean.class, byte.class, short.class, int.class, long.class, float.class, double.class, char.class,
            Boolean.class, Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            Character.class);

    private static final Set<Class<?>> TEXT = Set.of(String.class, CharSequence.class, StringBuilder.class);

    private final Introspector introspector;
    private final MemberHandles handles;
    private final Map<Type, TypeShape> shapes = new HashMap<>();

    public TypeClassifier(Introspector introspector, MemberHandles handles) {
        this.introspector = introspector;
        this.handles = handles;
    }

    // ============ 分类 ============

    public TypeShape classify(Type type) {
        TypeShape cached = shapes.get(type);
        if (cached != null) {
            return cached;
        }
        TypeShape shape;
        if (type instanceof Class) {
            shape = classifyClass((Class<?>) type);
        } else if (type instanceof ParameterizedType) {
            shape = classifyParameterized((ParameterizedType) type);
        } else if (type instanceof GenericArrayType) {
            TypeShape element = classify(((GenericArrayType) type).getGenericComponentType());
            Class<?> raw = Array.newInstance(element.getRawType(), 0).getClass();
            shape = TypeShape.sequence(type, raw, SequenceKind.ARRAY, element);
        } else {
            throw new BindingBuildException("Unsupported type " + TypeNames.render(type)
                    + ": type variables and wildcards cannot be bound");
        }
        shapes.put(type, shape);
        return shape;
    }

    private TypeShape classifyClass(Class<?> c) {
        if (c == void.class || c == Void.class) {
            throw new BindingBuildException("void is not a value type");
        }
        if (PRIMITIVES.contains(c)) {
            return TypeShape.primitive(c);
        }
        if (TEXT.contains(c)) {
            return TypeShape.text(c);
        }
        if (c.isEnum()) {
            return TypeShape.enumeration(c);
        }
        if (c.isArray()) {
            return TypeShape.sequence(c, c, SequenceKind.ARRAY, classify(c.getComponentType()));
        }
        if (Iterable.class.isAssignableFrom(c) || PointerKind.forType(c) != null) {
            throw new BindingBuildException("Raw type " + c.getName() + " has no element type");
        }
        if (isRecordCandidate(c)) {
            return classifyRecord(c);
        }
        throw new BindingBuildException("Unsupported type " + c.getName());
    }

    private TypeShape classifyParameterized(ParameterizedType p) {
        Class<?> raw = (Class<?>) p.getRawType();
        Type[] args = p.getActualTypeArguments();
        PointerKind pointerKind = PointerKind.forType(raw);
        if (pointerKind != null) {
            return TypeShape.pointer(p, raw, pointerKind, classify(args[0]));
        }
        if (Collection.class.isAssignableFrom(raw)) {
            SequenceKind kind = SequenceKind.forCollection(raw);
            if (kind == null || args.length != 1) {
                throw new BindingBuildException("Unsupported collection type " + TypeNames.render(p));
            }
            return TypeShape.sequence(p, raw, kind, classify(args[0]));
        }
        throw new BindingBuildException("Unsupported generic type " + TypeNames.render(p));
    }

    /** 具体的、非 JDK 的、带无参构造器的类 */
    private static boolean isRecordCandidate(Class<?> c) {
        if (c.isInterface() || c.isPrimitive() || Modifier.isAbstract(c.getModifiers())) {
            return false;
        }
        String name = c.getName();
        if (name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.")) {
            return false;
        }
        try {
            c.getDeclaredConstructor();
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private TypeShape classifyRecord(Class<?> c) {
        TypeShape shape = TypeShape.record(c);
        // 先登记，自引用字段会解析到同一个形状
        shapes.put(c, shape);
        try {
            List<FieldDescriptor> fields = new ArrayList<>();
            for (Field f : introspector.fieldsOf(c)) {
                fields.add(describeField(c, f));
            }
            for (FieldDescriptor fd : fields) {
                if (fd.isReadOnly() && !fd.canInitialize()) {
                    throw new BindingBuildException(c.getName() + "." + fd.getName()
                            + ": final field cannot be populated from a script value",
                            c, fd.getName(), null);
                }
            }
            MethodHandle factory = handles.factory(c);
            if (factory == null) {
                throw new BindingBuildException("No accessible no-arg constructor in " + c.getName(),
                        c, "<init>", null);
            }
            shape.completeRecord(fields, factory);
            LOG.fine("Classified record " + c.getName() + " with " + fields.size() + " fields");
            return shape;
        } catch (BindingBuildException e) {
            shapes.remove(c);
            throw e;
        }
    }

    // ============ 成员描述 ============

    public FieldDescriptor describeField(Class<?> owner, Field field) {
        TypeShape shape;
        try {
            shape = classify(field.getGenericType());
        } catch (BindingBuildException e) {
            throw BindingBuildException.inMember(owner, field.getName(), e);
        }
        return new FieldDescriptor(field.getName(), shape, field,
                handles.getter(field), handles.setter(field), handles.initializer(field));
    }

    public MethodDescriptor describeMethod(Class<?> owner, Method method) {
        try {
            List<TypeShape> params = classifyAll(method.getGenericParameterTypes());
            Class<?> ret = method.getReturnType();
            TypeShape returnShape = ret == void.class || ret == Void.class
                    ? null
                    : classify(method.getGenericReturnType());
            return new MethodDescriptor(method.getName(), params, returnShape,
                    Modifier.isStatic(method.getModifiers()), method, handles.method(method));
        } catch (BindingBuildException e) {
            throw BindingBuildException.inMember(owner, method.getName(), e);
        }
    }

    public ConstructorDescriptor describeConstructor(Class<?> owner, Constructor<?> constructor) {
        try {
            List<TypeShape> params = classifyAll(constructor.getGenericParameterTypes());
            return new ConstructorDescriptor(params, constructor, handles.constructor(constructor));
        } catch (BindingBuildException e) {
            throw BindingBuildException.inMember(owner, "<init>", e);
        }
    }

    private List<TypeShape> classifyAll(Type[] types) {
        List<TypeShape> shapes = new ArrayList<>(types.length);
        for (Type t : types) {
            shapes.add(classify(t));
        }
        return shapes;
    }
}
