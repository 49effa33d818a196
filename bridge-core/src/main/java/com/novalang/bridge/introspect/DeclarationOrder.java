package com.novalang.bridge.introspect;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

/**
 * 一个类文件中字段与方法的声明顺序。
 *
 * <p>反射 API 不保证返回顺序，而类文件中成员按源码顺序排列，因此用 ASM 读取一次并按
 * 名称（方法再加描述符）记录下标。类文件不可用时使用 {@link #UNKNOWN}，
 * 所有成员下标相同，调用方退回到按名称排序。</p>
 */
public final class DeclarationOrder {

    public static final DeclarationOrder UNKNOWN = new DeclarationOrder(new HashMap<>(), new HashMap<>());

    private final Map<String, Integer> fields;
    private final Map<String, Integer> methods;   // name + descriptor

    private DeclarationOrder(Map<String, Integer> fields, Map<String, Integer> methods) {
        this.fields = fields;
        this.methods = methods;
    }

    public static DeclarationOrder read(byte[] bytecode) {
        Map<String, Integer> fields = new HashMap<>();
        Map<String, Integer> methods = new HashMap<>();
        ClassReader reader = new ClassReader(bytecode);
        reader.accept(new ClassVisitor(Opcodes.ASM9) {
            @Override
            public FieldVisitor visitField(int access, String name, String descriptor,
                                           String signature, Object value) {
                fields.putIfAbsent(name, fields.size());
                return null;
            }

            @Override
            public MethodVisitor visitMethod(int access, String name, String descriptor,
                                             String signature, String[] exceptions) {
                methods.putIfAbsent(name + descriptor, methods.size());
                return null;
            }
        }, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        return new DeclarationOrder(fields, methods);
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public int indexOf(Field field) {
        return fields.getOrDefault(field.getName(), Integer.MAX_VALUE);
    }

    public int indexOf(Method method) {
        return methods.getOrDefault(method.getName() + Type.getMethodDescriptor(method), Integer.MAX_VALUE);
    }

    public int indexOf(Constructor<?> constructor) {
        return methods.getOrDefault("<init>" + Type.getConstructorDescriptor(constructor), Integer.MAX_VALUE);
    }
}
