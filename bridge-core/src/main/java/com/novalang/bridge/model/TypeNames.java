package com.novalang.bridge.model;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;

/**
 * 类型名简化渲染。
 *
 * <p>{@link #render} 去掉包名与外部类名，保留泛型实参，例如
 * {@code java.util.List<java.util.Map<java.lang.String, java.lang.Integer>>}
 * 渲染为 {@code List<Map<String,Integer>>}。</p>
 *
 * <p>{@link #token} 在此基础上得到可用作标识符片段的记号：{@code []} 变为 {@code Array}，
 * {@code <} 与 {@code ,} 变为下划线，{@code >} 去掉。同一组参数类型总是得到同一记号。</p>
 */
public final class TypeNames {

    private TypeNames() {}

    public static String render(Type type) {
        StringBuilder sb = new StringBuilder();
        render(type, sb);
        return sb.toString();
    }

    private static void render(Type type, StringBuilder sb) {
        if (type instanceof Class) {
            Class<?> c = (Class<?>) type;
            if (c.isArray()) {
                render(c.getComponentType(), sb);
                sb.append("[]");
            } else {
                sb.append(c.getSimpleName());
            }
        } else if (type instanceof ParameterizedType) {
            ParameterizedType p = (ParameterizedType) type;
            render(p.getRawType(), sb);
            sb.append('<');
            Type[] args = p.getActualTypeArguments();
            for (int i = 0; i < args.length; i++) {
                if (i > 0) sb.append(',');
                render(args[i], sb);
            }
            sb.append('>');
        } else if (type instanceof GenericArrayType) {
            render(((GenericArrayType) type).getGenericComponentType(), sb);
            sb.append("[]");
        } else if (type instanceof TypeVariable) {
            sb.append(((TypeVariable<?>) type).getName());
        } else if (type instanceof WildcardType) {
            sb.append('?');
        } else {
            sb.append(type.getTypeName());
        }
    }

    public static String token(Type type) {
        String rendered = render(type);
        StringBuilder sb = new StringBuilder(rendered.length());
        for (int i = 0; i < rendered.length(); i++) {
            char ch = rendered.charAt(i);
            switch (ch) {
                case '[':
                    sb.append("Array");
                    i++; // 跳过 ']'
                    break;
                case '<':
                case ',':
                    sb.append('_');
                    break;
                case '>':
                case ' ':
                    break;
                case '?':
                    sb.append("Any");
                    break;
                default:
                    sb.append(ch);
            }
        }
        return sb.toString();
    }
}
