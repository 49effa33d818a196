package com.novalang.bridge.introspect;

import com.novalang.bridge.BridgeOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 结构查询测试
 */
class ReflectiveIntrospectorTest {

    @SuppressWarnings("unused")
    public static class Base {
        public int zeta;
        public int alpha;

        public void baseMethod() {}

        public void shared() {}
    }

    @SuppressWarnings("unused")
    public static class Derived extends Base {
        public String mid;
        public transient String cache;
        public static int COUNT;
        private String secret;
        public final long id = 7;

        public Derived() {}

        public Derived(String mid) {}

        public Derived(int a, int b) {}

        public void zulu() {}

        public void apple() {}

        @Override
        public void shared() {}

        public static Derived create() {
            return new Derived();
        }

        protected void hidden() {}
    }

    private static List<String> names(List<? extends java.lang.reflect.Member> members) {
        return members.stream().map(java.lang.reflect.Member::getName).collect(Collectors.toList());
    }

    @Test
    @DisplayName("字段按声明顺序，父类在前，跳过 static/transient/非公开")
    void fieldsInDeclarationOrder() {
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(BridgeOptions.defaults());
        List<Field> fields = introspector.fieldsOf(Derived.class);
        assertEquals(List.of("zeta", "alpha", "mid", "id"), names(fields));
    }

    @Test
    @DisplayName("宽松选项包含非公开字段")
    void nonPublicFields() {
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(BridgeOptions.permissive());
        assertThat(names(introspector.fieldsOf(Derived.class))).contains("secret");
    }

    @Test
    @DisplayName("不含继承成员")
    void withoutInherited() {
        BridgeOptions options = BridgeOptions.custom().includeInheritedMembers(false).build();
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(options);
        assertEquals(List.of("mid", "id"), names(introspector.fieldsOf(Derived.class)));
        assertEquals(List.of("zulu", "apple", "shared"), names(introspector.methodsOf(Derived.class)));
    }

    @Test
    @DisplayName("方法按声明顺序，重写的方法只出现一次")
    void methodsInDeclarationOrder() {
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(BridgeOptions.defaults());
        List<Method> methods = introspector.methodsOf(Derived.class);
        assertEquals(List.of("baseMethod", "shared", "zulu", "apple"), names(methods));
        assertEquals(Derived.class, methods.get(1).getDeclaringClass());
    }

    @Test
    @DisplayName("排除指定成员")
    void excludedMembers() {
        BridgeOptions options = BridgeOptions.custom()
                .excludeMember(Derived.class.getName(), "alpha")
                .excludeMember(Derived.class.getName(), "zulu")
                .build();
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(options);
        assertThat(names(introspector.fieldsOf(Derived.class))).doesNotContain("alpha");
        assertThat(names(introspector.methodsOf(Derived.class))).doesNotContain("zulu");
    }

    @Test
    void staticMethods() {
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(BridgeOptions.defaults());
        assertEquals(List.of("create"), names(introspector.staticMethodsOf(Derived.class)));
    }

    @Test
    @DisplayName("构造器按声明顺序")
    void constructorsInDeclarationOrder() {
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(BridgeOptions.defaults());
        List<Constructor<?>> ctors = introspector.constructorsOf(Derived.class);
        assertThat(ctors).extracting(Constructor::getParameterCount).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("声明顺序按类缓存")
    void orderIsCached() {
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(BridgeOptions.defaults());
        DeclarationOrder first = introspector.orderOf(Derived.class);
        assertTrue(first.isKnown());
        assertSame(first, introspector.orderOf(Derived.class));
    }
}
