package com.novalang.bridge.bind;

import com.novalang.bridge.BridgeOptions;
import com.novalang.bridge.classify.TypeClassifier;
import com.novalang.bridge.introspect.MemberHandles;
import com.novalang.bridge.introspect.ReflectiveIntrospector;
import com.novalang.bridge.model.MethodDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 重载命名测试
 */
class TypeSuffixNamingTest {

    @SuppressWarnings("unused")
    public static class Overloads {
        public void print(int value) {}
        public void print(double value) {}
        public void print(String a, String b) {}
        public void print(List<String> lines) {}
        public void print(int[] values) {}
        public void single(long value) {}
    }

    private TypeClassifier classifier;

    @BeforeEach
    void setUp() {
        BridgeOptions options = BridgeOptions.defaults();
        classifier = new TypeClassifier(new ReflectiveIntrospector(options), new MemberHandles(true));
    }

    private List<MethodDescriptor> group(String name) {
        List<MethodDescriptor> methods = new ArrayList<>();
        ReflectiveIntrospector introspector = new ReflectiveIntrospector(BridgeOptions.defaults());
        for (java.lang.reflect.Method m : introspector.methodsOf(Overloads.class)) {
            if (m.getName().equals(name)) {
                methods.add(classifier.describeMethod(Overloads.class, m));
            }
        }
        return methods;
    }

    @Test
    @DisplayName("重载组内按参数类型追加后缀")
    void mangledOverloads() {
        List<String> names = TypeSuffixNaming.INSTANCE.assignNames("print", group("print"));
        assertThat(names).containsExactly(
                "print_int", "print_double", "print_String_String", "print_List_String", "print_intArray");
    }

    @Test
    @DisplayName("唯一方法保留原名")
    void singleMemberKeepsName() {
        assertThat(TypeSuffixNaming.INSTANCE.assignNames("single", group("single"))).containsExactly("single");
    }

    @Test
    @DisplayName("多次生成结果一致")
    void deterministic() {
        List<String> first = TypeSuffixNaming.INSTANCE.assignNames("print", group("print"));
        setUp();
        List<String> second = TypeSuffixNaming.INSTANCE.assignNames("print", group("print"));
        assertEquals(first, second);
        assertEquals(first.size(), first.stream().distinct().count());
    }
}
