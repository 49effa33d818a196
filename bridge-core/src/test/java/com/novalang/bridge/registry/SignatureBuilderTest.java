package com.novalang.bridge.registry;

import com.novalang.bridge.BridgeOptions;
import com.novalang.bridge.classify.TypeClassifier;
import com.novalang.bridge.introspect.MemberHandles;
import com.novalang.bridge.introspect.ReflectiveIntrospector;
import com.novalang.bridge.model.FieldDescriptor;
import com.novalang.bridge.model.MethodDescriptor;
import com.novalang.bridge.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 结构签名测试
 */
class SignatureBuilderTest {

    private final ReflectiveIntrospector introspector = new ReflectiveIntrospector(BridgeOptions.defaults());
    private TypeClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new TypeClassifier(introspector, new MemberHandles(true));
    }

    private List<FieldDescriptor> fields(Class<?> type) {
        List<FieldDescriptor> out = new ArrayList<>();
        for (Field f : introspector.fieldsOf(type)) {
            out.add(classifier.describeField(type, f));
        }
        return out;
    }

    private List<MethodDescriptor> methods(Class<?> type) {
        List<MethodDescriptor> out = new ArrayList<>();
        for (Method m : introspector.methodsOf(type)) {
            out.add(classifier.describeMethod(type, m));
        }
        return out;
    }

    @Test
    void structuralSignature() {
        String sig = SignatureBuilder.build(Fixtures.Point.class, fields(Fixtures.Point.class),
                methods(Fixtures.Point.class), false, null);
        assertEquals("class:Point|members:x:double,y:double|methods:distanceFromOrigin", sig);
    }

    @Test
    void overloadsListedOnceByName() {
        String sig = SignatureBuilder.build(Fixtures.Printer.class, fields(Fixtures.Printer.class),
                methods(Fixtures.Printer.class), false, null);
        assertEquals("class:Printer|members:last:String|methods:print,format", sig);
    }

    @Test
    void typedMethodsAndContentHash() {
        String sig = SignatureBuilder.build(Fixtures.Printer.class, fields(Fixtures.Printer.class),
                methods(Fixtures.Printer.class), true, "abc123");
        assertEquals("hash:abc123|class:Printer|members:last:String"
                + "|methods:print(int),print(double),format(String,String)", sig);
    }

    @Test
    void genericFieldTypesAreRendered() {
        String sig = SignatureBuilder.build(Fixtures.Containers.class, fields(Fixtures.Containers.class),
                List.of(), false, null);
        assertEquals("class:Containers|members:numbers:int[],words:String[],list:List<Integer>,set:Set<String>,"
                + "deque:Deque<Long>,nested:List<List<String>>,maybe:Optional<Integer>|methods:", sig);
    }
}
