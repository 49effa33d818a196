package com.novalang.bridge.bind;

import com.novalang.bridge.BindingBuildException;
import com.novalang.bridge.BridgeOptions;
import com.novalang.bridge.ErrorKind;
import com.novalang.bridge.model.ClassBinding;
import com.novalang.bridge.support.Fixtures.Address;
import com.novalang.bridge.support.Fixtures.Counter;
import com.novalang.bridge.support.Fixtures.Exploding;
import com.novalang.bridge.support.Fixtures.Labeled;
import com.novalang.bridge.support.Fixtures.NameClash;
import com.novalang.bridge.support.Fixtures.Person;
import com.novalang.bridge.support.Fixtures.Point;
import com.novalang.bridge.support.Fixtures.Printer;
import com.novalang.bridge.support.Fixtures.Rectangle;
import com.novalang.bridge.support.Fixtures.Resource;
import com.novalang.bridge.support.JavaObjectRuntime;
import com.novalang.bridge.support.JavaObjectRuntime.TestBridgeError;
import com.novalang.bridge.support.JavaObjectRuntime.TestHandle;
import com.novalang.bridge.support.JavaObjectRuntime.TestType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 绑定生成器端到端测试，脚本值由 {@link JavaObjectRuntime} 模拟。
 */
class BindingGeneratorTest {

    private JavaObjectRuntime runtime;
    private BindingGenerator<Object> generator;

    @BeforeEach
    void setUp() {
        runtime = new JavaObjectRuntime();
        generator = new BindingGenerator<>(runtime);
    }

    private TestType bind(Class<?> type) {
        generator.bind(type);
        return (TestType) generator.typeOf(type);
    }

    private static ErrorKind kindOf(Executable call) {
        return assertThrows(TestBridgeError.class, call).kind;
    }

    /** 包私有类，public 成员需要 setAccessible 才能访问 */
    static class Hidden {
        public int value;

        public Hidden() {
        }

        public int twice() {
            return value * 2;
        }
    }

    @Nested
    @DisplayName("构造与调用")
    class Construction {

        @Test
        @DisplayName("构造后读取属性并调用方法")
        void pointScenario() {
            TestType point = bind(Point.class);
            TestHandle p = point.construct(3.0, 4.0);

            assertEquals(5.0, p.call("distanceFromOrigin"));
            assertEquals(3.0, p.get("x"));

            p.set("x", 6L);
            p.set("y", 8L);
            assertEquals(10.0, p.call("distanceFromOrigin"));
            assertTrue(p.wrapper.owns());
        }

        @Test
        @DisplayName("零实参使用默认构造器")
        void defaultConstructor() {
            TestHandle p = bind(Point.class).construct();
            assertEquals(0.0, p.get("x"));
        }

        @Test
        @DisplayName("同数量构造器按声明顺序取第一个")
        void firstConstructorOfArity() {
            TestType labeled = bind(Labeled.class);

            assertEquals("default", labeled.construct().get("label"));
            assertEquals("x", labeled.construct("x").get("label"));
            assertEquals(2L, labeled.construct("x", 2L).get("count"));

            // 单实参时匹配 Labeled(String)，整数无法转换
            assertEquals(ErrorKind.CONSTRUCTOR_RESOLUTION, kindOf(() -> labeled.construct(1L)));
        }

        @Test
        @DisplayName("没有匹配数量的构造器")
        void noMatchingArity() {
            TestType rect = bind(Rectangle.class);
            assertEquals(ErrorKind.CONSTRUCTOR_RESOLUTION, kindOf(() -> rect.construct(1.0)));
            assertEquals(ErrorKind.CONSTRUCTOR_RESOLUTION, kindOf(() -> rect.construct()));

            TestHandle r = rect.construct(2.0, 3.0);
            assertEquals(6.0, r.call("area"));
            assertEquals(0, generator.getLifetimeManager().finalizedCount());
        }

        @Test
        @DisplayName("void 方法返回缺省值")
        void voidReturnsAbsent() {
            TestHandle c = bind(Counter.class).construct();
            assertSame(JavaObjectRuntime.ABSENT, c.call("increment"));
            assertEquals(1L, c.get("value"));
            assertEquals(4L, c.call("add", 3L));
        }

        @Test
        @DisplayName("包私有类的 public 成员")
        void packagePrivateClass() {
            TestHandle h = bind(Hidden.class).construct();
            h.set("value", 21L);
            assertEquals(21L, h.get("value"));
            assertEquals(42L, h.call("twice"));
        }

        @Test
        @DisplayName("原生构造器失败时不登记包装")
        void constructorFailureLeavesNoWrapper() {
            TestType exploding = bind(Exploding.class);
            long before = generator.getLifetimeManager().constructedCount();

            TestBridgeError e = assertThrows(TestBridgeError.class, () -> exploding.construct(7L));
            assertEquals(ErrorKind.NATIVE_FAILURE, e.kind);
            assertThat(e.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("bad 7");
            assertEquals(before, generator.getLifetimeManager().constructedCount());
        }

        @Test
        @DisplayName("静态方法")
        void staticMethods() {
            TestType counter = bind(Counter.class);
            assertEquals(42L, counter.callStatic("twice", 21L));

            Object copy = counter.callStatic("startingAt", 5L);
            assertThat(copy).isInstanceOf(Map.class);
            assertEquals(5L, ((Map<?, ?>) copy).get("value"));
            assertThat(counter.methods).doesNotContainKey("twice");
        }
    }

    @Nested
    @DisplayName("重载")
    class Overloads {

        @Test
        @DisplayName("重载以类型后缀区分")
        void suffixedNames() {
            TestType printer = bind(Printer.class);
            assertThat(printer.methods).containsOnlyKeys("print_int", "print_double", "format");

            TestHandle p = printer.construct();
            p.call("print_int", 7L);
            assertEquals("int:7", p.get("last"));
            p.call("print_double", 2.5);
            assertEquals("double:2.5", p.get("last"));
            assertEquals("a-b", p.call("format", "a-{}", "b"));
        }

        @Test
        @DisplayName("类型不符的实参")
        void conversionError() {
            TestHandle p = bind(Printer.class).construct();
            TestBridgeError e = assertThrows(TestBridgeError.class, () -> p.call("print_double", "x"));
            assertEquals(ErrorKind.CONVERSION, e.kind);
            assertThat(e.getMessage()).contains("Printer.print_double").contains("argument 1");
            assertNull(p.get("last"));
        }

        @Test
        @DisplayName("超出 int 范围")
        void outOfRange() {
            TestHandle p = bind(Printer.class).construct();
            assertEquals(ErrorKind.CONVERSION, kindOf(() -> p.call("print_int", 1L << 40)));
        }

        @Test
        @DisplayName("改写名与字段冲突时构建失败")
        void nameClash() {
            BindingBuildException e = assertThrows(BindingBuildException.class, () -> generator.bind(NameClash.class));
            assertEquals("size", e.getMember());
            assertNull(generator.getBinding(NameClash.class));
        }
    }

    @Nested
    @DisplayName("调用期错误")
    class Errors {

        @Test
        @DisplayName("数量检查先于任何参数转换")
        void arityBeforeConversion() {
            TestHandle c = bind(Counter.class).construct();
            int before = runtime.nullChecks();

            TestBridgeError e = assertThrows(TestBridgeError.class, () -> c.call("add"));
            assertEquals(ErrorKind.ARITY, e.kind);
            assertThat(e.getMessage()).contains("expects 1 argument(s) but got 0");
            assertEquals(before, runtime.nullChecks());

            assertEquals(ErrorKind.ARITY, kindOf(() -> c.call("add", "a", "b")));
            assertEquals(before, runtime.nullChecks());
            assertEquals(0L, c.get("value"));
        }

        @Test
        @DisplayName("原生异常")
        void nativeFailure() {
            TestHandle c = bind(Counter.class).construct();
            TestBridgeError e = assertThrows(TestBridgeError.class, () -> c.call("fail"));
            assertEquals(ErrorKind.NATIVE_FAILURE, e.kind);
            assertThat(e.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        }

        @Test
        @DisplayName("final 字段只读")
        void readOnly() {
            TestHandle r = bind(Rectangle.class).construct(2.0, 3.0);
            assertEquals(2.0, r.get("width"));
            assertEquals(ErrorKind.READ_ONLY, kindOf(() -> r.set("width", 1.0)));
            assertTrue(r.type.properties.get("width").isReadOnly());
        }

        @Test
        @DisplayName("回收后的对象失效")
        void invalidAfterCollect() {
            TestHandle p = bind(Point.class).construct(1.0, 2.0);
            generator.getLifetimeManager().collectNow(p.wrapper);

            assertEquals(ErrorKind.INVALID_OBJECT, kindOf(() -> p.get("x")));
            assertEquals(ErrorKind.INVALID_OBJECT, kindOf(() -> p.set("x", 1.0)));
            assertEquals(ErrorKind.INVALID_OBJECT, kindOf(() -> p.call("distanceFromOrigin")));
        }

        @Test
        @DisplayName("回收时关闭拥有的资源")
        void ownedResourceClosed() {
            TestHandle handle = bind(Resource.class).construct();
            Resource resource = (Resource) handle.wrapper.get();
            generator.getLifetimeManager().collectNow(handle.wrapper);
            assertTrue(resource.closed);
        }
    }

    @Nested
    @DisplayName("嵌套记录")
    class Records {

        @Test
        @DisplayName("记录字段按值复制")
        void nestedRecordCopied() {
            TestHandle person = bind(Person.class).construct();
            Map<String, Object> address = new LinkedHashMap<>();
            address.put("street", "Main");
            address.put("zip", 12345L);
            person.set("address", address);

            Person p = (Person) person.wrapper.get();
            assertEquals("Main", p.address.street);
            assertEquals(12345, p.address.zip);

            Object read = person.get("address");
            assertEquals(address, read);
            assertNotSame(address, read);

            person.set("tags", List.of("a", "b"));
            assertEquals(List.of("a", "b"), p.tags);
            assertEquals(List.of("a", "b"), person.get("tags"));
        }

        @Test
        @DisplayName("可选与共享引用")
        void pointers() {
            TestHandle person = bind(Person.class).construct();
            Person p = (Person) person.wrapper.get();

            assertSame(JavaObjectRuntime.NULL, person.get("nickname"));
            person.set("nickname", "bob");
            assertEquals("bob", p.nickname.get());

            person.set("previous", JavaObjectRuntime.NULL);
            assertFalse(p.previous.isPresent());
        }

        @Test
        @DisplayName("缺少记录字段")
        void missingMember() {
            TestHandle person = bind(Person.class).construct();
            Map<String, Object> address = new LinkedHashMap<>();
            address.put("street", "Main");
            TestBridgeError e = assertThrows(TestBridgeError.class, () -> person.set("address", address));
            assertEquals(ErrorKind.CONVERSION, e.kind);
            assertThat(e.getMessage()).contains("zip");
        }
    }

    @Nested
    @DisplayName("注册与导出")
    class Registration {

        @Test
        @DisplayName("绑定时登记签名")
        void signatureRegistered() {
            ClassBinding binding = generator.bind(Point.class);
            assertTrue(binding.isRegistered());
            assertEquals("class:Point|members:x:double,y:double|methods:distanceFromOrigin",
                    generator.getRegistry().get("Point").getSignature());
            assertSame(generator.typeOf(Point.class), generator.getRegistry().get("Point").getForeignHandle());
        }

        @Test
        @DisplayName("重复绑定返回原有绑定")
        void bindOnce() {
            ClassBinding first = generator.bind(Point.class);
            assertSame(first, generator.bind("Other", Point.class));
            assertEquals(1, generator.getBindings().size());
        }

        @Test
        @DisplayName("模块导出")
        void moduleExport() {
            Map<String, Object> module = new LinkedHashMap<>();
            BridgeModule geometry = BridgeModule.builder("geometry")
                    .bind(Point.class)
                    .bind("Rect", Rectangle.class)
                    .build();
            geometry.registerInto(generator, module);

            assertThat(module).containsOnlyKeys("Point", "Rect");
            assertSame(generator.typeOf(Rectangle.class), module.get("Rect"));
            assertTrue(generator.getRegistry().isRegistered("Rect"));
        }

        @Test
        @DisplayName("模块内重名")
        void duplicateModuleName() {
            BridgeModule.Builder builder = BridgeModule.builder("m").bind("P", Point.class);
            assertThrows(IllegalArgumentException.class, () -> builder.bind("P", Address.class));
        }

        @Test
        @DisplayName("包装宿主对象不转移所有权")
        void wrapHostObject() {
            bind(Point.class);
            Point host = new Point(1, 2);
            TestHandle handle = (TestHandle) generator.wrap(host);

            assertFalse(handle.wrapper.owns());
            handle.set("x", 9.0);
            assertEquals(9.0, host.x);
            assertThrows(IllegalArgumentException.class, () -> generator.wrap("not bound"));
        }

        @Test
        @DisplayName("不可绑定的类")
        void notConcrete() {
            assertThrows(BindingBuildException.class, () -> generator.bind(Runnable.class));
            assertThrows(BindingBuildException.class, () -> generator.bind(java.util.AbstractList.class));
        }

        @Test
        @DisplayName("严格模式要求默认构造器")
        void strictRequiresDefaultConstructor() {
            BindingGenerator<Object> strict = new BindingGenerator<>(runtime, BridgeOptions.strict());
            assertThrows(BindingBuildException.class, () -> strict.bind(Rectangle.class));

            ClassBinding point = strict.bind(Point.class);
            assertThat(point.getSignature()).startsWith("hash:").contains("methods:distanceFromOrigin()");
        }
    }
}
