package com.novalang.bridge.nova;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Nova 值模型")
class NovaValueTest {

    @Test
    @DisplayName("Int 与 Long 按数值相等")
    void integerEquality() {
        assertEquals(NovaInt.of(5), NovaLong.of(5));
        assertNotEquals(NovaInt.of(5), NovaDouble.of(5.0));
        assertSame(NovaInt.of(100), NovaInt.of(100));
    }

    @Test
    @DisplayName("null 与 Unit")
    void nullAndUnit() {
        assertTrue(NovaNull.NULL.isNull());
        assertTrue(NovaNull.UNIT.isNull());
        assertTrue(NovaNull.UNIT.isUnit());
        assertFalse(NovaNull.NULL.isUnit());
        assertNotEquals(NovaNull.NULL, NovaNull.UNIT);
    }

    @Test
    @DisplayName("字符串不接受 null")
    void stringRejectsNull() {
        assertThrows(NovaException.class, () -> NovaString.of(null));
    }

    @Test
    @DisplayName("列表元素视图只读")
    void listView() {
        NovaList list = NovaList.of(NovaInt.of(1), NovaInt.of(2));
        assertThrows(UnsupportedOperationException.class, () -> list.getElements().add(NovaInt.of(3)));
        assertEquals(List.of(NovaInt.of(1), NovaInt.of(2)), list.getElements());
        assertEquals(List.of(1, 2), list.toJavaValue());
        assertEquals("[1, 2]", list.toString());
    }

    @Test
    @DisplayName("映射以字符串为键并保持插入顺序")
    void mapKeys() {
        NovaMap map = new NovaMap();
        map.put("street", NovaString.of("Main"));
        map.put("zip", NovaInt.of(1));
        assertTrue(map.containsKey("street"));
        assertFalse(map.containsKey("city"));
        assertEquals(NovaString.of("Main"), map.get("street"));

        Map<Object, Object> expected = new LinkedHashMap<>();
        expected.put("street", "Main");
        expected.put("zip", 1);
        assertEquals(expected, map.toJavaValue());
        assertEquals(List.of("street", "zip"), List.copyOf(((Map<?, ?>) map.toJavaValue()).keySet()));
    }

    @Test
    @DisplayName("类型转换失败")
    void badConversion() {
        assertThrows(NovaException.class, () -> NovaString.of("x").asLong());
        assertThrows(NovaException.class, () -> NovaInt.of(1).asBoolean());
        assertEquals(3.0, NovaInt.of(3).asDouble());
    }
}
