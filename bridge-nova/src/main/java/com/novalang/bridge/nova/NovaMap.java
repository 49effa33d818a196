package com.novalang.bridge.nova;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nova Map 值（有序映射）
 */
public final class NovaMap extends NovaValue {

    private final Map<NovaValue, NovaValue> entries;

    public NovaMap() {
        this.entries = new LinkedHashMap<>();
    }

    @Override
    public String getTypeName() {
        return "Map";
    }

    @Override
    public Object toJavaValue() {
        Map<Object, Object> result = new LinkedHashMap<>();
        for (Map.Entry<NovaValue, NovaValue> entry : entries.entrySet()) {
            result.put(entry.getKey().toJavaValue(), entry.getValue().toJavaValue());
        }
        return result;
    }

    @Override
    public boolean isMap() {
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<NovaValue, NovaValue> entry : entries.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            NovaValue key = entry.getKey();
            NovaValue value = entry.getValue();
            sb.append(key.isString() ? "\"" + key.asString() + "\"" : key.toString());
            sb.append(": ");
            sb.append(value.isString() ? "\"" + value.asString() + "\"" : value.toString());
        }
        return sb.append('}').toString();
    }

    @Override
    public boolean equals(NovaValue other) {
        if (!(other instanceof NovaMap)) return false;
        return entries.equals(((NovaMap) other).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    // ============ 映射操作 ============

    public int size() {
        return entries.size();
    }

    public NovaValue get(String key) {
        return entries.get(NovaString.of(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(NovaString.of(key));
    }

    public void put(String key, NovaValue value) {
        entries.put(NovaString.of(key), value);
    }
}
