package com.novalang.bridge.nova;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Nova List 值
 */
public final class NovaList extends NovaValue {

    private final List<NovaValue> elements;

    public NovaList(List<NovaValue> values) {
        this.elements = new ArrayList<>(values);
    }

    public static NovaList of(NovaValue... values) {
        return new NovaList(Arrays.asList(values));
    }

    /** 只读视图 */
    public List<NovaValue> getElements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public String getTypeName() {
        return "List";
    }

    @Override
    public Object toJavaValue() {
        List<Object> result = new ArrayList<>(elements.size());
        for (NovaValue v : elements) {
            result.add(v.toJavaValue());
        }
        return result;
    }

    @Override
    public boolean isList() {
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return sb.append(']').toString();
    }

    @Override
    public boolean equals(NovaValue other) {
        if (!(other instanceof NovaList)) return false;
        return elements.equals(((NovaList) other).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
