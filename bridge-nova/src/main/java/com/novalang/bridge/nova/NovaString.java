package com.novalang.bridge.nova;

/**
 * Nova String 值
 */
public final class NovaString extends NovaValue {

    private static final NovaString EMPTY = new NovaString("");

    private final String value;

    private NovaString(String value) {
        this.value = value;
    }

    public static NovaString of(String value) {
        if (value == null) {
            throw new NovaException("String value must not be null");
        }
        return value.isEmpty() ? EMPTY : new NovaString(value);
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
