package com.novalang.bridge.nova;

/**
 * Nova Boolean 值
 */
public final class NovaBoolean extends NovaValue {

    public static final NovaBoolean TRUE = new NovaBoolean(true);

    public static final NovaBoolean FALSE = new NovaBoolean(false);

    private final boolean value;

    private NovaBoolean(boolean value) {
        this.value = value;
    }

    public static NovaBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Boolean";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isBoolean() {
        return true;
    }

    @Override
    public boolean asBoolean() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
