package com.novalang.bridge.nova;

/**
 * Nova Long 值（64位整数）
 */
public final class NovaLong extends NovaValue {

    private final long value;

    private NovaLong(long value) {
        this.value = value;
    }

    public static NovaLong of(long value) {
        return new NovaLong(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Long";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public boolean isInteger() {
        return true;
    }

    @Override
    public long asLong() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public boolean equals(NovaValue other) {
        if (other instanceof NovaLong) return ((NovaLong) other).value == value;
        if (other instanceof NovaInt) return ((NovaInt) other).getValue() == value;
        return false;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return value + "L";
    }
}
